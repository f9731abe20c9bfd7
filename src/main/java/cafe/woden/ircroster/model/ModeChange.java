package cafe.woden.ircroster.model;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One argument-taking mode letter from a MODE line.
 *
 * <p>{@code argument} is {@code null} when the letter takes no argument in this polarity (e.g.
 * {@code -l}) or when the MODE line ran out of arguments.
 */
@ValueObject
public record ModeChange(char letter, Polarity polarity, String argument) {

  public enum Polarity {
    ADD,
    REMOVE
  }

  public boolean adding() {
    return polarity == Polarity.ADD;
  }

  public boolean hasArgument() {
    return argument != null && !argument.isEmpty();
  }

  static ModeChange of(char letter, boolean adding, String argument) {
    return new ModeChange(letter, adding ? Polarity.ADD : Polarity.REMOVE, argument);
  }
}
