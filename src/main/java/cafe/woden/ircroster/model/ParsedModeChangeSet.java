package cafe.woden.ircroster.model;

import java.util.List;

/**
 * Structured form of one MODE line.
 *
 * @param added argument-less letters being set, in encounter order
 * @param removed argument-less letters being cleared, in encounter order
 * @param argumentChanges argument-taking letters, in encounter order
 */
public record ParsedModeChangeSet(
    List<Character> added, List<Character> removed, List<ModeChange> argumentChanges) {

  public static final ParsedModeChangeSet EMPTY = new ParsedModeChangeSet(List.of(), List.of(), List.of());

  public ParsedModeChangeSet {
    added = added == null ? List.of() : List.copyOf(added);
    removed = removed == null ? List.of() : List.copyOf(removed);
    argumentChanges = argumentChanges == null ? List.of() : List.copyOf(argumentChanges);
  }

  public boolean isEmpty() {
    return added.isEmpty() && removed.isEmpty() && argumentChanges.isEmpty();
  }
}
