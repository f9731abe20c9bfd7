package cafe.woden.ircroster.irc;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One decoded protocol line, as handed over by the line tokenizer.
 *
 * <p>{@code targetChannel} is filled in by the decoder when the command addresses a channel and
 * may be empty otherwise. {@code params} are the command parameters in wire order, trailing
 * parameter included. Nulls normalize to empty values.
 */
@ValueObject
public record InboundMessage(
    Instant at,
    String command,
    String sourceNick,
    String sourceUser,
    String sourceHost,
    String targetChannel,
    List<String> params) {

  public InboundMessage {
    at = at == null ? Instant.now() : at;
    command = Objects.toString(command, "").trim().toUpperCase(Locale.ROOT);
    sourceNick = norm(sourceNick);
    sourceUser = norm(sourceUser);
    sourceHost = norm(sourceHost);
    targetChannel = norm(targetChannel);
    params = params == null ? List.of() : params.stream().map(InboundMessage::norm).toList();
  }

  /** Convenience for tests and decoders that already split the {@code nick!user@host} prefix. */
  public static InboundMessage of(String command, String source, String targetChannel, String... params) {
    String s = norm(source);
    String nick = s;
    String user = "";
    String host = "";
    int bang = s.indexOf('!');
    int at = s.indexOf('@');
    if (bang > 0 && at > bang) {
      nick = s.substring(0, bang);
      user = s.substring(bang + 1, at);
      host = s.substring(at + 1);
    } else if (at > 0 && bang < 0) {
      nick = s.substring(0, at);
      host = s.substring(at + 1);
    }
    return new InboundMessage(
        Instant.now(), command, nick, user, host, targetChannel, params == null ? List.of() : Arrays.asList(params));
  }

  /** Parameter {@code i}, or empty if absent. */
  public String param(int i) {
    return (i >= 0 && i < params.size()) ? params.get(i) : "";
  }

  public boolean isNumeric() {
    return command.length() == 3
        && Character.isDigit(command.charAt(0))
        && Character.isDigit(command.charAt(1))
        && Character.isDigit(command.charAt(2));
  }

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }
}
