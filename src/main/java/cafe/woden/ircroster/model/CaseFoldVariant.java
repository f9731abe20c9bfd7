package cafe.woden.ircroster.model;

import java.util.Locale;
import java.util.Objects;

/**
 * IRC casemapping rules used to decide whether two nicknames (or channel names) are the same.
 *
 * <p>All variants lowercase ASCII letters. {@link #RFC1459} additionally treats {@code {}|~} as
 * the lowercase forms of {@code []\^}; {@link #RFC1459_STRICT} does the same except for the
 * {@code ~}/{@code ^} pair.
 */
public enum CaseFoldVariant {
  ASCII("ascii"),
  RFC1459("rfc1459"),
  RFC1459_STRICT("strict-rfc1459");

  private final String token;

  CaseFoldVariant(String token) {
    this.token = token;
  }

  /** The ISUPPORT {@code CASEMAPPING} token for this variant. */
  public String token() {
    return token;
  }

  /**
   * Maps an ISUPPORT {@code CASEMAPPING} token to a variant.
   *
   * <p>Unrecognized or missing tokens fall back to {@link #RFC1459}.
   */
  public static CaseFoldVariant fromToken(String token) {
    String t = Objects.toString(token, "").trim().toLowerCase(Locale.ROOT);
    return switch (t) {
      case "ascii" -> ASCII;
      case "strict-rfc1459", "rfc1459-strict" -> RFC1459_STRICT;
      default -> RFC1459;
    };
  }

  char foldChar(char c) {
    if (c >= 'A' && c <= 'Z') return (char) (c + ('a' - 'A'));
    if (this == ASCII) return c;
    switch (c) {
      case '{':
        return '[';
      case '}':
        return ']';
      case '|':
        return '\\';
      case '~':
        return this == RFC1459 ? '^' : c;
      default:
        return c;
    }
  }
}
