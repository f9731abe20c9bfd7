package cafe.woden.ircroster.model;

/**
 * Best-effort away status for a user.
 *
 * <p>Most networks do not provide away state in NAMES. It is learned later from WHO flags or
 * IRCv3 {@code away-notify}; until then it stays {@link #UNKNOWN}.
 */
public enum AwayState {
  UNKNOWN,
  HERE,
  AWAY
}
