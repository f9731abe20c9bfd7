package cafe.woden.ircroster.model;

/**
 * Thrown when an operation requires an identity the registry has never seen.
 *
 * <p>This means the caller is out of sync with the protocol stream; it is not a benign race.
 */
public class UnknownIdentityException extends IllegalStateException {

  private final String nick;

  public UnknownIdentityException(String nick) {
    super("unknown nickname: " + nick);
    this.nick = nick;
  }

  public String nick() {
    return nick;
  }
}
