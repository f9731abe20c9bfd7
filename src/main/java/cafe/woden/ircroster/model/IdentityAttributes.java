package cafe.woden.ircroster.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Optional user details observed alongside a nickname (prefix, WHO, WHOIS, userhost-in-names).
 *
 * <p>Missing values are normalized to the empty string; {@code *} placeholders sent by some
 * servers count as missing.
 */
@ValueObject
public record IdentityAttributes(String user, String host, String realName, String info) {

  public static final IdentityAttributes EMPTY = new IdentityAttributes("", "", "", "");

  public IdentityAttributes {
    user = clean(user);
    host = clean(host);
    realName = Objects.toString(realName, "").trim();
    info = Objects.toString(info, "").trim();
  }

  public static IdentityAttributes ofUserHost(String user, String host) {
    return new IdentityAttributes(user, host, "", "");
  }

  public boolean isEmpty() {
    return user.isEmpty() && host.isEmpty() && realName.isEmpty() && info.isEmpty();
  }

  private static String clean(String s) {
    String v = Objects.toString(s, "").trim();
    return "*".equals(v) ? "" : v;
  }
}
