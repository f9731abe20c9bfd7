package cafe.woden.ircroster.irc;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * ISUPPORT values that shape membership tracking, as negotiated for one connection.
 *
 * <p>Blank values mean "not advertised"; the receiving session keeps its current setting for those.
 *
 * @param prefix {@code PREFIX}, e.g. {@code (qaohv)~&@%+}
 * @param casemapping {@code CASEMAPPING} token, e.g. {@code rfc1459}
 * @param chanTypes {@code CHANTYPES}, e.g. {@code #&}
 * @param chanModes {@code CHANMODES}, e.g. {@code beI,k,l,imnpst}
 */
@ValueObject
public record ServerSupport(String prefix, String casemapping, String chanTypes, String chanModes) {

  public ServerSupport {
    prefix = norm(prefix);
    casemapping = norm(casemapping);
    chanTypes = norm(chanTypes);
    chanModes = norm(chanModes);
  }

  public static ServerSupport of(String prefix, String casemapping) {
    return new ServerSupport(prefix, casemapping, "", "");
  }

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }
}
