package cafe.woden.ircroster.config;

import cafe.woden.ircroster.model.CaseFoldVariant;
import cafe.woden.ircroster.model.ChannelModeTypes;
import cafe.woden.ircroster.model.PrefixTable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Membership tracking defaults, used until a connection negotiates its own ISUPPORT values.
 *
 * <p>Example YAML:
 * <pre>
 * irc:
 *   roster:
 *     casemapping: rfc1459
 *     prefix: "(qaohv)~&amp;@%+"
 *     chan-types: "#&amp;"
 *     chan-modes: "beI,k,l,imnpst"
 * </pre>
 */
@ConfigurationProperties(prefix = "irc.roster")
public record RosterProperties(String casemapping, String prefix, String chanTypes, String chanModes) {

  public RosterProperties {
    if (casemapping == null || casemapping.isBlank()) {
      casemapping = CaseFoldVariant.RFC1459.token();
    }
    if (prefix == null || prefix.isBlank()) {
      prefix = PrefixTable.DEFAULT_PREFIX;
    }
    if (chanTypes == null || chanTypes.isBlank()) {
      chanTypes = "#&";
    }
    if (chanModes == null || chanModes.isBlank()) {
      chanModes = ChannelModeTypes.DEFAULT_CHANMODES;
    }
    casemapping = casemapping.trim();
    prefix = prefix.trim();
    chanTypes = chanTypes.trim();
    chanModes = chanModes.trim();
  }

  public static RosterProperties defaults() {
    return new RosterProperties(null, null, null, null);
  }

  public CaseFoldVariant caseFoldVariant() {
    return CaseFoldVariant.fromToken(casemapping);
  }

  public PrefixTable prefixTable() {
    return PrefixTable.parse(prefix);
  }

  public ChannelModeTypes channelModeTypes() {
    return ChannelModeTypes.parse(chanModes);
  }
}
