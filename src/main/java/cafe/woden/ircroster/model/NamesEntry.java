package cafe.woden.ircroster.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One decoded NAMES token such as {@code @+alice} or {@code @alice!ali@example.org}.
 *
 * <p>Leading characters that cannot start a nickname are read as rank glyphs; glyphs the
 * {@link PrefixTable} does not know count as voice.
 */
public record NamesEntry(String nick, Set<RankSymbol> ranks, String user, String host) {

  private static final String NICK_SPECIALS = "[]\\`_^{|}";

  public NamesEntry {
    nick = Objects.toString(nick, "");
    ranks = ranks == null ? Set.of() : Set.copyOf(ranks);
    user = Objects.toString(user, "");
    host = Objects.toString(host, "");
  }

  public IdentityAttributes attributes() {
    return IdentityAttributes.ofUserHost(user, host);
  }

  /** Decodes {@code raw}; returns {@code null} when no nickname remains after the glyphs. */
  public static NamesEntry parse(String raw, PrefixTable prefixes) {
    String s = Objects.toString(raw, "").trim();
    if (s.isEmpty()) return null;
    PrefixTable table = prefixes == null ? PrefixTable.DEFAULT : prefixes;

    EnumSet<RankSymbol> ranks = EnumSet.noneOf(RankSymbol.class);
    int i = 0;
    while (i < s.length()) {
      char c = s.charAt(i);
      RankSymbol rank = table.rankOfGlyph(c);
      if (rank == null) {
        if (canStartNick(c)) break;
        rank = RankSymbol.VOICE;
      }
      ranks.add(rank);
      i++;
    }

    String rest = s.substring(i);
    String user = "";
    String host = "";
    int bang = rest.indexOf('!');
    int at = rest.indexOf('@', Math.max(bang, 0));
    if (bang > 0 && at > bang) {
      user = rest.substring(bang + 1, at);
      host = rest.substring(at + 1);
      rest = rest.substring(0, bang);
    } else if (bang > 0) {
      rest = rest.substring(0, bang);
    }
    if (rest.isEmpty()) return null;
    return new NamesEntry(rest, ranks, user, host);
  }

  static boolean canStartNick(char c) {
    return Character.isLetterOrDigit(c) || NICK_SPECIALS.indexOf(c) >= 0;
  }
}
