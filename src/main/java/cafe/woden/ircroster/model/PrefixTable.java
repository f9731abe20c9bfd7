package cafe.woden.ircroster.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pairs membership mode letters with rank glyphs, as advertised by ISUPPORT {@code PREFIX}.
 *
 * <p>A {@code PREFIX} value looks like {@code (qaohv)~&@%+}. Missing or malformed values fall back
 * to {@link #DEFAULT}. Letters the table carries but that are not one of the five standard ranks
 * are mapped by their glyph, and failing that treated as voice-equivalent, so nonstandard networks
 * still produce a usable roster.
 */
public final class PrefixTable {

  public static final String DEFAULT_PREFIX = "(qaohv)~&@%+";

  public static final PrefixTable DEFAULT = new PrefixTable(DEFAULT_PREFIX, defaultEntries());

  /** One positional letter/glyph pair and the rank it grants. */
  public record Entry(char letter, char glyph, RankSymbol rank) {}

  private final String source;
  private final List<Entry> entries;

  private PrefixTable(String source, List<Entry> entries) {
    this.source = source;
    this.entries = Collections.unmodifiableList(entries);
  }

  /**
   * Builds a table from an ISUPPORT {@code PREFIX} value.
   *
   * <p>Returns {@link #DEFAULT} when the value is the default, absent, empty, missing its
   * parentheses, or has a different number of letters and glyphs.
   */
  public static PrefixTable parse(String prefix) {
    String p = Objects.toString(prefix, "").trim();
    if (p.isEmpty() || p.equals(DEFAULT_PREFIX) || p.charAt(0) != '(') return DEFAULT;
    int close = p.indexOf(')');
    if (close < 0) return DEFAULT;

    String letters = p.substring(1, close);
    String glyphs = p.substring(close + 1);
    if (letters.isEmpty() || letters.length() != glyphs.length()) return DEFAULT;

    List<Entry> out = new ArrayList<>(letters.length());
    for (int i = 0; i < letters.length(); i++) {
      char letter = letters.charAt(i);
      char glyph = glyphs.charAt(i);
      RankSymbol rank = RankSymbol.forDefaultLetter(letter);
      if (rank == null) rank = RankSymbol.forDefaultGlyph(glyph);
      if (rank == null) rank = RankSymbol.VOICE;
      out.add(new Entry(letter, glyph, rank));
    }
    return new PrefixTable(p, out);
  }

  private static List<Entry> defaultEntries() {
    List<Entry> out = new ArrayList<>();
    out.add(new Entry('q', '~', RankSymbol.OWNER));
    out.add(new Entry('a', '&', RankSymbol.ADMIN));
    out.add(new Entry('o', '@', RankSymbol.OP));
    out.add(new Entry('h', '%', RankSymbol.HALF_OP));
    out.add(new Entry('v', '+', RankSymbol.VOICE));
    return out;
  }

  /** The {@code PREFIX} value this table was built from. */
  public String source() {
    return source;
  }

  public boolean isRankLetter(char letter) {
    return entryForLetter(letter) != null;
  }

  /** Rank granted by {@code letter}, or {@code null} if the letter is not a membership mode. */
  public RankSymbol rankOf(char letter) {
    Entry e = entryForLetter(letter);
    return e == null ? null : e.rank();
  }

  /** Rank shown by {@code glyph} in NAMES/WHO replies, or {@code null} if unknown. */
  public RankSymbol rankOfGlyph(char glyph) {
    for (Entry e : entries) {
      if (e.glyph() == glyph) return e.rank();
    }
    return null;
  }

  /**
   * Mode letter granting {@code rank}, or {@code null} if this network has none.
   *
   * <p>When several letters collapse onto the same rank, the standard letter wins.
   */
  public Character letterOf(RankSymbol rank) {
    if (rank == null) return null;
    Character first = null;
    for (Entry e : entries) {
      if (e.rank() != rank) continue;
      if (e.letter() == rank.defaultLetter()) return e.letter();
      if (first == null) first = e.letter();
    }
    return first;
  }

  /** Display glyph for {@code rank}; falls back to the conventional glyph. */
  public char glyphOf(RankSymbol rank) {
    Objects.requireNonNull(rank, "rank");
    char fallback = rank.defaultGlyph();
    Character first = null;
    for (Entry e : entries) {
      if (e.rank() != rank) continue;
      if (e.glyph() == fallback) return fallback;
      if (first == null) first = e.glyph();
    }
    return first == null ? fallback : first;
  }

  private Entry entryForLetter(char letter) {
    for (Entry e : entries) {
      if (e.letter() == letter) return e;
    }
    return null;
  }

  @Override
  public String toString() {
    return "PrefixTable{" + source + "}";
  }
}
