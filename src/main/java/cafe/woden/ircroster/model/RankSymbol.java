package cafe.woden.ircroster.model;

/** Channel membership ranks, lowest first. */
public enum RankSymbol {
  VOICE('v', '+'),
  HALF_OP('h', '%'),
  OP('o', '@'),
  ADMIN('a', '&'),
  OWNER('q', '~');

  private final char defaultLetter;
  private final char defaultGlyph;

  RankSymbol(char defaultLetter, char defaultGlyph) {
    this.defaultLetter = defaultLetter;
    this.defaultGlyph = defaultGlyph;
  }

  public char defaultLetter() {
    return defaultLetter;
  }

  public char defaultGlyph() {
    return defaultGlyph;
  }

  static RankSymbol forDefaultLetter(char letter) {
    for (RankSymbol r : values()) {
      if (r.defaultLetter == letter) return r;
    }
    return null;
  }

  static RankSymbol forDefaultGlyph(char glyph) {
    for (RankSymbol r : values()) {
      if (r.defaultGlyph == glyph) return r;
    }
    return null;
  }
}
