package cafe.woden.ircroster.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PrefixTableTest {

  @Test
  void pairsLettersWithGlyphsPositionally() {
    PrefixTable table = PrefixTable.parse("(ov)@+");

    assertEquals(RankSymbol.OP, table.rankOf('o'));
    assertEquals(RankSymbol.VOICE, table.rankOf('v'));
    assertNull(table.rankOf('q'));
    assertEquals(RankSymbol.OP, table.rankOfGlyph('@'));
    assertNull(table.rankOfGlyph('~'));
    assertEquals('o', table.letterOf(RankSymbol.OP));
    assertNull(table.letterOf(RankSymbol.OWNER));
    assertTrue(table.isRankLetter('v'));
    assertFalse(table.isRankLetter('h'));
  }

  @Test
  void glyphOfFallsBackToConventionalGlyph() {
    PrefixTable table = PrefixTable.parse("(ov)@+");
    assertEquals('@', table.glyphOf(RankSymbol.OP));
    assertEquals('~', table.glyphOf(RankSymbol.OWNER));
  }

  @Test
  void malformedOrMissingPrefixFallsBackToDefault() {
    assertSame(PrefixTable.DEFAULT, PrefixTable.parse(null));
    assertSame(PrefixTable.DEFAULT, PrefixTable.parse(""));
    assertSame(PrefixTable.DEFAULT, PrefixTable.parse("ov@+"));
    assertSame(PrefixTable.DEFAULT, PrefixTable.parse("(ov@+"));
    assertSame(PrefixTable.DEFAULT, PrefixTable.parse("(ov)@"));
    assertSame(PrefixTable.DEFAULT, PrefixTable.parse("()"));
  }

  @Test
  void defaultPrefixValueResolvesToSharedDefaultTable() {
    assertSame(PrefixTable.DEFAULT, PrefixTable.parse(PrefixTable.DEFAULT_PREFIX));
    assertSame(PrefixTable.DEFAULT, PrefixTable.parse(" (qaohv)~&@%+ "));
  }

  @Test
  void defaultTableCoversFiveStandardRanks() {
    PrefixTable table = PrefixTable.DEFAULT;
    assertEquals(RankSymbol.OWNER, table.rankOf('q'));
    assertEquals(RankSymbol.ADMIN, table.rankOf('a'));
    assertEquals(RankSymbol.OP, table.rankOf('o'));
    assertEquals(RankSymbol.HALF_OP, table.rankOf('h'));
    assertEquals(RankSymbol.VOICE, table.rankOf('v'));
    assertEquals('%', table.glyphOf(RankSymbol.HALF_OP));
  }

  @Test
  void nonstandardLettersMapByGlyphThenToVoice() {
    PrefixTable table = PrefixTable.parse("(Yyov)!~@+");

    assertEquals(RankSymbol.VOICE, table.rankOf('Y'));
    assertEquals(RankSymbol.OWNER, table.rankOf('y'));
    assertEquals('v', table.letterOf(RankSymbol.VOICE));
    assertEquals('+', table.glyphOf(RankSymbol.VOICE));
    assertEquals(RankSymbol.VOICE, table.rankOfGlyph('!'));
  }
}
