package cafe.woden.ircroster.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CaseFolderTest {

  @Test
  void rfc1459FoldsBracketsAndLettersTogether() {
    assertEquals(
        CaseFolder.fold("Nick[", CaseFoldVariant.RFC1459),
        CaseFolder.fold("nick{", CaseFoldVariant.RFC1459));
    assertEquals("nick[]\\^", CaseFolder.fold("NICK{}|~", CaseFoldVariant.RFC1459));
  }

  @Test
  void asciiOnlyLowercasesLetters() {
    assertNotEquals(
        CaseFolder.fold("Nick[", CaseFoldVariant.ASCII),
        CaseFolder.fold("nick{", CaseFoldVariant.ASCII));
    assertEquals("nick{}|~", CaseFolder.fold("NICK{}|~", CaseFoldVariant.ASCII));
  }

  @Test
  void strictRfc1459KeepsTildeAndCaretApart() {
    CaseFolder strict = CaseFolder.of(CaseFoldVariant.RFC1459_STRICT);
    CaseFolder loose = CaseFolder.of(CaseFoldVariant.RFC1459);

    assertFalse(strict.same("a~", "a^"));
    assertTrue(loose.same("a~", "a^"));
    assertTrue(strict.same("A{b}", "a[B]"));
  }

  @Test
  void nullFoldsToEmptyAndIsNeverTheSameAsAnything() {
    CaseFolder folder = CaseFolder.of(CaseFoldVariant.RFC1459);
    assertEquals("", folder.fold(null));
    assertFalse(folder.same(null, ""));
  }

  @Test
  void unchangedInputIsReturnedAsIs() {
    String already = "alice";
    assertSame(already, CaseFolder.fold(already, CaseFoldVariant.RFC1459));
  }

  @Test
  void casemappingTokensMapToVariantsWithRfc1459Fallback() {
    assertEquals(CaseFoldVariant.ASCII, CaseFoldVariant.fromToken("ascii"));
    assertEquals(CaseFoldVariant.RFC1459, CaseFoldVariant.fromToken("RFC1459"));
    assertEquals(CaseFoldVariant.RFC1459_STRICT, CaseFoldVariant.fromToken("strict-rfc1459"));
    assertEquals(CaseFoldVariant.RFC1459, CaseFoldVariant.fromToken("rfc7613"));
    assertEquals(CaseFoldVariant.RFC1459, CaseFoldVariant.fromToken(null));
  }
}
