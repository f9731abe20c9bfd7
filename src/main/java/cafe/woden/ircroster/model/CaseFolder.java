package cafe.woden.ircroster.model;

import java.util.Objects;

/**
 * Canonicalizes nicknames and channel names for comparison and map keys.
 *
 * <p>Instances are bound to one {@link CaseFoldVariant} and are immutable. Characters outside the
 * ones a variant knows about are left alone apart from ASCII lowercasing.
 */
public final class CaseFolder {

  private static final CaseFolder ASCII = new CaseFolder(CaseFoldVariant.ASCII);
  private static final CaseFolder RFC1459 = new CaseFolder(CaseFoldVariant.RFC1459);
  private static final CaseFolder RFC1459_STRICT = new CaseFolder(CaseFoldVariant.RFC1459_STRICT);

  private final CaseFoldVariant variant;

  private CaseFolder(CaseFoldVariant variant) {
    this.variant = variant;
  }

  public static CaseFolder of(CaseFoldVariant variant) {
    if (variant == null) return RFC1459;
    return switch (variant) {
      case ASCII -> ASCII;
      case RFC1459 -> RFC1459;
      case RFC1459_STRICT -> RFC1459_STRICT;
    };
  }

  /** Folds {@code raw} under {@code variant}; {@code null} folds to the empty string. */
  public static String fold(String raw, CaseFoldVariant variant) {
    return of(variant).fold(raw);
  }

  public CaseFoldVariant variant() {
    return variant;
  }

  public String fold(String raw) {
    String s = Objects.toString(raw, "");
    char[] out = null;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      char f = variant.foldChar(c);
      if (f != c) {
        if (out == null) out = s.toCharArray();
        out[i] = f;
      }
    }
    return out == null ? s : new String(out);
  }

  /** True if both names denote the same identity under this folder's variant. */
  public boolean same(String a, String b) {
    if (a == null || b == null) return false;
    return fold(a).equals(fold(b));
  }

  @Override
  public String toString() {
    return "CaseFolder{" + variant.token() + "}";
  }
}
