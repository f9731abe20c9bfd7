package cafe.woden.ircroster.model;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Snapshot of a channel's own modes: argument-less flags plus key/limit style settings.
 *
 * @param flags set flag letters (e.g. {@code n}, {@code t})
 * @param settings letters set with an argument, such as {@code l -> 50} or {@code k -> secret}
 */
@ValueObject
public record ChannelModes(Set<Character> flags, Map<Character, String> settings) {

  public static final ChannelModes NONE = new ChannelModes(Set.of(), Map.of());

  public ChannelModes {
    flags = flags == null ? Set.of() : Set.copyOf(flags);
    settings = settings == null ? Map.of() : Map.copyOf(settings);
  }

  /** User limit ({@code +l}), or {@code null} if unset or not numeric. */
  public Integer limit() {
    String v = settings.get('l');
    if (v == null) return null;
    try {
      return Integer.valueOf(v.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Channel key ({@code +k}), or {@code null} if unset. */
  public String key() {
    return settings.get('k');
  }

  /** Normalized {@code +modes} summary such as {@code +klnt}, or empty. */
  public String summary() {
    TreeSet<Character> all = new TreeSet<>(flags);
    all.addAll(new TreeMap<>(settings).keySet());
    if (all.isEmpty()) return "";
    StringBuilder out = new StringBuilder(all.size() + 1).append('+');
    for (Character c : all) out.append(c.charValue());
    return out.toString();
  }
}
