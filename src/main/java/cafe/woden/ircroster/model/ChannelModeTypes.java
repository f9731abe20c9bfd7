package cafe.woden.ircroster.model;

import java.util.Objects;

/**
 * Channel mode argument classes from ISUPPORT {@code CHANMODES} ({@code A,B,C,D}).
 *
 * <p>Group A letters (ban/except/invite lists) always take an argument. Group B and C letters
 * (key, limit and similar) take an argument only when being set. Group D and unlisted letters are
 * plain flags.
 */
public final class ChannelModeTypes {

  public static final String DEFAULT_CHANMODES = "beI,k,l,imnpst";

  public static final ChannelModeTypes DEFAULT = build(DEFAULT_CHANMODES);

  private final String source;
  private final String listModes;
  private final String settingModes;

  private ChannelModeTypes(String source, String listModes, String settingModes) {
    this.source = source;
    this.listModes = listModes;
    this.settingModes = settingModes;
  }

  /** Parses a {@code CHANMODES} value; a value with fewer than two groups yields {@link #DEFAULT}. */
  public static ChannelModeTypes parse(String chanmodes) {
    String c = Objects.toString(chanmodes, "").trim();
    String[] groups = c.split(",", -1);
    if (c.isEmpty() || groups.length < 2) return DEFAULT;
    return build(c);
  }

  private static ChannelModeTypes build(String c) {
    String[] groups = c.split(",", -1);
    String a = groups[0];
    String b = groups.length > 1 ? groups[1] : "";
    String cc = groups.length > 2 ? groups[2] : "";
    return new ChannelModeTypes(c, a, b + cc);
  }

  public String source() {
    return source;
  }

  /** Ban-style list letters; these always consume an argument. */
  public boolean isListMode(char letter) {
    return listModes.indexOf(letter) >= 0;
  }

  /** Key/limit-style letters; these consume an argument only when being set. */
  public boolean isSettingMode(char letter) {
    return settingModes.indexOf(letter) >= 0;
  }

  @Override
  public String toString() {
    return "ChannelModeTypes{" + source + "}";
  }
}
