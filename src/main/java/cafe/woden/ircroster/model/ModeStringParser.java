package cafe.woden.ircroster.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Splits a MODE line into flag changes and argument-taking changes.
 *
 * <p>Stateless apart from the negotiated {@link PrefixTable} and {@link ChannelModeTypes} it was
 * built with. Membership letters and list letters always consume an argument; key/limit letters
 * consume one only while adding. A letter that should consume an argument but finds none yields a
 * change with a {@code null} argument.
 */
public final class ModeStringParser {

  private final PrefixTable prefixes;
  private final ChannelModeTypes modeTypes;

  public ModeStringParser(PrefixTable prefixes, ChannelModeTypes modeTypes) {
    this.prefixes = prefixes == null ? PrefixTable.DEFAULT : prefixes;
    this.modeTypes = modeTypes == null ? ChannelModeTypes.DEFAULT : modeTypes;
  }

  public ModeStringParser(PrefixTable prefixes) {
    this(prefixes, ChannelModeTypes.DEFAULT);
  }

  public PrefixTable prefixes() {
    return prefixes;
  }

  public ChannelModeTypes modeTypes() {
    return modeTypes;
  }

  /** Parses {@code modeField} (e.g. {@code +ov-k}) against whitespace separated {@code argsField}. */
  public ParsedModeChangeSet parse(String modeField, String argsField) {
    String a = Objects.toString(argsField, "").trim();
    List<String> args = a.isEmpty() ? List.of() : List.of(a.split("\\s+"));
    return parse(modeField, args);
  }

  public ParsedModeChangeSet parse(String modeField, List<String> args) {
    String m = Objects.toString(modeField, "").trim();
    if (m.isEmpty()) return ParsedModeChangeSet.EMPTY;

    Deque<String> pending = new ArrayDeque<>();
    if (args != null) {
      for (String arg : args) {
        if (arg != null && !arg.isBlank()) pending.addLast(arg.trim());
      }
    }

    List<Character> added = new ArrayList<>();
    List<Character> removed = new ArrayList<>();
    List<ModeChange> changes = new ArrayList<>();

    boolean adding = true;
    for (int i = 0; i < m.length(); i++) {
      char c = m.charAt(i);
      if (c == '+') {
        adding = true;
        continue;
      }
      if (c == '-') {
        adding = false;
        continue;
      }
      if (!Character.isLetterOrDigit(c)) continue;

      if (prefixes.isRankLetter(c) || modeTypes.isListMode(c)) {
        changes.add(ModeChange.of(c, adding, pending.pollFirst()));
      } else if (modeTypes.isSettingMode(c)) {
        changes.add(ModeChange.of(c, adding, adding ? pending.pollFirst() : null));
      } else if (adding) {
        added.add(c);
      } else {
        removed.add(c);
      }
    }

    if (added.isEmpty() && removed.isEmpty() && changes.isEmpty()) return ParsedModeChangeSet.EMPTY;
    return new ParsedModeChangeSet(added, removed, changes);
  }
}
