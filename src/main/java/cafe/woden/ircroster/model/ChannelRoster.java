package cafe.woden.ircroster.model;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * Membership records for one joined channel, keyed by folded nickname.
 *
 * <p>Also carries the channel's own mode state and, while a NAMES listing is being received, the
 * set of nicknames the listing has confirmed so far. Owned by {@link IrcSession}; not thread-safe
 * on its own.
 */
public final class ChannelRoster {

  private String name;
  private String key;
  private final Map<String, ChannelMembership> members = new LinkedHashMap<>();
  private final Set<Character> flags = new TreeSet<>();
  private final Map<Character, String> settings = new TreeMap<>();
  private Set<String> namesSeen;

  ChannelRoster(String name, String key) {
    this.name = Objects.requireNonNull(name, "name");
    this.key = Objects.requireNonNull(key, "key");
  }

  /** Channel name as first seen. */
  public String name() {
    return name;
  }

  /** Folded channel name; the identifier stored in identity context sets. */
  public String key() {
    return key;
  }

  public int size() {
    return members.size();
  }

  public ChannelMembership get(String nickKey) {
    return members.get(nickKey);
  }

  public boolean contains(String nickKey) {
    return members.containsKey(nickKey);
  }

  /** Immutable copy of the current memberships. */
  public List<ChannelMembership> members() {
    return List.copyOf(members.values());
  }

  public ChannelModes modes() {
    return new ChannelModes(flags, settings);
  }

  Set<String> nickKeys() {
    return new LinkedHashSet<>(members.keySet());
  }

  void put(String nickKey, ChannelMembership membership) {
    members.put(nickKey, membership);
  }

  ChannelMembership remove(String nickKey) {
    return members.remove(nickKey);
  }

  /** Moves the entry under {@code oldKey} to {@code newKey}, keeping the same record. */
  boolean rekey(String oldKey, String newKey) {
    if (oldKey.equals(newKey)) return members.containsKey(oldKey);
    ChannelMembership m = members.remove(oldKey);
    if (m == null) return false;
    members.put(newKey, m);
    if (namesSeen != null && namesSeen.remove(oldKey)) namesSeen.add(newKey);
    return true;
  }

  void rebuild(
      String newKey, Map<String, ChannelMembership> rekeyed, UnaryOperator<String> nickKeyRemap) {
    this.key = newKey;
    members.clear();
    members.putAll(rekeyed);
    if (namesSeen != null) {
      Set<String> remapped = new HashSet<>();
      for (String k : namesSeen) remapped.add(nickKeyRemap.apply(k));
      namesSeen = remapped;
    }
  }

  boolean setFlag(char letter, boolean on) {
    return on ? flags.add(letter) : flags.remove(letter);
  }

  boolean setSetting(char letter, String value) {
    if (value == null) return settings.remove(letter) != null;
    return !Objects.equals(settings.put(letter, value), value);
  }

  /** Drops every flag and setting; returns true if anything was set. */
  boolean clearModes() {
    boolean had = !flags.isEmpty() || !settings.isEmpty();
    flags.clear();
    settings.clear();
    return had;
  }

  void beginNames() {
    namesSeen = new HashSet<>();
  }

  boolean namesInProgress() {
    return namesSeen != null;
  }

  void markSeen(String nickKey) {
    if (namesSeen != null) namesSeen.add(nickKey);
  }

  /** Ends the NAMES listing and returns the keys it did not confirm. */
  Set<String> endNames() {
    Set<String> seen = namesSeen;
    namesSeen = null;
    if (seen == null) return Set.of();
    Set<String> stale = new LinkedHashSet<>(members.keySet());
    stale.removeAll(seen);
    return stale;
  }

  @Override
  public String toString() {
    return "ChannelRoster{" + name + ", members=" + members.size() + "}";
  }
}
