package cafe.woden.ircroster.model;

import cafe.woden.ircroster.model.RosterChange.Kind;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.jmolecules.ddd.annotation.AggregateRoot;

/**
 * Membership state for one IRC connection: the {@link IdentityRegistry} plus one
 * {@link ChannelRoster} per joined channel.
 *
 * <p>Events must be applied by a single writer in protocol order. Every mutating method takes the
 * write lock, commits, and returns the {@link RosterChange}s it produced so the caller can publish
 * them outside the lock. Queries take the read lock and return immutable copies.
 *
 * <p>Invariant: an identity's channel context set is exactly the set of rosters holding a
 * membership for it.
 */
@AggregateRoot
public final class IrcSession {

  public static final String DEFAULT_CHAN_TYPES = "#&";

  private final String serverId;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Clock clock;
  private final IdentityRegistry registry;
  private final Map<String, ChannelRoster> rosters = new LinkedHashMap<>();

  private CaseFolder folder;
  private PrefixTable prefixes;
  private ChannelModeTypes modeTypes;
  private ModeStringParser parser;
  private String chanTypes;
  private String ownNick = "";

  // Collects changes for the write operation in progress.
  private List<RosterChange> pending;

  public IrcSession(
      String serverId,
      CaseFoldVariant variant,
      PrefixTable prefixes,
      ChannelModeTypes modeTypes,
      String chanTypes) {
    this(serverId, variant, prefixes, modeTypes, chanTypes, Clock.systemUTC());
  }

  /** @param clock stamps channel activity for events that carry no timestamp of their own */
  public IrcSession(
      String serverId,
      CaseFoldVariant variant,
      PrefixTable prefixes,
      ChannelModeTypes modeTypes,
      String chanTypes,
      Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.serverId = Objects.toString(serverId, "").trim();
    if (this.serverId.isEmpty()) throw new IllegalArgumentException("serverId must not be blank");
    this.folder = CaseFolder.of(variant);
    this.prefixes = prefixes == null ? PrefixTable.DEFAULT : prefixes;
    this.modeTypes = modeTypes == null ? ChannelModeTypes.DEFAULT : modeTypes;
    this.parser = new ModeStringParser(this.prefixes, this.modeTypes);
    this.chanTypes = normalizeChanTypes(chanTypes);
    this.registry = new IdentityRegistry(folder, this::fanOutUserChanged);
  }

  public IrcSession(String serverId) {
    this(serverId, CaseFoldVariant.RFC1459, PrefixTable.DEFAULT, ChannelModeTypes.DEFAULT, null);
  }

  public String serverId() {
    return serverId;
  }

  /**
   * Applies negotiated ISUPPORT values.
   *
   * <p>A different casemapping re-keys every identity and roster; prefix and mode tables are
   * swapped without touching existing rank flags.
   */
  public List<RosterChange> updateServerSupport(
      CaseFoldVariant variant, PrefixTable newPrefixes, ChannelModeTypes newModeTypes, String newChanTypes) {
    return mutate(
        () -> {
          if (newPrefixes != null) prefixes = newPrefixes;
          if (newModeTypes != null) modeTypes = newModeTypes;
          parser = new ModeStringParser(prefixes, modeTypes);
          if (newChanTypes != null && !newChanTypes.isBlank()) {
            chanTypes = normalizeChanTypes(newChanTypes);
          }
          if (variant != null && variant != folder.variant()) rebuildKeys(CaseFolder.of(variant));
        });
  }

  public void setOwnNick(String nick) {
    lock.writeLock().lock();
    try {
      ownNick = norm(nick);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public String ownNick() {
    return read(() -> ownNick);
  }

  public CaseFolder caseFolder() {
    return read(() -> folder);
  }

  public PrefixTable prefixTable() {
    return read(() -> prefixes);
  }

  public boolean isChannelName(String target) {
    String t = norm(target);
    if (t.isEmpty()) return false;
    String types = read(() -> chanTypes);
    return types.indexOf(t.charAt(0)) >= 0;
  }

  /**
   * A user joined {@code channel}.
   *
   * <p>Our own JOIN opens the roster. A JOIN for a user already present only merges attributes.
   * Leading rank glyphs on the nickname (as some bouncers replay) set the decoded ranks.
   */
  public List<RosterChange> join(String channel, String nick, IdentityAttributes attrs) {
    return mutate(
        () -> {
          String ch = norm(channel);
          NamesEntry entry = NamesEntry.parse(nick, prefixes);
          if (ch.isEmpty() || entry == null) return;

          ChannelRoster roster = roster(ch);
          if (roster == null) {
            if (!isOwn(entry.nick())) return;
            roster = new ChannelRoster(ch, folder.fold(ch));
            rosters.put(roster.key(), roster);
          }
          IdentityAttributes merged = attrs == null ? entry.attributes() : attrs;
          upsertMember(roster, entry.nick(), merged, entry.ranks(), false);
        });
  }

  /** A user left {@code channel}; our own PART closes the roster. */
  public List<RosterChange> part(String channel, String nick) {
    return mutate(() -> leave(channel, nick));
  }

  /** A user was kicked from {@code channel}; a kick of ourselves closes the roster. */
  public List<RosterChange> kick(String channel, String nick) {
    return mutate(() -> leave(channel, nick));
  }

  /** A user quit; removes them from every channel. Our own QUIT clears the session. */
  public List<RosterChange> quit(String nick) {
    return mutate(
        () -> {
          String n = norm(nick);
          if (n.isEmpty()) return;
          if (isOwn(n)) {
            closeAllRosters();
            return;
          }
          Identity identity = registry.lookup(n);
          if (identity == null) return;
          for (String ctx : List.copyOf(identity.channelContexts())) {
            ChannelRoster roster = rosters.get(ctx);
            if (roster != null) removeMember(roster, identity.foldKey());
          }
        });
  }

  /**
   * A user changed nickname.
   *
   * <p>The identity and each of its membership records survive; only their keys move. If the new
   * nickname is held by a different (stale) identity, that identity is removed from its channels
   * first.
   *
   * @throws UnknownIdentityException if {@code oldNick} is not known and is not our own nickname
   */
  public List<RosterChange> renameUser(String oldNick, String newNick) {
    return mutate(
        () -> {
          String o = norm(oldNick);
          String n = norm(newNick);
          if (n.isEmpty()) throw new IllegalArgumentException("newNick must not be blank");
          boolean own = isOwn(o);
          Identity identity = registry.lookup(o);
          if (identity == null) {
            if (own) {
              ownNick = n;
              return;
            }
            throw new UnknownIdentityException(o);
          }

          String oldKey = identity.foldKey();
          String newKey = folder.fold(n);
          Identity stale = registry.lookup(n);
          if (stale != null && stale != identity) {
            for (String ctx : List.copyOf(stale.channelContexts())) {
              ChannelRoster roster = rosters.get(ctx);
              if (roster != null) removeMember(roster, stale.foldKey());
            }
          }

          registry.rename(o, n);
          for (String ctx : identity.channelContexts()) {
            ChannelRoster roster = rosters.get(ctx);
            if (roster == null) continue;
            roster.rekey(oldKey, newKey);
            emit(roster, Kind.MEMBER_RENAMED, n);
          }
          if (own) ownNick = n;
        });
  }

  /** Applies a MODE line addressed to {@code channel}. */
  public List<RosterChange> applyMode(String channel, String modeField, List<String> args) {
    return mutate(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster == null) return;
          ParsedModeChangeSet parsed = parser.parse(modeField, args);
          if (applyParsed(roster, parsed)) emit(roster, Kind.CHANNEL_MODES_CHANGED, "");
        });
  }

  /** Applies a parsed MODE line; useful when the caller already split it. */
  public List<RosterChange> applyMode(String channel, ParsedModeChangeSet parsed) {
    return mutate(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster == null || parsed == null) return;
          if (applyParsed(roster, parsed)) emit(roster, Kind.CHANNEL_MODES_CHANGED, "");
        });
  }

  /**
   * Replaces the channel's own modes with a full listing (RPL_CHANNELMODEIS).
   *
   * <p>Flags and settings missing from the listing are cleared. Membership letters are ignored.
   */
  public List<RosterChange> seedChannelModes(String channel, String modeField, List<String> args) {
    return mutate(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster == null) return;
          ChannelModes before = roster.modes();
          roster.clearModes();
          ParsedModeChangeSet parsed = parser.parse(modeField, args);
          for (Character c : parsed.added()) roster.setFlag(c, true);
          for (ModeChange change : parsed.argumentChanges()) {
            if (change.adding() && change.hasArgument() && modeTypes.isSettingMode(change.letter())) {
              roster.setSetting(change.letter(), change.argument());
            }
          }
          if (!before.equals(roster.modes())) emit(roster, Kind.CHANNEL_MODES_CHANGED, "");
        });
  }

  /**
   * Grants or revokes one rank.
   *
   * <p>Nicknames with no identity at all are ignored. A grant for a known identity that is missing
   * from this roster implies presence and adds it.
   */
  public List<RosterChange> setRank(String channel, String nick, RankSymbol rank, boolean granted) {
    return mutate(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster == null) return;
          applyRank(roster, nick, rank, granted);
        });
  }

  /** Starts a NAMES listing for {@code channel}, discarding any unfinished one. */
  public List<RosterChange> beginNames(String channel) {
    return mutate(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster != null) roster.beginNames();
        });
  }

  public boolean namesInProgress(String channel) {
    return read(
        () -> {
          ChannelRoster roster = roster(channel);
          return roster != null && roster.namesInProgress();
        });
  }

  /**
   * Applies one NAMES token: adds the user if absent, sets ranks to the decoded glyphs and marks
   * the user as seen by the listing in progress.
   */
  public List<RosterChange> namesEntry(String channel, String rawEntry) {
    return mutate(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster == null) return;
          NamesEntry entry = NamesEntry.parse(rawEntry, prefixes);
          if (entry == null) return;
          String key = upsertMember(roster, entry.nick(), entry.attributes(), entry.ranks(), true);
          roster.markSeen(key);
        });
  }

  /** Ends the NAMES listing; members it did not confirm are removed as if they had parted. */
  public List<RosterChange> endNames(String channel) {
    return mutate(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster == null || !roster.namesInProgress()) return;
          for (String stale : roster.endNames()) removeMember(roster, stale);
          emit(roster, Kind.ROSTER_SYNCED, "");
        });
  }

  /** A channel message from {@code nick}; refreshes the member's activity timestamp. */
  public List<RosterChange> channelActivity(
      String channel, String nick, IdentityAttributes attrs, Instant at) {
    return mutate(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster == null) return;
          String key = folder.fold(norm(nick));
          ChannelMembership m = roster.get(key);
          if (m == null) return;
          roster.put(key, m.withLastActivity(at == null ? clock.instant() : at));
          registry.getOrCreate(m.nick(), attrs);
        });
  }

  /**
   * A WHO reply row for a user on {@code channel}.
   *
   * @param flags the WHO flags field, e.g. {@code H@} or {@code G*+}
   */
  public List<RosterChange> whoReply(
      String channel, String nick, IdentityAttributes attrs, String flags) {
    return mutate(
        () -> {
          String n = norm(nick);
          if (n.isEmpty()) return;
          ChannelRoster roster = roster(channel);
          Identity identity;
          if (roster != null) {
            String key = folder.fold(n);
            if (!roster.contains(key)) upsertMember(roster, n, attrs, Set.of(), false);
            identity = registry.getOrCreate(n, attrs);
          } else {
            identity = registry.lookup(n);
            if (identity == null) return;
            registry.getOrCreate(n, attrs);
          }
          String f = norm(flags);
          if (f.startsWith("H")) updateAway(identity, AwayState.HERE, null);
          else if (f.startsWith("G")) updateAway(identity, AwayState.AWAY, null);
        });
  }

  /** Fills in details for an already known user (e.g. from WHOIS); unknown users are ignored. */
  public List<RosterChange> mergeAttributes(String nick, IdentityAttributes attrs) {
    return mutate(
        () -> {
          Identity identity = registry.lookup(nick);
          if (identity != null) registry.getOrCreate(identity.nick(), attrs);
        });
  }

  /** IRCv3 away-notify; a blank message means the user is back. */
  public List<RosterChange> away(String nick, String message) {
    return mutate(
        () -> {
          Identity identity = registry.lookup(nick);
          if (identity == null) return;
          boolean back = message == null || message.isBlank();
          updateAway(identity, back ? AwayState.HERE : AwayState.AWAY, message);
        });
  }

  /** IRCv3 CHGHOST; replaces the user and host fields. */
  public List<RosterChange> changeHost(String nick, String user, String host) {
    return mutate(
        () -> {
          Identity identity = registry.lookup(nick);
          if (identity != null && identity.replaceUserHost(user, host)) {
            registry.notifyChanged(identity);
          }
        });
  }

  /** IRCv3 SETNAME; replaces the real name. */
  public List<RosterChange> changeRealName(String nick, String realName) {
    return mutate(
        () -> {
          Identity identity = registry.lookup(nick);
          if (identity != null && identity.replaceRealName(realName)) {
            registry.notifyChanged(identity);
          }
        });
  }

  /** Drops the whole roster for {@code channel}, releasing every membership. */
  public List<RosterChange> closeChannel(String channel) {
    return mutate(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster != null) closeRoster(roster);
        });
  }

  /** Drops every roster, e.g. on disconnect. */
  public List<RosterChange> clear() {
    return mutate(this::closeAllRosters);
  }

  /** Snapshot of the memberships of {@code channel}; empty for unknown channels. */
  public List<ChannelMembership> membersOf(String channel) {
    return read(
        () -> {
          ChannelRoster roster = roster(channel);
          return roster == null ? List.<ChannelMembership>of() : roster.members();
        });
  }

  public ChannelMembership membership(String channel, String nick) {
    return read(
        () -> {
          ChannelRoster roster = roster(channel);
          if (roster == null) return null;
          return roster.get(folder.fold(norm(nick)));
        });
  }

  public boolean hasRank(String channel, String nick, RankSymbol rank) {
    ChannelMembership m = membership(channel, nick);
    return m != null && m.hasRank(rank);
  }

  public boolean isOwner(String channel, String nick) {
    return hasRank(channel, nick, RankSymbol.OWNER);
  }

  public boolean isAdmin(String channel, String nick) {
    return hasRank(channel, nick, RankSymbol.ADMIN);
  }

  public boolean isOp(String channel, String nick) {
    return hasRank(channel, nick, RankSymbol.OP);
  }

  public boolean isHalfOp(String channel, String nick) {
    return hasRank(channel, nick, RankSymbol.HALF_OP);
  }

  public boolean isVoice(String channel, String nick) {
    return hasRank(channel, nick, RankSymbol.VOICE);
  }

  /** Members holding op or any higher rank. */
  public int operatorCount(String channel) {
    int count = 0;
    for (ChannelMembership m : membersOf(channel)) {
      if (m.op() || m.admin() || m.owner()) count++;
    }
    return count;
  }

  public Identity identityOf(String nick) {
    return read(() -> registry.lookup(nick));
  }

  public Set<String> allNicks() {
    return read(registry::allNicks);
  }

  public int identityCount() {
    return read(registry::size);
  }

  /** Names of the channels {@code nick} is on. */
  public Set<String> channelsOf(String nick) {
    return read(
        () -> {
          Identity identity = registry.lookup(nick);
          if (identity == null) return Set.<String>of();
          Set<String> out = new LinkedHashSet<>();
          for (String ctx : identity.channelContexts()) {
            ChannelRoster roster = rosters.get(ctx);
            if (roster != null) out.add(roster.name());
          }
          return Collections.unmodifiableSet(out);
        });
  }

  public List<String> channels() {
    return read(
        () -> {
          List<String> out = new ArrayList<>(rosters.size());
          for (ChannelRoster r : rosters.values()) out.add(r.name());
          return List.copyOf(out);
        });
  }

  public boolean hasChannel(String channel) {
    return read(() -> roster(channel) != null);
  }

  public ChannelModes channelModes(String channel) {
    return read(
        () -> {
          ChannelRoster roster = roster(channel);
          return roster == null ? ChannelModes.NONE : roster.modes();
        });
  }

  private void leave(String channel, String nick) {
    ChannelRoster roster = roster(channel);
    String n = norm(nick);
    if (roster == null || n.isEmpty()) return;
    if (isOwn(n)) {
      closeRoster(roster);
      return;
    }
    removeMember(roster, folder.fold(n));
  }

  /**
   * Adds or refreshes a membership and returns its key.
   *
   * @param replaceRanks true to set ranks exactly to {@code ranks}; false to only add them
   */
  private String upsertMember(
      ChannelRoster roster,
      String nick,
      IdentityAttributes attrs,
      Set<RankSymbol> ranks,
      boolean replaceRanks) {
    Identity identity = registry.getOrCreate(nick, attrs);
    String key = identity.foldKey();
    ChannelMembership existing = roster.get(key);

    if (existing == null) {
      roster.put(key, ChannelMembership.of(identity).withRanks(ranks));
      registry.attach(identity, roster.key());
      emit(roster, Kind.MEMBER_JOINED, identity.nick());
      return key;
    }

    Set<RankSymbol> target;
    if (replaceRanks) {
      target = ranks;
    } else {
      EnumSet<RankSymbol> union = EnumSet.noneOf(RankSymbol.class);
      union.addAll(existing.ranks());
      union.addAll(ranks);
      target = union;
    }
    ChannelMembership next = existing.withRanks(target);
    if (next != existing) {
      roster.put(key, next);
      emit(roster, Kind.RANKS_CHANGED, identity.nick());
    }
    return key;
  }

  private void removeMember(ChannelRoster roster, String nickKey) {
    ChannelMembership m = roster.remove(nickKey);
    if (m == null) return;
    String nick = m.nick();
    registry.release(nick, roster.key());
    emit(roster, Kind.MEMBER_LEFT, nick);
  }

  private void closeRoster(ChannelRoster roster) {
    for (String key : roster.nickKeys()) {
      ChannelMembership m = roster.remove(key);
      if (m != null) registry.release(m.nick(), roster.key());
    }
    rosters.remove(roster.key());
    emit(roster, Kind.ROSTER_CLOSED, "");
  }

  private void closeAllRosters() {
    for (ChannelRoster roster : List.copyOf(rosters.values())) closeRoster(roster);
  }

  /** Applies a MODE delta; returns true if the channel's own modes changed. */
  private boolean applyParsed(ChannelRoster roster, ParsedModeChangeSet parsed) {
    boolean channelChanged = false;
    for (Character c : parsed.added()) channelChanged |= roster.setFlag(c, true);
    for (Character c : parsed.removed()) channelChanged |= roster.setFlag(c, false);

    for (ModeChange change : parsed.argumentChanges()) {
      char letter = change.letter();
      RankSymbol rank = prefixes.rankOf(letter);
      if (rank != null) {
        if (change.hasArgument()) applyRank(roster, change.argument(), rank, change.adding());
        continue;
      }
      if (modeTypes.isSettingMode(letter)) {
        if (!change.adding()) {
          channelChanged |= roster.setSetting(letter, null);
        } else if (change.hasArgument()) {
          channelChanged |= roster.setSetting(letter, change.argument());
        }
      }
      // List modes (bans, exceptions, invites) are not tracked.
    }

    return channelChanged;
  }

  private void applyRank(ChannelRoster roster, String nick, RankSymbol rank, boolean granted) {
    String n = norm(nick);
    if (n.isEmpty() || rank == null) return;
    String key = folder.fold(n);
    ChannelMembership m = roster.get(key);
    if (m == null) {
      if (!granted || registry.lookup(n) == null) return;
      upsertMember(roster, n, IdentityAttributes.EMPTY, Set.of(rank), false);
      return;
    }
    ChannelMembership next = m.withRank(rank, granted);
    if (next == m) return;
    roster.put(key, next);
    emit(roster, Kind.RANKS_CHANGED, m.nick());
  }

  private void updateAway(Identity identity, AwayState state, String message) {
    if (identity.updateAway(state, message)) registry.notifyChanged(identity);
  }

  private void fanOutUserChanged(Identity identity) {
    for (String ctx : identity.channelContexts()) {
      ChannelRoster roster = rosters.get(ctx);
      if (roster != null) emit(roster, Kind.USER_CHANGED, identity.nick());
    }
  }

  private void rebuildKeys(CaseFolder next) {
    Map<String, String> channelRemap = new HashMap<>();
    Map<String, ChannelRoster> rebuilt = new LinkedHashMap<>();
    List<ChannelRoster> duplicates = new ArrayList<>();
    for (ChannelRoster roster : rosters.values()) {
      String newKey = next.fold(roster.name());
      channelRemap.put(roster.key(), newKey);
      if (rebuilt.containsKey(newKey)) duplicates.add(roster);
      else rebuilt.put(newKey, roster);
    }
    // Two channels that fold together under the new rules: keep the first one.
    for (ChannelRoster dup : duplicates) closeRoster(dup);

    List<Identity> dropped = registry.rebuild(next, ctx -> channelRemap.getOrDefault(ctx, ctx));
    Set<Identity> droppedSet = Collections.newSetFromMap(new IdentityHashMap<>());
    droppedSet.addAll(dropped);

    Map<String, String> nickRemap = new HashMap<>();
    for (ChannelRoster roster : rebuilt.values()) {
      Map<String, ChannelMembership> members = new LinkedHashMap<>();
      for (String oldKey : roster.nickKeys()) {
        ChannelMembership m = roster.get(oldKey);
        String newKey = next.fold(m.nick());
        nickRemap.put(oldKey, newKey);
        if (droppedSet.contains(m.identity())) continue;
        members.put(newKey, m);
      }
      roster.rebuild(channelRemap.get(roster.key()), members, k -> nickRemap.getOrDefault(k, k));
    }
    for (Identity identity : dropped) identity.replaceContexts(Set.of());

    rosters.clear();
    rosters.putAll(rebuilt);
    folder = next;
    for (ChannelRoster roster : rosters.values()) emit(roster, Kind.ROSTER_SYNCED, "");
  }

  private ChannelRoster roster(String channel) {
    String ch = norm(channel);
    if (ch.isEmpty()) return null;
    return rosters.get(folder.fold(ch));
  }

  private boolean isOwn(String nick) {
    return !ownNick.isEmpty() && folder.same(ownNick, nick);
  }

  private void emit(ChannelRoster roster, Kind kind, String nick) {
    if (pending != null) pending.add(new RosterChange(serverId, roster.name(), kind, nick));
  }

  private List<RosterChange> mutate(Runnable action) {
    lock.writeLock().lock();
    List<RosterChange> outer = pending;
    pending = new ArrayList<>();
    try {
      action.run();
      return List.copyOf(pending);
    } finally {
      pending = outer;
      lock.writeLock().unlock();
    }
  }

  private <T> T read(Supplier<T> query) {
    lock.readLock().lock();
    try {
      return query.get();
    } finally {
      lock.readLock().unlock();
    }
  }

  private static String normalizeChanTypes(String chanTypes) {
    String t = norm(chanTypes);
    return t.isEmpty() ? DEFAULT_CHAN_TYPES : t;
  }

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }

  @Override
  public String toString() {
    return "IrcSession{" + serverId + "}";
  }
}
