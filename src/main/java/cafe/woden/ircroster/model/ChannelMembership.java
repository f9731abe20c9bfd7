package cafe.woden.ircroster.model;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A user's presence on one channel: the shared {@link Identity} plus that channel's rank flags.
 *
 * <p>Immutable; rosters replace the record when a flag or the activity timestamp changes. Ranks are
 * independent booleans because some networks grant several at once.
 *
 * @param lastActivity last time the user spoke on the channel, or {@code null}
 */
public record ChannelMembership(
    Identity identity,
    boolean voice,
    boolean halfOp,
    boolean op,
    boolean admin,
    boolean owner,
    Instant lastActivity) {

  public ChannelMembership {
    Objects.requireNonNull(identity, "identity");
  }

  public static ChannelMembership of(Identity identity) {
    return new ChannelMembership(identity, false, false, false, false, false, null);
  }

  public String nick() {
    return identity.nick();
  }

  public boolean hasRank(RankSymbol rank) {
    if (rank == null) return false;
    return switch (rank) {
      case VOICE -> voice;
      case HALF_OP -> halfOp;
      case OP -> op;
      case ADMIN -> admin;
      case OWNER -> owner;
    };
  }

  public Set<RankSymbol> ranks() {
    EnumSet<RankSymbol> out = EnumSet.noneOf(RankSymbol.class);
    for (RankSymbol r : RankSymbol.values()) {
      if (hasRank(r)) out.add(r);
    }
    return Set.copyOf(out);
  }

  /** Highest rank held, or {@code null} for a plain member. */
  public RankSymbol highestRank() {
    RankSymbol[] all = RankSymbol.values();
    for (int i = all.length - 1; i >= 0; i--) {
      if (hasRank(all[i])) return all[i];
    }
    return null;
  }

  /** All held rank glyphs, highest first (e.g. {@code @+}). */
  public String prefix(PrefixTable prefixes) {
    PrefixTable table = prefixes == null ? PrefixTable.DEFAULT : prefixes;
    StringBuilder sb = new StringBuilder();
    RankSymbol[] all = RankSymbol.values();
    for (int i = all.length - 1; i >= 0; i--) {
      if (hasRank(all[i])) sb.append(table.glyphOf(all[i]));
    }
    return sb.toString();
  }

  public ChannelMembership withRank(RankSymbol rank, boolean granted) {
    if (rank == null || hasRank(rank) == granted) return this;
    return new ChannelMembership(
        identity,
        rank == RankSymbol.VOICE ? granted : voice,
        rank == RankSymbol.HALF_OP ? granted : halfOp,
        rank == RankSymbol.OP ? granted : op,
        rank == RankSymbol.ADMIN ? granted : admin,
        rank == RankSymbol.OWNER ? granted : owner,
        lastActivity);
  }

  public ChannelMembership withRanks(Set<RankSymbol> granted) {
    Set<RankSymbol> g = granted == null ? Set.of() : granted;
    ChannelMembership next =
        new ChannelMembership(
            identity,
            g.contains(RankSymbol.VOICE),
            g.contains(RankSymbol.HALF_OP),
            g.contains(RankSymbol.OP),
            g.contains(RankSymbol.ADMIN),
            g.contains(RankSymbol.OWNER),
            lastActivity);
    return next.equals(this) ? this : next;
  }

  public ChannelMembership withLastActivity(Instant at) {
    return new ChannelMembership(identity, voice, halfOp, op, admin, owner, at);
  }
}
