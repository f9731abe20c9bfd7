package cafe.woden.ircroster.app.api;

import cafe.woden.ircroster.model.ChannelMembership;
import cafe.woden.ircroster.model.ChannelModes;
import cafe.woden.ircroster.model.Identity;
import cafe.woden.ircroster.model.RankSymbol;
import cafe.woden.ircroster.model.RosterChange;
import io.reactivex.rxjava3.core.Flowable;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read side of membership tracking, for UI and formatting code.
 *
 * <p>All results are snapshots; unknown servers, channels or nicknames yield empty results or
 * {@code false} rather than errors.
 */
public interface RosterQueryPort {

  /** Fires after every committed mutation, naming the affected channel. */
  Flowable<RosterChange> changes();

  /** Unordered snapshot; callers sort for display. */
  List<ChannelMembership> membersOf(String serverId, String channel);

  boolean hasRank(String serverId, String channel, String nick, RankSymbol rank);

  default boolean isOwner(String serverId, String channel, String nick) {
    return hasRank(serverId, channel, nick, RankSymbol.OWNER);
  }

  default boolean isAdmin(String serverId, String channel, String nick) {
    return hasRank(serverId, channel, nick, RankSymbol.ADMIN);
  }

  default boolean isOp(String serverId, String channel, String nick) {
    return hasRank(serverId, channel, nick, RankSymbol.OP);
  }

  default boolean isHalfOp(String serverId, String channel, String nick) {
    return hasRank(serverId, channel, nick, RankSymbol.HALF_OP);
  }

  default boolean isVoice(String serverId, String channel, String nick) {
    return hasRank(serverId, channel, nick, RankSymbol.VOICE);
  }

  int operatorCount(String serverId, String channel);

  Optional<Identity> identityOf(String serverId, String nick);

  Set<String> channelsOf(String serverId, String nick);

  ChannelModes channelModes(String serverId, String channel);
}
