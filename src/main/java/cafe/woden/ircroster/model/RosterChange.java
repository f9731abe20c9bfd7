package cafe.woden.ircroster.model;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Published after a mutation commits, naming the channel whose roster or modes changed.
 *
 * @param channel channel name as the roster knows it
 * @param nick affected nickname, or empty for channel-wide changes
 */
@ValueObject
public record RosterChange(String serverId, String channel, Kind kind, String nick) {

  public enum Kind {
    MEMBER_JOINED,
    MEMBER_LEFT,
    MEMBER_RENAMED,
    RANKS_CHANGED,
    USER_CHANGED,
    CHANNEL_MODES_CHANGED,
    ROSTER_SYNCED,
    ROSTER_CLOSED
  }

  public RosterChange {
    serverId = Objects.toString(serverId, "").trim();
    channel = Objects.toString(channel, "").trim();
    Objects.requireNonNull(kind, "kind");
    nick = Objects.toString(nick, "").trim();
  }

  public static RosterChange channelWide(String serverId, String channel, Kind kind) {
    return new RosterChange(serverId, channel, kind, "");
  }
}
