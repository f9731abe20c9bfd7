package cafe.woden.ircroster.app;

import cafe.woden.ircroster.app.api.RosterQueryPort;
import cafe.woden.ircroster.config.RosterProperties;
import cafe.woden.ircroster.irc.InboundMessage;
import cafe.woden.ircroster.irc.ServerSupport;
import cafe.woden.ircroster.model.CaseFoldVariant;
import cafe.woden.ircroster.model.ChannelMembership;
import cafe.woden.ircroster.model.ChannelModeTypes;
import cafe.woden.ircroster.model.ChannelModes;
import cafe.woden.ircroster.model.Identity;
import cafe.woden.ircroster.model.IdentityAttributes;
import cafe.woden.ircroster.model.IrcSession;
import cafe.woden.ircroster.model.PrefixTable;
import cafe.woden.ircroster.model.RankSymbol;
import cafe.woden.ircroster.model.RosterChange;
import cafe.woden.ircroster.model.UnknownIdentityException;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies decoded IRC events to the per-connection {@link IrcSession}s and publishes the
 * resulting {@link RosterChange}s.
 *
 * <p>Each server id owns one session; sessions share nothing. Events for one server must arrive
 * sequentially, in protocol order.
 */
@Component
@ApplicationLayer
public class MembershipCoordinator implements RosterQueryPort {
  private static final Logger log = LoggerFactory.getLogger(MembershipCoordinator.class);

  static final String RPL_WELCOME = "001";
  static final String RPL_WHOISUSER = "311";
  static final String RPL_CHANNELMODEIS = "324";
  static final String RPL_WHOREPLY = "352";
  static final String RPL_NAMREPLY = "353";
  static final String RPL_ENDOFNAMES = "366";

  private final RosterProperties props;
  private final ConcurrentHashMap<String, IrcSession> sessions = new ConcurrentHashMap<>();

  private final FlowableProcessor<RosterChange> changes =
      PublishProcessor.<RosterChange>create().toSerialized();

  public MembershipCoordinator(RosterProperties props) {
    this.props = props == null ? RosterProperties.defaults() : props;
  }

  @Override
  public Flowable<RosterChange> changes() {
    return changes.onBackpressureBuffer();
  }

  /** Returns the session for {@code serverId}, creating it with the configured defaults. */
  public IrcSession openSession(String serverId, String ownNick) {
    String sid = norm(serverId);
    if (sid.isEmpty()) throw new IllegalArgumentException("serverId must not be blank");
    IrcSession session =
        sessions.computeIfAbsent(
            sid,
            k ->
                new IrcSession(
                    k,
                    props.caseFoldVariant(),
                    props.prefixTable(),
                    props.channelModeTypes(),
                    props.chanTypes()));
    String nick = norm(ownNick);
    if (!nick.isEmpty()) session.setOwnNick(nick);
    return session;
  }

  public Optional<IrcSession> session(String serverId) {
    String sid = norm(serverId);
    if (sid.isEmpty()) return Optional.empty();
    return Optional.ofNullable(sessions.get(sid));
  }

  /** Connection lost: every roster of the session is dropped, the session itself stays. */
  public void onDisconnected(String serverId) {
    session(serverId).ifPresent(s -> publish(s.clear()));
  }

  /** Forgets the session entirely. */
  public void closeSession(String serverId) {
    String sid = norm(serverId);
    if (sid.isEmpty()) return;
    IrcSession removed = sessions.remove(sid);
    if (removed != null) publish(removed.clear());
  }

  /** Applies values from ISUPPORT; blank fields keep the current setting. */
  public void applyServerSupport(String serverId, ServerSupport support) {
    if (support == null) return;
    IrcSession session = session(serverId).orElse(null);
    if (session == null) return;

    CaseFoldVariant variant =
        support.casemapping().isEmpty() ? null : CaseFoldVariant.fromToken(support.casemapping());
    PrefixTable prefixes = support.prefix().isEmpty() ? null : PrefixTable.parse(support.prefix());
    ChannelModeTypes modeTypes =
        support.chanModes().isEmpty() ? null : ChannelModeTypes.parse(support.chanModes());

    if (log.isDebugEnabled()) {
      log.debug("ROSTER isupport serverId={} casemapping={} prefix={} chanmodes={} chantypes={}",
          session.serverId(), variant, prefixes, modeTypes, support.chanTypes());
    }
    publish(session.updateServerSupport(variant, prefixes, modeTypes, support.chanTypes()));
  }

  /** Applies one decoded event. Events for servers without a session are ignored. */
  public void handle(String serverId, InboundMessage msg) {
    if (msg == null) return;
    IrcSession session = session(serverId).orElse(null);
    if (session == null) {
      if (log.isDebugEnabled()) {
        log.debug("ROSTER drop (no session) serverId={} command={}", serverId, msg.command());
      }
      return;
    }

    if (log.isDebugEnabled()) {
      log.debug("ROSTER event serverId={} command={} from={} target={} params={}",
          session.serverId(), msg.command(), msg.sourceNick(), msg.targetChannel(),
          clip(msg.params()));
    }

    List<RosterChange> out;
    try {
      out = dispatch(session, msg);
    } catch (UnknownIdentityException e) {
      log.warn("ROSTER out of sync with protocol stream serverId={} command={} nick={}",
          session.serverId(), msg.command(), e.nick());
      throw e;
    }
    publish(out);
  }

  private List<RosterChange> dispatch(IrcSession session, InboundMessage msg) {
    return switch (msg.command()) {
      case "JOIN" -> onJoin(session, msg);
      case "PART" -> session.part(channelOf(msg, 0), msg.sourceNick());
      case "KICK" -> session.kick(channelOf(msg, 0), msg.param(1));
      case "QUIT" -> session.quit(msg.sourceNick());
      case "NICK" -> onNick(session, msg);
      case "MODE" -> onMode(session, channelOf(msg, 0), msg.param(1), tail(msg.params(), 2));
      case "PRIVMSG", "NOTICE" -> onMessage(session, msg);
      case "AWAY" -> session.away(msg.sourceNick(), msg.param(0));
      case "CHGHOST" -> session.changeHost(msg.sourceNick(), msg.param(0), msg.param(1));
      case "SETNAME" -> session.changeRealName(msg.sourceNick(), msg.param(0));
      case RPL_WELCOME -> onWelcome(session, msg);
      case RPL_NAMREPLY -> onNames(session, msg);
      case RPL_ENDOFNAMES -> session.endNames(msg.param(1));
      case RPL_WHOREPLY -> onWho(session, msg);
      case RPL_WHOISUSER -> session.mergeAttributes(
          msg.param(1), new IdentityAttributes(msg.param(2), msg.param(3), msg.param(5), ""));
      case RPL_CHANNELMODEIS -> onChannelModeIs(session, msg);
      default -> List.of();
    };
  }

  private List<RosterChange> onJoin(IrcSession session, InboundMessage msg) {
    // extended-join: JOIN <channel> <account> :<realname>
    String realName = msg.params().size() >= 3 ? msg.param(2) : "";
    IdentityAttributes attrs =
        new IdentityAttributes(msg.sourceUser(), msg.sourceHost(), realName, "");
    return session.join(channelOf(msg, 0), msg.sourceNick(), attrs);
  }

  private List<RosterChange> onNick(IrcSession session, InboundMessage msg) {
    String oldNick = msg.sourceNick();
    String newNick = msg.param(0);
    if (oldNick.isEmpty() || newNick.isEmpty()) return List.of();

    boolean own = session.caseFolder().same(session.ownNick(), oldNick);
    if (!own && session.identityOf(oldNick) == null) {
      // Nobody we share a channel with.
      if (log.isDebugEnabled()) {
        log.debug("ROSTER ignore NICK for unknown user serverId={} {} -> {}",
            session.serverId(), oldNick, newNick);
      }
      return List.of();
    }
    return session.renameUser(oldNick, newNick);
  }

  private List<RosterChange> onMode(
      IrcSession session, String target, String modeField, List<String> args) {
    if (!session.isChannelName(target)) return List.of();
    if (!session.hasChannel(target)) {
      if (log.isDebugEnabled()) {
        log.debug("ROSTER ignore MODE for channel without roster serverId={} channel={} modes={}",
            session.serverId(), target, modeField);
      }
      return List.of();
    }
    return session.applyMode(target, modeField, args);
  }

  private List<RosterChange> onChannelModeIs(IrcSession session, InboundMessage msg) {
    // 324 <me> <channel> <modes> [args...]: the complete set, not a delta.
    String channel = msg.param(1);
    if (!session.hasChannel(channel)) return List.of();
    return session.seedChannelModes(channel, msg.param(2), tail(msg.params(), 3));
  }

  private List<RosterChange> onMessage(IrcSession session, InboundMessage msg) {
    String target = channelOf(msg, 0);
    if (msg.sourceNick().isEmpty() || !session.isChannelName(target)) return List.of();
    IdentityAttributes attrs = IdentityAttributes.ofUserHost(msg.sourceUser(), msg.sourceHost());
    return session.channelActivity(target, msg.sourceNick(), attrs, msg.at());
  }

  private List<RosterChange> onWelcome(IrcSession session, InboundMessage msg) {
    String me = msg.param(0);
    if (!me.isEmpty()) session.setOwnNick(me);
    return List.of();
  }

  private List<RosterChange> onNames(IrcSession session, InboundMessage msg) {
    // 353 <me> <symbol> <channel> :<names>; a few servers omit the symbol.
    int chanIdx = session.isChannelName(msg.param(2)) ? 2 : 1;
    String channel = msg.param(chanIdx);
    String names = msg.param(chanIdx + 1);
    if (!session.hasChannel(channel)) {
      if (log.isDebugEnabled()) {
        log.debug("ROSTER ignore NAMES for channel without roster serverId={} channel={}",
            session.serverId(), channel);
      }
      return List.of();
    }

    List<RosterChange> out = new ArrayList<>();
    if (!session.namesInProgress(channel)) out.addAll(session.beginNames(channel));
    for (String token : names.split("\\s+")) {
      if (token.isEmpty()) continue;
      out.addAll(session.namesEntry(channel, token));
    }
    return out;
  }

  private List<RosterChange> onWho(IrcSession session, InboundMessage msg) {
    // 352 <me> <channel> <user> <host> <server> <nick> <flags> :<hopcount> <realname>
    String trailing = msg.param(7);
    int sp = trailing.indexOf(' ');
    String realName = sp < 0 ? "" : trailing.substring(sp + 1).trim();
    IdentityAttributes attrs = new IdentityAttributes(msg.param(2), msg.param(3), realName, "");
    return session.whoReply(msg.param(1), msg.param(5), attrs, msg.param(6));
  }

  @Override
  public List<ChannelMembership> membersOf(String serverId, String channel) {
    return session(serverId).map(s -> s.membersOf(channel)).orElse(List.of());
  }

  @Override
  public boolean hasRank(String serverId, String channel, String nick, RankSymbol rank) {
    return session(serverId).map(s -> s.hasRank(channel, nick, rank)).orElse(false);
  }

  @Override
  public int operatorCount(String serverId, String channel) {
    return session(serverId).map(s -> s.operatorCount(channel)).orElse(0);
  }

  @Override
  public Optional<Identity> identityOf(String serverId, String nick) {
    return session(serverId).map(s -> s.identityOf(nick));
  }

  @Override
  public Set<String> channelsOf(String serverId, String nick) {
    return session(serverId).map(s -> s.channelsOf(nick)).orElse(Set.of());
  }

  @Override
  public ChannelModes channelModes(String serverId, String channel) {
    return session(serverId).map(s -> s.channelModes(channel)).orElse(ChannelModes.NONE);
  }

  private void publish(List<RosterChange> out) {
    if (out == null || out.isEmpty()) return;
    for (RosterChange change : out) changes.onNext(change);
  }

  private static String channelOf(InboundMessage msg, int paramIndex) {
    String target = msg.targetChannel();
    return target.isEmpty() ? msg.param(paramIndex) : target;
  }

  private static List<String> tail(List<String> params, int from) {
    if (params == null || params.size() <= from) return List.of();
    return List.copyOf(params.subList(from, params.size()));
  }

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }

  private static String clip(Object v) {
    if (v == null) return "<null>";
    String s = String.valueOf(v);
    s = s.replace('\n', ' ').replace('\r', ' ');
    if (s.length() > 220) return s.substring(0, 217) + "...";
    return s;
  }
}
