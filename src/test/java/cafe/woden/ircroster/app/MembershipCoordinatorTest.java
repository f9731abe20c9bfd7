package cafe.woden.ircroster.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircroster.config.RosterProperties;
import cafe.woden.ircroster.irc.InboundMessage;
import cafe.woden.ircroster.irc.ServerSupport;
import cafe.woden.ircroster.model.AwayState;
import cafe.woden.ircroster.model.Identity;
import cafe.woden.ircroster.model.IrcSession;
import cafe.woden.ircroster.model.RankSymbol;
import cafe.woden.ircroster.model.RosterChange;
import cafe.woden.ircroster.model.RosterChange.Kind;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MembershipCoordinatorTest {

  private static final String SID = "libera";

  private MembershipCoordinator coordinator;
  private TestSubscriber<RosterChange> changes;

  @BeforeEach
  void setUp() {
    coordinator = new MembershipCoordinator(RosterProperties.defaults());
    changes = coordinator.changes().test();
    coordinator.openSession(SID, "me");
    coordinator.handle(SID, InboundMessage.of("JOIN", "me!me@my.host", "#chan", "#chan"));
    coordinator.handle(
        SID,
        InboundMessage.of(
            "353", "irc.server", "", "me", "=", "#chan", "@me @alice +bob!b@bob.host"));
    coordinator.handle(
        SID, InboundMessage.of("366", "irc.server", "", "me", "#chan", "End of /NAMES list."));
  }

  @Test
  void namesListingPopulatesRosterAndPublishesSync() {
    assertEquals(3, coordinator.membersOf(SID, "#chan").size());
    assertTrue(coordinator.isOp(SID, "#chan", "alice"));
    assertTrue(coordinator.isVoice(SID, "#CHAN", "Bob"));
    assertEquals(2, coordinator.operatorCount(SID, "#chan"));
    assertEquals("bob.host", coordinator.identityOf(SID, "bob").orElseThrow().host());

    changes.assertNoErrors();
    assertTrue(
        changes.values().contains(RosterChange.channelWide(SID, "#chan", Kind.ROSTER_SYNCED)));
  }

  @Test
  void channelModeLineUpdatesRanks() {
    coordinator.handle(
        SID, InboundMessage.of("MODE", "alice!a@h", "#chan", "#chan", "-o+v", "alice", "alice"));

    assertFalse(coordinator.isOp(SID, "#chan", "alice"));
    assertTrue(coordinator.isVoice(SID, "#chan", "alice"));
    assertTrue(coordinator.hasRank(SID, "#chan", "alice", RankSymbol.VOICE));
  }

  @Test
  void userModeLinesAreIgnored() {
    int before = changes.values().size();

    coordinator.handle(SID, InboundMessage.of("MODE", "me", "", "me", "+i"));

    assertEquals(before, changes.values().size());
  }

  @Test
  void nickChangeMovesIdentity() {
    Identity alice = coordinator.identityOf(SID, "alice").orElseThrow();

    coordinator.handle(SID, InboundMessage.of("NICK", "alice!a@h", "", "alicia"));

    assertTrue(coordinator.identityOf(SID, "alice").isEmpty());
    assertEquals(alice, coordinator.identityOf(SID, "alicia").orElseThrow());
    assertTrue(coordinator.isOp(SID, "#chan", "alicia"));
    assertTrue(
        changes.values().contains(new RosterChange(SID, "#chan", Kind.MEMBER_RENAMED, "alicia")));
  }

  @Test
  void nickChangeForUnknownUserIsIgnored() {
    coordinator.handle(SID, InboundMessage.of("NICK", "ghost!g@h", "", "spirit"));

    changes.assertNoErrors();
    assertTrue(coordinator.identityOf(SID, "spirit").isEmpty());
  }

  @Test
  void extendedJoinCarriesRealName() {
    coordinator.handle(
        SID,
        InboundMessage.of("JOIN", "carol!c@carol.host", "#chan", "#chan", "carolacct", "Carol R"));

    Identity carol = coordinator.identityOf(SID, "carol").orElseThrow();
    assertEquals("Carol R", carol.realName());
    assertEquals("carol!c@carol.host", carol.hostmask());
  }

  @Test
  void partKickAndQuitRemoveMembers() {
    coordinator.handle(SID, InboundMessage.of("KICK", "alice!a@h", "#chan", "#chan", "bob", "bye"));
    assertTrue(coordinator.identityOf(SID, "bob").isEmpty());

    coordinator.handle(SID, InboundMessage.of("QUIT", "alice!a@h", "", "Quit: later"));
    assertTrue(coordinator.identityOf(SID, "alice").isEmpty());
    assertEquals(1, coordinator.membersOf(SID, "#chan").size());

    coordinator.handle(SID, InboundMessage.of("PART", "me!me@my.host", "#chan", "#chan"));
    assertTrue(coordinator.membersOf(SID, "#chan").isEmpty());
    assertTrue(
        changes.values().contains(RosterChange.channelWide(SID, "#chan", Kind.ROSTER_CLOSED)));
  }

  @Test
  void whoReplyFillsDetailsAndAwayState() {
    coordinator.handle(
        SID,
        InboundMessage.of(
            "352", "irc.server", "", "me", "#chan", "bobu", "bob.host", "irc.server", "bob",
            "G+", "0 Bob Builder"));

    Identity bob = coordinator.identityOf(SID, "bob").orElseThrow();
    assertEquals("Bob Builder", bob.realName());
    assertEquals("b", bob.user());
    assertEquals(AwayState.AWAY, bob.awayState());
  }

  @Test
  void whoisFillsDetailsForKnownUsersOnly() {
    coordinator.handle(
        SID,
        InboundMessage.of(
            "311", "irc.server", "", "me", "alice", "ali", "alice.host", "*", "Alice Liddell"));
    coordinator.handle(
        SID,
        InboundMessage.of(
            "311", "irc.server", "", "me", "stranger", "s", "s.host", "*", "Stranger"));

    Identity alice = coordinator.identityOf(SID, "alice").orElseThrow();
    assertEquals("alice!ali@alice.host", alice.hostmask());
    assertEquals("Alice Liddell", alice.realName());
    assertTrue(coordinator.identityOf(SID, "stranger").isEmpty());
  }

  @Test
  void awayNotifyAndChghost() {
    coordinator.handle(SID, InboundMessage.of("AWAY", "alice!a@h", "", "lunch"));
    coordinator.handle(SID, InboundMessage.of("CHGHOST", "alice!a@h", "", "ali", "cloak/alice"));
    coordinator.handle(SID, InboundMessage.of("SETNAME", "alice!ali@cloak/alice", "", "A. L."));

    Identity alice = coordinator.identityOf(SID, "alice").orElseThrow();
    assertEquals(AwayState.AWAY, alice.awayState());
    assertEquals("lunch", alice.awayMessage());
    assertEquals("alice!ali@cloak/alice", alice.hostmask());
    assertEquals("A. L.", alice.realName());
    assertTrue(changes.values().contains(new RosterChange(SID, "#chan", Kind.USER_CHANGED, "alice")));
  }

  @Test
  void channelMessageStampsActivity() {
    InboundMessage msg = InboundMessage.of("PRIVMSG", "alice!a@h", "#chan", "#chan", "hello");

    coordinator.handle(SID, msg);

    IrcSession session = coordinator.session(SID).orElseThrow();
    assertEquals(msg.at(), session.membership("#chan", "alice").lastActivity());
  }

  @Test
  void channelModeIsReplyUpdatesChannelModes() {
    coordinator.handle(SID, InboundMessage.of("324", "irc.server", "", "me", "#chan", "+ntl", "25"));

    assertEquals(Integer.valueOf(25), coordinator.channelModes(SID, "#chan").limit());
    assertEquals(Set.of('n', 't'), coordinator.channelModes(SID, "#chan").flags());
  }

  @Test
  void channelModeIsReplyDropsModesNoLongerListed() {
    coordinator.handle(SID, InboundMessage.of("MODE", "alice!a@h", "#chan", "#chan", "+mk", "pw"));

    coordinator.handle(SID, InboundMessage.of("324", "irc.server", "", "me", "#chan", "+nt"));

    assertEquals(Set.of('n', 't'), coordinator.channelModes(SID, "#chan").flags());
    assertNull(coordinator.channelModes(SID, "#chan").key());
    assertEquals("+nt", coordinator.channelModes(SID, "#chan").summary());
  }

  @Test
  void namesForChannelWithoutRosterIsIgnored() {
    coordinator.handle(
        SID, InboundMessage.of("353", "irc.server", "", "me", "=", "#other", "dave erin"));

    assertTrue(coordinator.identityOf(SID, "dave").isEmpty());
    assertTrue(coordinator.membersOf(SID, "#other").isEmpty());
  }

  @Test
  void namesWithoutChannelSymbolStillParses() {
    coordinator.handle(SID, InboundMessage.of("353", "irc.server", "", "me", "#chan", "+dave"));
    coordinator.handle(SID, InboundMessage.of("366", "irc.server", "", "me", "#chan", "End"));

    assertTrue(coordinator.isVoice(SID, "#chan", "dave"));
    assertTrue(coordinator.identityOf(SID, "alice").isEmpty());
  }

  @Test
  void serverSupportSwapsPrefixTable() {
    coordinator.applyServerSupport(SID, ServerSupport.of("(ov)@+", ""));
    coordinator.handle(SID, InboundMessage.of("MODE", "alice!a@h", "#chan", "#chan", "+h", "bob"));

    assertFalse(coordinator.isHalfOp(SID, "#chan", "bob"));
    assertEquals(Set.of('h'), coordinator.channelModes(SID, "#chan").flags());
  }

  @Test
  void welcomeSetsOwnNick() {
    coordinator.openSession("oftc", "");
    coordinator.handle("oftc", InboundMessage.of("001", "irc.oftc.net", "", "me2", "Welcome"));

    assertEquals("me2", coordinator.session("oftc").orElseThrow().ownNick());
  }

  @Test
  void eventsForUnknownServerAreDropped() {
    int before = changes.values().size();

    coordinator.handle("nowhere", InboundMessage.of("JOIN", "x!x@x", "#x", "#x"));

    assertEquals(before, changes.values().size());
    assertTrue(coordinator.membersOf("nowhere", "#x").isEmpty());
    assertTrue(coordinator.identityOf("nowhere", "x").isEmpty());
  }

  @Test
  void disconnectClosesEveryRoster() {
    coordinator.onDisconnected(SID);

    assertTrue(coordinator.membersOf(SID, "#chan").isEmpty());
    assertTrue(coordinator.channelsOf(SID, "me").isEmpty());
    assertTrue(
        changes.values().contains(RosterChange.channelWide(SID, "#chan", Kind.ROSTER_CLOSED)));
    assertTrue(coordinator.session(SID).isPresent());

    coordinator.closeSession(SID);
    assertTrue(coordinator.session(SID).isEmpty());
    assertNull(coordinator.identityOf(SID, "me").orElse(null));
  }
}
