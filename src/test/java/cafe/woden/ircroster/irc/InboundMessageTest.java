package cafe.woden.ircroster.irc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class InboundMessageTest {

  @Test
  void splitsFullSourcePrefix() {
    InboundMessage msg = InboundMessage.of("join", "alice!ali@alice.host", "#chan", "#chan");

    assertEquals("JOIN", msg.command());
    assertEquals("alice", msg.sourceNick());
    assertEquals("ali", msg.sourceUser());
    assertEquals("alice.host", msg.sourceHost());
    assertEquals("#chan", msg.targetChannel());
  }

  @Test
  void serverSourceStaysWhole() {
    InboundMessage msg = InboundMessage.of("353", "irc.example.net", "", "me", "=", "#chan", "a b");

    assertEquals("irc.example.net", msg.sourceNick());
    assertEquals("", msg.sourceUser());
    assertTrue(msg.isNumeric());
    assertEquals("a b", msg.param(3));
  }

  @Test
  void missingParamsAndNullsReadAsEmpty() {
    InboundMessage msg = InboundMessage.of("PART", null, null, "#chan", null);

    assertEquals(List.of("#chan", ""), msg.params());
    assertEquals("", msg.param(5));
    assertEquals("", msg.param(-1));
    assertEquals("", msg.sourceNick());
    assertFalse(msg.isNumeric());
  }
}
