package cafe.woden.ircroster.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.jmolecules.ddd.annotation.Entity;

/**
 * Session-wide record for one nickname, shared by every channel roster the user appears on.
 *
 * <p>Owned by {@link IdentityRegistry}; all mutation happens under the owning session's write
 * lock. Fields are volatile so UI threads may read them without the lock.
 *
 * <p>{@link #channelContexts()} holds the folded names of the channels whose roster references
 * this identity. The identity is discarded when that set becomes empty.
 */
@Entity
public final class Identity {

  private volatile String foldKey;
  private volatile String nick;
  private volatile String user = "";
  private volatile String host = "";
  private volatile String realName = "";
  private volatile String info = "";
  private volatile AwayState awayState = AwayState.UNKNOWN;
  private volatile String awayMessage;
  private volatile Set<String> channelContexts = Set.of();

  Identity(String foldKey, String nick) {
    this.foldKey = Objects.requireNonNull(foldKey, "foldKey");
    this.nick = Objects.requireNonNull(nick, "nick");
  }

  public String foldKey() {
    return foldKey;
  }

  public String nick() {
    return nick;
  }

  public String user() {
    return user;
  }

  public String host() {
    return host;
  }

  public String realName() {
    return realName;
  }

  public String info() {
    return info;
  }

  public AwayState awayState() {
    return awayState;
  }

  /** Away reason; only present while {@link #awayState()} is {@link AwayState#AWAY}. */
  public String awayMessage() {
    return awayMessage;
  }

  /** {@code nick!user@host}, with {@code *} for unknown parts. */
  public String hostmask() {
    String u = user.isEmpty() ? "*" : user;
    String h = host.isEmpty() ? "*" : host;
    return nick + "!" + u + "@" + h;
  }

  /** Immutable snapshot of the folded channel names referencing this identity. */
  public Set<String> channelContexts() {
    return channelContexts;
  }

  void renameTo(String newFoldKey, String newNick) {
    this.foldKey = newFoldKey;
    this.nick = newNick;
  }

  /**
   * Fills previously-empty fields from {@code attrs}.
   *
   * @return true if any field changed
   */
  boolean mergeMissing(IdentityAttributes attrs) {
    if (attrs == null || attrs.isEmpty()) return false;
    boolean changed = false;
    if (user.isEmpty() && !attrs.user().isEmpty()) {
      user = attrs.user();
      changed = true;
    }
    if (host.isEmpty() && !attrs.host().isEmpty()) {
      host = attrs.host();
      changed = true;
    }
    if (realName.isEmpty() && !attrs.realName().isEmpty()) {
      realName = attrs.realName();
      changed = true;
    }
    if (info.isEmpty() && !attrs.info().isEmpty()) {
      info = attrs.info();
      changed = true;
    }
    return changed;
  }

  boolean replaceUserHost(String newUser, String newHost) {
    IdentityAttributes a = IdentityAttributes.ofUserHost(newUser, newHost);
    if (a.user().equals(user) && a.host().equals(host)) return false;
    user = a.user();
    host = a.host();
    return true;
  }

  boolean replaceRealName(String newRealName) {
    String r = Objects.toString(newRealName, "").trim();
    if (r.equals(realName)) return false;
    realName = r;
    return true;
  }

  boolean updateAway(AwayState state, String message) {
    AwayState s = state == null ? AwayState.UNKNOWN : state;
    String m = Objects.toString(message, "").trim();
    String next = (s == AwayState.AWAY && !m.isEmpty()) ? m : null;
    // A bare AWAY without a reason keeps the reason we already know.
    if (s == AwayState.AWAY && next == null && awayState == AwayState.AWAY) next = awayMessage;
    if (s == awayState && Objects.equals(next, awayMessage)) return false;
    awayState = s;
    awayMessage = next;
    return true;
  }

  boolean addContext(String channelKey) {
    if (channelContexts.contains(channelKey)) return false;
    Set<String> next = new LinkedHashSet<>(channelContexts);
    next.add(channelKey);
    channelContexts = Collections.unmodifiableSet(next);
    return true;
  }

  boolean removeContext(String channelKey) {
    if (!channelContexts.contains(channelKey)) return false;
    Set<String> next = new LinkedHashSet<>(channelContexts);
    next.remove(channelKey);
    channelContexts = Collections.unmodifiableSet(next);
    return true;
  }

  void replaceContexts(Set<String> contexts) {
    channelContexts =
        contexts == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(contexts));
  }

  @Override
  public String toString() {
    return "Identity{" + hostmask() + ", channels=" + channelContexts + "}";
  }
}
