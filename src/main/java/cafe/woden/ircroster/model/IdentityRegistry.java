package cafe.woden.ircroster.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * One {@link Identity} per folded nickname for a single session.
 *
 * <p>Identities are reference-counted by channel context: {@link #attach} adds a channel to an
 * identity's context set and {@link #release} removes it, erasing the identity once no channel
 * references it. Not thread-safe on its own; {@link IrcSession} guards it with its lock.
 */
public final class IdentityRegistry {

  private final Map<String, Identity> byFoldKey = new LinkedHashMap<>();
  private final Consumer<Identity> onChanged;
  private CaseFolder folder;

  /**
   * @param onChanged invoked when an existing identity's attributes change, so the owner can
   *     notify every channel the identity belongs to
   */
  public IdentityRegistry(CaseFolder folder, Consumer<Identity> onChanged) {
    this.folder = Objects.requireNonNull(folder, "folder");
    this.onChanged = onChanged == null ? i -> {} : onChanged;
  }

  public IdentityRegistry(CaseFolder folder) {
    this(folder, null);
  }

  public CaseFolder folder() {
    return folder;
  }

  /**
   * Returns the identity for {@code nick}, creating it if needed.
   *
   * <p>For an existing identity, non-empty {@code attrs} fill fields that are still empty and the
   * display nickname takes the case of {@code nick}; if that changes anything the change callback
   * fires. A freshly created identity has no channel context
   * yet and must be {@linkplain #attach attached} by the caller.
   */
  public Identity getOrCreate(String nick, IdentityAttributes attrs) {
    String n = norm(nick);
    if (n.isEmpty()) throw new IllegalArgumentException("nick must not be blank");
    String key = folder.fold(n);

    Identity existing = byFoldKey.get(key);
    if (existing != null) {
      boolean changed = existing.mergeMissing(attrs);
      if (!existing.nick().equals(n)) {
        existing.renameTo(key, n);
        changed = true;
      }
      if (changed) onChanged.accept(existing);
      return existing;
    }

    Identity created = new Identity(key, n);
    created.mergeMissing(attrs);
    byFoldKey.put(key, created);
    return created;
  }

  public Identity lookup(String nick) {
    String n = norm(nick);
    if (n.isEmpty()) return null;
    return byFoldKey.get(folder.fold(n));
  }

  /** Display nicknames of every known identity. */
  public Set<String> allNicks() {
    Set<String> out = new LinkedHashSet<>();
    for (Identity i : byFoldKey.values()) out.add(i.nick());
    return Collections.unmodifiableSet(out);
  }

  public int size() {
    return byFoldKey.size();
  }

  /**
   * Moves the identity known as {@code oldNick} to {@code newNick}, keeping the same object.
   *
   * <p>The caller re-keys roster entries for every channel in the identity's context set within
   * the same critical section.
   *
   * @throws UnknownIdentityException if {@code oldNick} is not known
   * @throws IllegalStateException if {@code newNick} already belongs to a different identity
   */
  public Identity rename(String oldNick, String newNick) {
    Identity identity = lookup(oldNick);
    if (identity == null) throw new UnknownIdentityException(norm(oldNick));

    String n = norm(newNick);
    if (n.isEmpty()) throw new IllegalArgumentException("newNick must not be blank");
    String newKey = folder.fold(n);
    String oldKey = identity.foldKey();

    if (newKey.equals(oldKey)) {
      identity.renameTo(oldKey, n);
      return identity;
    }

    Identity clash = byFoldKey.get(newKey);
    if (clash != null) {
      throw new IllegalStateException("nickname already in use by another identity: " + n);
    }

    byFoldKey.remove(oldKey);
    identity.renameTo(newKey, n);
    byFoldKey.put(newKey, identity);
    return identity;
  }

  /** Adds {@code channelKey} to the identity's context set. */
  boolean attach(Identity identity, String channelKey) {
    if (identity == null || channelKey == null) return false;
    if (byFoldKey.get(identity.foldKey()) != identity) return false;
    return identity.addContext(channelKey);
  }

  /**
   * Drops {@code channelKey} from the identity known as {@code nick}.
   *
   * @return true if the identity was erased because no channel references it any more
   */
  public boolean release(String nick, String channelKey) {
    Identity identity = lookup(nick);
    if (identity == null || channelKey == null) return false;
    identity.removeContext(channelKey);
    return eraseIfUnreferenced(identity);
  }

  boolean eraseIfUnreferenced(Identity identity) {
    if (!identity.channelContexts().isEmpty()) return false;
    return byFoldKey.remove(identity.foldKey(), identity);
  }

  void notifyChanged(Identity identity) {
    onChanged.accept(identity);
  }

  /**
   * Re-keys every identity under {@code newFolder} and remaps their channel contexts.
   *
   * @return identities that collided with an earlier one under the new folding and were dropped;
   *     the caller removes their roster entries
   */
  List<Identity> rebuild(CaseFolder newFolder, UnaryOperator<String> channelKeyRemap) {
    this.folder = Objects.requireNonNull(newFolder, "newFolder");
    List<Identity> all = new ArrayList<>(byFoldKey.values());
    byFoldKey.clear();

    List<Identity> dropped = new ArrayList<>();
    for (Identity identity : all) {
      Set<String> contexts = new LinkedHashSet<>();
      for (String ctx : identity.channelContexts()) contexts.add(channelKeyRemap.apply(ctx));
      identity.replaceContexts(contexts);

      String key = newFolder.fold(identity.nick());
      if (byFoldKey.containsKey(key)) {
        dropped.add(identity);
        continue;
      }
      identity.renameTo(key, identity.nick());
      byFoldKey.put(key, identity);
    }
    return dropped;
  }

  void clear() {
    for (Identity identity : byFoldKey.values()) identity.replaceContexts(Set.of());
    byFoldKey.clear();
  }

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }
}
