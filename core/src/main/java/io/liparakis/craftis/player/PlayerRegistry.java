package io.liparakis.craftis.player;

import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Table of live players keyed by player id.
 * <p>
 * Id lifecycle: an id is allocated on {@link #register}, stops being live on
 * {@link #unregister}, and only becomes allocatable again after
 * {@link #reclaim}. This lets the caller announce a departure before the id
 * can be handed to a newcomer. Reclaimed ids are reused smallest first;
 * otherwise ids increase monotonically from 1.
 * </p>
 * <p>
 * Display names are unique among live players, ignoring case, so a name
 * always resolves to at most one player.
 * </p>
 * <p>
 * Every operation holds a single lock for the duration of a few map
 * operations and never performs I/O.
 * </p>
 */
public final class PlayerRegistry {
    private static final int NO_PLAYER = -1;
    private static final String DEFAULT_NAME_PREFIX = "guest";

    private final ReentrantLock lock = new ReentrantLock();
    private final Int2ObjectLinkedOpenHashMap<Player> players = new Int2ObjectLinkedOpenHashMap<>();
    private final Long2IntMap playerByConnection = new Long2IntOpenHashMap();
    private final IntSortedSet freeIds = new IntAVLTreeSet();
    private final IntOpenHashSet retiredIds = new IntOpenHashSet();
    private final Pose spawn;

    private int nextId = 1;

    public PlayerRegistry(Pose spawn) {
        this.spawn = Objects.requireNonNull(spawn, "spawn");
        playerByConnection.defaultReturnValue(NO_PLAYER);
    }

    public PlayerRegistry() {
        this(Pose.ORIGIN);
    }

    /**
     * Allocates an id and creates the player at the spawn pose.
     *
     * @param connectionId the owning connection
     * @param name         display name, or {@code null} for {@code guest<id>}
     *                     (suffixed if a live player already uses it)
     * @return the new player
     * @throws IllegalStateException if the connection already owns a player
     * @throws NameTakenException    if {@code name} is held by a live player
     */
    public Player register(long connectionId, @Nullable String name) {
        lock.lock();
        try {
            if (playerByConnection.get(connectionId) != NO_PLAYER) {
                throw new IllegalStateException("Connection " + connectionId + " already has a player");
            }
            if (name != null && findLocked(name) != null) {
                throw new NameTakenException(name);
            }
            int id = freeIds.isEmpty() ? nextId++ : takeSmallestFree();
            Player player = new Player(id, connectionId, name == null ? defaultName(id) : name, spawn);
            players.put(id, player);
            playerByConnection.put(connectionId, id);
            return player;
        } finally {
            lock.unlock();
        }
    }

    private String defaultName(int id) {
        String name = DEFAULT_NAME_PREFIX + id;
        String candidate = name;
        for (int suffix = 2; findLocked(candidate) != null; suffix++) {
            candidate = name + "_" + suffix;
        }
        return candidate;
    }

    private int takeSmallestFree() {
        int id = freeIds.firstInt();
        freeIds.remove(id);
        return id;
    }

    /**
     * Overwrites a player's pose.
     *
     * @return the updated player
     * @throws StaleReferenceException if the id is not live
     */
    public Player updateTransform(int playerId, Pose pose) {
        Objects.requireNonNull(pose, "pose");
        lock.lock();
        try {
            Player updated = require(playerId).withPose(pose);
            players.put(playerId, updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public Player updateTransform(int playerId, float x, float y, float z, float rx, float ry) {
        return updateTransform(playerId, new Pose(x, y, z, rx, ry));
    }

    /**
     * Changes a player's display name.
     *
     * @return the updated player
     * @throws StaleReferenceException if the id is not live
     * @throws NameTakenException      if another live player holds the name
     */
    public Player rename(int playerId, String name) {
        Objects.requireNonNull(name, "name");
        lock.lock();
        try {
            Player current = require(playerId);
            Player holder = findLocked(name);
            if (holder != null && holder.id() != playerId) {
                throw new NameTakenException(name);
            }
            Player updated = current.withName(name);
            players.put(playerId, updated);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a live player. The id stays reserved until {@link #reclaim}.
     *
     * @return the removed player, for the departure notice
     * @throws StaleReferenceException if the id is not live
     */
    public Player unregister(int playerId) {
        lock.lock();
        try {
            Player removed = players.remove(playerId);
            if (removed == null) {
                throw new StaleReferenceException(playerId);
            }
            playerByConnection.remove(removed.connectionId());
            retiredIds.add(playerId);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Makes a previously unregistered id allocatable again.
     *
     * @throws StaleReferenceException if the id was not unregistered or was
     *                                 already reclaimed
     */
    public void reclaim(int playerId) {
        lock.lock();
        try {
            if (!retiredIds.remove(playerId)) {
                throw new StaleReferenceException(playerId);
            }
            freeIds.add(playerId);
        } finally {
            lock.unlock();
        }
    }

    private Player require(int playerId) {
        Player player = players.get(playerId);
        if (player == null) {
            throw new StaleReferenceException(playerId);
        }
        return player;
    }

    // ==================== Queries ====================

    /**
     * @return the live player, or {@code null}
     */
    public @Nullable Player get(int playerId) {
        lock.lock();
        try {
            return players.get(playerId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finds a live player by name, ignoring case.
     */
    public @Nullable Player find(String name) {
        lock.lock();
        try {
            return findLocked(name);
        } finally {
            lock.unlock();
        }
    }

    private @Nullable Player findLocked(String name) {
        for (Player player : players.values()) {
            if (player.name().equalsIgnoreCase(name)) {
                return player;
            }
        }
        return null;
    }

    /**
     * Point-in-time view of every live player, in registration order. The
     * table is copied under the lock; the stream itself is evaluated lazily
     * against that copy.
     */
    public Stream<Player> list() {
        List<Player> copy;
        lock.lock();
        try {
            copy = new ArrayList<>(players.values());
        } finally {
            lock.unlock();
        }
        return copy.stream();
    }

    public int size() {
        lock.lock();
        try {
            return players.size();
        } finally {
            lock.unlock();
        }
    }

    public Pose spawn() {
        return spawn;
    }
}
