package com.wmux.coordination;

import com.wmux.receiver.Receiver;
import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.ReceiverId;
import com.wmux.shared.WatchOptions;
import com.wmux.upstream.WatchSource;
import com.wmux.upstream.WatchStream;

import com.google.inject.Inject;
import com.google.inject.Singleton;

import java.util.HashMap;
import java.util.Map;

/**
 * Multiplexes receivers watching the same key range onto one upstream
 * stream. Keeps two indices over the same relationships, range to group and
 * receiver to group, and changes both under this object's monitor.
 *
 * <p>A group is stopped and dropped from the range index as soon as its
 * last receiver leaves, so a later watch on that range opens a fresh
 * upstream stream.
 */
@Singleton
public class WatchGroupRegistry {

    private final WatchSource source;
    private final CancelScope proxyScope;
    private final Map<KeyRange, WatchGroup> groups = new HashMap<>();
    private final Map<ReceiverId, WatchGroup> idToGroup = new HashMap<>();

    @Inject
    public WatchGroupRegistry(WatchSource source, CancelScope proxyScope) {
        this.source = source;
        this.proxyScope = proxyScope;
    }

    /**
     * Joins {@code receiver} to the group watching its range, opening a new
     * upstream stream if there is none. A receiver joining a group that has
     * already seen its created notification gets a synthetic one at the
     * group's revision.
     *
     * @throws IllegalArgumentException if the receiver asks for a start
     *         revision; history replay needs a {@link SingleWatcher}
     */
    public synchronized void addWatcher(ReceiverId rid, Receiver receiver) {
        if (receiver.getStartRevision() > 0) {
            throw new IllegalArgumentException("Receiver " + rid + " starts at revision " +
                    receiver.getStartRevision() + " and cannot be grouped");
        }
        detach(rid);

        KeyRange range = receiver.getRange();
        WatchGroup group = groups.get(range);
        if (group != null) {
            long revision = group.add(rid, receiver);
            if (revision != WatchGroup.REJECTED) {
                idToGroup.put(rid, group);
                if (revision != 0) {
                    receiver.sendCreated(revision);
                }
                return;
            }
            groups.remove(range);
        }

        CancelScope scope = proxyScope.child();
        WatchStream stream;
        try {
            stream = source.open(scope, range, WatchOptions.grouped());
        } catch (RuntimeException e) {
            scope.cancel();
            throw e;
        }
        group = new WatchGroup(range, stream, scope, 0);
        group.add(rid, receiver);
        groups.put(range, group);
        idToGroup.put(rid, group);
        group.start();
        System.out.println("[WatchGroupRegistry] Created group for " + range);
    }

    /**
     * Removes a receiver from its group, stopping the group if it was the
     * last one.
     */
    public synchronized RemoveResult removeWatcher(ReceiverId rid) {
        WatchGroup group = detach(rid);
        if (group == null) {
            return RemoveResult.NOT_FOUND;
        }
        return RemoveResult.found(group.revision());
    }

    /**
     * Tries to move a single watcher's receiver into a group, either by
     * joining the existing group for its range or by promoting the single
     * watcher's private stream into a new group. Returns false if the
     * existing group is stopped or ahead of the watcher's private stream, or
     * the watcher cannot be promoted; the watcher then stays private.
     */
    public synchronized boolean maybeJoinWatcherSingle(SingleWatcher single) {
        if (single.isRetired()) {
            return false;
        }
        ReceiverId rid = single.getReceiverId();
        Receiver receiver = single.getReceiver();
        KeyRange range = single.getRange();

        WatchGroup group = groups.get(range);
        if (group != null) {
            // a group ahead of the private stream has already fanned out
            // revisions this receiver has not seen; stay private until caught up
            if (group.addIfCaughtUp(rid, receiver, single.getLastRevision()) == WatchGroup.REJECTED) {
                return false;
            }
            detachOther(rid, group);
            idToGroup.put(rid, group);
            single.retire();
            return true;
        }

        if (!single.canPromote()) {
            return false;
        }
        detach(rid);
        group = single.promote();
        group.add(rid, receiver);
        groups.put(range, group);
        idToGroup.put(rid, group);
        group.start();
        System.out.println("[WatchGroupRegistry] Promoted " + rid + " into group for " + range +
                " at revision " + group.revision());
        return true;
    }

    /**
     * Stops every group. For proxy shutdown only.
     */
    public synchronized void stop() {
        for (WatchGroup group : groups.values()) {
            group.stop();
        }
        for (WatchGroup group : idToGroup.values()) {
            group.stop();
        }
        groups.clear();
        idToGroup.clear();
    }

    public synchronized int size() {
        return groups.size();
    }

    public synchronized boolean hasWatcher(ReceiverId rid) {
        return idToGroup.containsKey(rid);
    }

    synchronized WatchGroup groupFor(KeyRange range) {
        return groups.get(range);
    }

    synchronized Map<KeyRange, WatchGroup> groupIndex() {
        return new HashMap<>(groups);
    }

    synchronized Map<ReceiverId, WatchGroup> watcherIndex() {
        return new HashMap<>(idToGroup);
    }

    private WatchGroup detach(ReceiverId rid) {
        WatchGroup group = idToGroup.remove(rid);
        if (group == null) {
            return null;
        }
        group.delete(rid);
        if (group.isEmpty()) {
            group.stop();
            groups.remove(group.getRange(), group);
            System.out.println("[WatchGroupRegistry] Stopped group for " + group.getRange());
        }
        return group;
    }

    private void detachOther(ReceiverId rid, WatchGroup keep) {
        WatchGroup current = idToGroup.get(rid);
        if (current != null && current != keep) {
            detach(rid);
        }
    }
}
