package com.wmux.coordination;

import com.wmux.receiver.Receiver;
import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.ReceiverId;
import com.wmux.shared.WatchResponse;
import com.wmux.upstream.WatchStream;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One upstream watch stream shared by every receiver watching the same
 * key range. A dedicated fan-out thread reads the stream and forwards each
 * response to the current receivers in read order.
 */
public class WatchGroup {

    /** Returned by {@link #add} and {@link #addIfCaughtUp} when the receiver was not added. */
    public static final long REJECTED = -1;

    private final KeyRange range;
    private final WatchStream stream;
    private final CancelScope scope;
    private final Map<ReceiverId, Receiver> receivers = new ConcurrentHashMap<>();
    private final AtomicLong revision;
    private boolean stopped;
    private Thread fanOut;

    WatchGroup(KeyRange range, WatchStream stream, CancelScope scope, long initialRevision) {
        this.range = range;
        this.stream = stream;
        this.scope = scope;
        this.revision = new AtomicLong(initialRevision);
    }

    public KeyRange getRange() {
        return range;
    }

    /**
     * Adds a receiver and returns the last revision this group has seen,
     * 0 if the upstream created notification has not arrived yet, or
     * {@link #REJECTED} if the group is stopped.
     */
    public synchronized long add(ReceiverId rid, Receiver receiver) {
        if (stopped) {
            return REJECTED;
        }
        // the fan-out thread advances the revision and snapshots receivers under
        // this monitor, so a receiver added at revision r gets everything after r
        receivers.put(rid, receiver);
        return revision.get();
    }

    /**
     * Adds a receiver that has already seen every revision up to
     * {@code seenRevision}. Returns {@link #REJECTED} without adding it if the
     * group is stopped or has moved past that revision, since the receiver
     * would miss what lies in between.
     */
    public synchronized long addIfCaughtUp(ReceiverId rid, Receiver receiver, long seenRevision) {
        if (stopped || revision.get() > seenRevision) {
            return REJECTED;
        }
        receivers.put(rid, receiver);
        return revision.get();
    }

    public synchronized void delete(ReceiverId rid) {
        receivers.remove(rid);
    }

    public boolean isEmpty() {
        return receivers.isEmpty();
    }

    public boolean contains(ReceiverId rid) {
        return receivers.containsKey(rid);
    }

    public int size() {
        return receivers.size();
    }

    public long revision() {
        return revision.get();
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    public void stop() {
        synchronized (this) {
            if (stopped) {
                return;
            }
            stopped = true;
        }
        scope.cancel();
    }

    synchronized void start() {
        if (fanOut != null) {
            return;
        }
        fanOut = new Thread(this::run, "wmux-group-" + range.getKey().toString(StandardCharsets.UTF_8));
        fanOut.setDaemon(true);
        fanOut.start();
    }

    synchronized Thread getFanOutThread() {
        return fanOut;
    }

    void run() {
        try {
            while (true) {
                WatchResponse response = stream.next();
                if (response == null) {
                    break;
                }
                List<Receiver> targets;
                synchronized (this) {
                    revision.accumulateAndGet(response.getRevision(), Math::max);
                    targets = new ArrayList<>(receivers.values());
                }
                broadcast(response, targets);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            System.err.println("[WatchGroup] Fan-out for " + range + " failed: " + e.getMessage());
        }
        if (!scope.isCancelled()) {
            System.out.println("[WatchGroup] Upstream for " + range + " ended with " +
                    receivers.size() + " receivers attached");
        }
    }

    private static void broadcast(WatchResponse response, List<Receiver> targets) {
        for (Receiver receiver : targets) {
            receiver.forward(response);
        }
    }

    @Override
    public String toString() {
        return "WatchGroup{range=" + range + ", receivers=" + receivers.size() +
                ", revision=" + revision.get() + ", stopped=" + isStopped() + "}";
    }
}
