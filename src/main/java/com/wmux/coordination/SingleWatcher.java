package com.wmux.coordination;

import com.wmux.receiver.Receiver;
import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.ReceiverId;
import com.wmux.shared.WatchOptions;
import com.wmux.shared.WatchResponse;
import com.wmux.upstream.WatchSource;
import com.wmux.upstream.WatchStream;

/**
 * A receiver served by its own private upstream stream. Used for watches
 * that cannot join a group yet, for example ones replaying history from a
 * start revision.
 *
 * <p>After every delivered response that leaves the receiver caught up
 * with the private stream, the delivery loop offers the watcher to the
 * registry. Only at that point is nothing read from the private
 * stream still on its way to the receiver, so {@link #canPromote()} only
 * reports true while the loop is parked there. On promotion the private
 * stream and its scope move to the new group and this loop exits without
 * reading again.
 */
public class SingleWatcher {

    private final Receiver receiver;
    private final WatchSource source;
    private final CancelScope scope;
    private final WatchGroupRegistry registry;

    private WatchStream stream;
    private Thread thread;
    private boolean parked;
    private boolean retired;
    private long lastRevision;

    public SingleWatcher(Receiver receiver, WatchSource source, CancelScope proxyScope,
                         WatchGroupRegistry registry) {
        this.receiver = receiver;
        this.source = source;
        this.scope = proxyScope.child();
        this.registry = registry;
    }

    public Receiver getReceiver() {
        return receiver;
    }

    public ReceiverId getReceiverId() {
        return receiver.getId();
    }

    public KeyRange getRange() {
        return receiver.getRange();
    }

    public synchronized void start() {
        if (stream != null) {
            throw new IllegalStateException("Single watcher already started: " + receiver.getId());
        }
        WatchOptions options = WatchOptions.builder()
                .progressNotify(true)
                .createdNotify(true)
                .startRevision(receiver.getStartRevision())
                .build();
        try {
            stream = source.open(scope, receiver.getRange(), options);
        } catch (RuntimeException e) {
            scope.cancel();
            throw e;
        }
        thread = new Thread(this::run, "wmux-single-" + receiver.getId().getConnectionId() +
                "-" + receiver.getId().getWatchId());
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * True only while the delivery loop is parked between reads with the
     * receiver acknowledged and caught up to the last revision read from
     * the private stream.
     */
    public synchronized boolean canPromote() {
        return parked
                && !retired
                && stream != null
                && !stream.isEnded()
                && !scope.isCancelled()
                && !receiver.isCancelled()
                && caughtUp();
    }

    public synchronized boolean isRetired() {
        return retired;
    }

    public synchronized long getLastRevision() {
        return lastRevision;
    }

    /**
     * Cancels the private stream. Returns false if the stream was already
     * handed to a group or stopped.
     */
    public synchronized boolean stop() {
        if (retired) {
            return false;
        }
        retired = true;
        scope.cancel();
        return true;
    }

    /**
     * Hands the private stream to a new group. The caller owns the group.
     */
    synchronized WatchGroup promote() {
        if (!canPromote()) {
            throw new IllegalStateException("Single watcher cannot be promoted: " + receiver.getId());
        }
        retired = true;
        return new WatchGroup(receiver.getRange(), stream, scope, lastRevision);
    }

    /**
     * Retires this watcher after its receiver joined an existing group.
     */
    synchronized void retire() {
        if (!retired) {
            retired = true;
            scope.cancel();
        }
    }

    void run() {
        try {
            while (true) {
                WatchResponse response = stream.next();
                if (response == null) {
                    return;
                }
                synchronized (this) {
                    if (retired) {
                        return;
                    }
                    lastRevision = Math.max(lastRevision, response.getRevision());
                }
                if (!receiver.forward(response) && receiver.isCancelled()) {
                    stop();
                    return;
                }
                if (caughtUp() && offerToRegistry()) {
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            System.err.println("[SingleWatcher] Delivery for " + receiver.getId() + " failed: " + e.getMessage());
            stop();
        }
    }

    private synchronized boolean caughtUp() {
        return receiver.isCreated() && receiver.getNextRevision() > lastRevision;
    }

    private boolean offerToRegistry() {
        synchronized (this) {
            if (retired) {
                return true;
            }
            parked = true;
        }
        try {
            return registry.maybeJoinWatcherSingle(this);
        } finally {
            synchronized (this) {
                parked = false;
            }
        }
    }

    synchronized Thread getThread() {
        return thread;
    }

    @Override
    public String toString() {
        return "SingleWatcher{receiver=" + receiver.getId() + ", retired=" + isRetired() + "}";
    }
}
