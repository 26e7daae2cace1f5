package com.wmux.receiver;

import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.ReceiverId;
import com.wmux.shared.WatchEvent;
import com.wmux.shared.WatchFilter;
import com.wmux.shared.WatchResponse;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Client-side end of one watch: an outbound queue plus the cancellation
 * scope of the client stream that drains it.
 *
 * <p>The first item a receiver delivers is always its created
 * acknowledgment, and it is delivered at most once. Responses that arrive
 * earlier are held until the acknowledgment goes out. After that only
 * events at or above the next expected revision pass.
 */
public class Receiver {

    private final ReceiverId id;
    private final KeyRange range;
    private final BlockingQueue<WatchResponse> queue;
    private final CancelScope scope;
    private final long sendTimeoutMs;
    private final long startRevision;
    private final boolean progressNotify;
    private final Set<WatchFilter> filters;

    private final List<WatchResponse> pending = new ArrayList<>();
    private volatile boolean evicted;
    private boolean created;
    private long nextRevision;

    public Receiver(ReceiverId id, KeyRange range, BlockingQueue<WatchResponse> queue,
                    CancelScope scope, long sendTimeoutMs) {
        this(id, range, queue, scope, sendTimeoutMs, 0, false, EnumSet.noneOf(WatchFilter.class));
    }

    public Receiver(ReceiverId id, KeyRange range, BlockingQueue<WatchResponse> queue,
                    CancelScope scope, long sendTimeoutMs, long startRevision,
                    boolean progressNotify, Set<WatchFilter> filters) {
        this.id = id;
        this.range = range;
        this.queue = queue;
        this.scope = scope;
        this.sendTimeoutMs = sendTimeoutMs;
        this.startRevision = startRevision;
        this.progressNotify = progressNotify;
        this.filters = filters.isEmpty() ? EnumSet.noneOf(WatchFilter.class) : EnumSet.copyOf(filters);
    }

    public ReceiverId getId() {
        return id;
    }

    public KeyRange getRange() {
        return range;
    }

    public BlockingQueue<WatchResponse> getQueue() {
        return queue;
    }

    public long getStartRevision() {
        return startRevision;
    }

    public boolean isCancelled() {
        return evicted || scope.isCancelled();
    }

    public void cancel() {
        scope.cancel();
    }

    public synchronized boolean isCreated() {
        return created;
    }

    /**
     * Lowest revision this receiver will still accept an event for.
     */
    public synchronized long getNextRevision() {
        return nextRevision;
    }

    /**
     * Forwards an upstream response. Returns false if the receiver is gone
     * or the response could not be enqueued in time.
     */
    public boolean forward(WatchResponse response) {
        boolean sent;
        synchronized (this) {
            sent = forwardLocked(response);
        }
        cancelIfEvicted();
        return sent;
    }

    /**
     * Sends a synthetic created acknowledgment at {@code revision}. No-op if
     * this receiver has already been acknowledged.
     */
    public boolean sendCreated(long revision) {
        boolean sent;
        synchronized (this) {
            sent = !created && !isCancelled() && acknowledge(revision);
        }
        cancelIfEvicted();
        return sent;
    }

    private boolean forwardLocked(WatchResponse response) {
        if (isCancelled()) {
            return false;
        }
        if (response.isCreated()) {
            if (created) {
                return true;
            }
            return acknowledge(response.getRevision());
        }
        if (!created) {
            pending.add(response);
            return true;
        }
        return deliver(response);
    }

    private boolean acknowledge(long revision) {
        created = true;
        nextRevision = startRevision > 0 ? startRevision : revision + 1;
        boolean sent = offer(WatchResponse.created(revision, id.getWatchId()));
        List<WatchResponse> held = new ArrayList<>(pending);
        pending.clear();
        for (WatchResponse response : held) {
            if (!deliver(response)) {
                break;
            }
        }
        return sent;
    }

    private boolean deliver(WatchResponse response) {
        if (response.isProgressNotify()) {
            if (response.getRevision() < nextRevision - 1) {
                return true;
            }
            // a progress marker at r means every event up to r has been sent
            nextRevision = response.getRevision() + 1;
            if (!progressNotify) {
                return true;
            }
            return offer(response.withWatchId(id.getWatchId()));
        }

        List<WatchEvent> kept = new ArrayList<>();
        long highest = 0;
        for (WatchEvent event : response.getEvents()) {
            highest = Math.max(highest, event.getModRevision());
            if (event.getModRevision() < nextRevision || dropped(event)) {
                continue;
            }
            kept.add(event);
        }
        if (highest >= nextRevision) {
            nextRevision = highest + 1;
        }
        if (kept.isEmpty()) {
            return true;
        }
        return offer(response.withEvents(kept).withWatchId(id.getWatchId()));
    }

    private boolean dropped(WatchEvent event) {
        for (WatchFilter filter : filters) {
            if (filter.drops(event)) {
                return true;
            }
        }
        return false;
    }

    private boolean offer(WatchResponse response) {
        if (isCancelled()) {
            return false;
        }
        try {
            if (queue.offer(response, sendTimeoutMs, TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        System.err.println("[Receiver] " + id + " did not accept a response within " +
                sendTimeoutMs + "ms, cancelling");
        evicted = true;
        return false;
    }

    // cancel callbacks may call back into the registry, so never run them under this monitor
    private void cancelIfEvicted() {
        if (evicted) {
            scope.cancel();
        }
    }

    @Override
    public String toString() {
        return "Receiver{id=" + id + ", range=" + range + "}";
    }
}
