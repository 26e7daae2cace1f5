package com.wmux.upstream;

import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.WatchEvent;
import com.wmux.shared.WatchOptions;
import com.wmux.shared.WatchResponse;

import com.google.inject.Inject;

import io.etcd.jetcd.ByteSequence;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process revisioned key space with etcd-like watch semantics. Every
 * mutation bumps the store revision by one, starting from 1.
 *
 * <p>Meant for tests and the demo. Only the most recent events are kept for
 * start-revision replay; older ones are dropped, much like a compacted etcd.
 */
public class InMemoryWatchSource implements WatchSource {

    private final Map<ByteSequence, ByteSequence> data = new HashMap<>();
    public static final int DEFAULT_HISTORY_LIMIT = 10_000;

    private final Deque<WatchEvent> history = new ArrayDeque<>();
    private final int historyLimit;
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicInteger opened = new AtomicInteger();
    private long revision = 1;
    private boolean closed;

    @Inject
    public InMemoryWatchSource() {
        this(DEFAULT_HISTORY_LIMIT);
    }

    public InMemoryWatchSource(int historyLimit) {
        if (historyLimit <= 0) {
            throw new IllegalArgumentException("historyLimit must be > 0");
        }
        this.historyLimit = historyLimit;
    }

    @Override
    public synchronized WatchStream open(CancelScope scope, KeyRange range, WatchOptions options) {
        if (closed) {
            throw new WatchSourceException("Watch source is closed");
        }
        QueueWatchStream stream = new QueueWatchStream();
        Subscription sub = new Subscription(range, options, stream);
        opened.incrementAndGet();
        if (options.isCreatedNotify()) {
            stream.push(WatchResponse.created(revision, -1));
        }
        if (options.getStartRevision() > 0) {
            for (WatchEvent event : history) {
                if (event.getModRevision() >= options.getStartRevision() && range.contains(event.getKey())) {
                    stream.push(WatchResponse.events(event.getModRevision(), List.of(event)));
                }
            }
        }
        subscriptions.add(sub);
        scope.onCancel(() -> {
            subscriptions.remove(sub);
            stream.close();
        });
        return stream;
    }

    public synchronized long put(String key, String value) {
        ByteSequence k = bs(key);
        ByteSequence v = bs(value);
        revision++;
        data.put(k, v);
        dispatch(new WatchEvent(WatchEvent.Type.PUT, k, v, revision));
        return revision;
    }

    /**
     * Deletes {@code key}. Deleting an absent key leaves the revision unchanged.
     */
    public synchronized long delete(String key) {
        ByteSequence k = bs(key);
        if (data.remove(k) == null) {
            return revision;
        }
        revision++;
        dispatch(new WatchEvent(WatchEvent.Type.DELETE, k, ByteSequence.EMPTY, revision));
        return revision;
    }

    public synchronized String get(String key) {
        ByteSequence v = data.get(bs(key));
        return v != null ? v.toString(StandardCharsets.UTF_8) : null;
    }

    /**
     * Sends a progress marker at the current revision to every stream that
     * asked for progress notifications.
     */
    public synchronized void progress() {
        for (Subscription sub : subscriptions) {
            if (sub.options.isProgressNotify()) {
                sub.stream.push(WatchResponse.progress(revision));
            }
        }
    }

    public synchronized long getRevision() {
        return revision;
    }

    /**
     * Number of upstream streams ever opened against this source.
     */
    public int getOpenCount() {
        return opened.get();
    }

    public int getActiveCount() {
        return subscriptions.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
        for (Subscription sub : subscriptions) {
            sub.stream.close();
        }
        subscriptions.clear();
    }

    private void dispatch(WatchEvent event) {
        history.addLast(event);
        if (history.size() > historyLimit) {
            history.removeFirst();
        }
        for (Subscription sub : subscriptions) {
            if (sub.range.contains(event.getKey())) {
                sub.stream.push(WatchResponse.events(event.getModRevision(), List.of(event)));
            }
        }
    }

    private static ByteSequence bs(String s) {
        return ByteSequence.from(s, StandardCharsets.UTF_8);
    }

    private static final class Subscription {
        private final KeyRange range;
        private final WatchOptions options;
        private final QueueWatchStream stream;

        private Subscription(KeyRange range, WatchOptions options, QueueWatchStream stream) {
            this.range = range;
            this.options = options;
            this.stream = stream;
        }
    }
}
