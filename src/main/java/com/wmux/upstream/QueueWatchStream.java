package com.wmux.upstream;

import com.wmux.shared.WatchResponse;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Watch stream fed by a producer thread through an unbounded queue.
 */
public class QueueWatchStream implements WatchStream {

    private static final WatchResponse END = WatchResponse.progress(-1);

    private final BlockingQueue<WatchResponse> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean ended;

    public void push(WatchResponse response) {
        if (!closed.get()) {
            queue.add(response);
        }
    }

    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.add(END);
        }
    }

    @Override
    public WatchResponse next() throws InterruptedException {
        if (ended) {
            return null;
        }
        WatchResponse response = queue.take();
        if (response == END) {
            ended = true;
            return null;
        }
        return response;
    }

    @Override
    public boolean isEnded() {
        return ended || closed.get();
    }
}
