package com.wmux.upstream;

import com.wmux.shared.WatchResponse;

public interface WatchStream {

    /**
     * Blocks for the next response. Returns null once the stream has ended.
     */
    WatchResponse next() throws InterruptedException;

    boolean isEnded();
}
