package com.wmux.upstream;

import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.WatchOptions;

public interface WatchSource {

    /**
     * Opens an upstream watch over {@code range}. The stream ends when
     * {@code scope} is cancelled.
     */
    WatchStream open(CancelScope scope, KeyRange range, WatchOptions options);

    void close();
}
