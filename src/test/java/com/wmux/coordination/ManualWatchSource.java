package com.wmux.coordination;

import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.WatchOptions;
import com.wmux.upstream.QueueWatchStream;
import com.wmux.upstream.WatchSource;
import com.wmux.upstream.WatchStream;

import java.util.ArrayList;
import java.util.List;

/**
 * Watch source whose streams only carry what a test pushes into them.
 */
class ManualWatchSource implements WatchSource {

    static final class Opened {
        final KeyRange range;
        final CancelScope scope;
        final QueueWatchStream stream;

        Opened(KeyRange range, CancelScope scope, QueueWatchStream stream) {
            this.range = range;
            this.scope = scope;
            this.stream = stream;
        }
    }

    private final List<Opened> opened = new ArrayList<>();

    @Override
    public synchronized WatchStream open(CancelScope scope, KeyRange range, WatchOptions options) {
        QueueWatchStream stream = new QueueWatchStream();
        scope.onCancel(stream::close);
        opened.add(new Opened(range, scope, stream));
        return stream;
    }

    @Override
    public void close() {
    }

    synchronized int openCount() {
        return opened.size();
    }

    synchronized Opened last() {
        return opened.get(opened.size() - 1);
    }

    synchronized List<Opened> live(KeyRange range) {
        List<Opened> result = new ArrayList<>();
        for (Opened o : opened) {
            if (o.range.equals(range) && !o.scope.isCancelled()) {
                result.add(o);
            }
        }
        return result;
    }

    synchronized int liveCount() {
        int count = 0;
        for (Opened o : opened) {
            if (!o.scope.isCancelled()) {
                count++;
            }
        }
        return count;
    }
}
