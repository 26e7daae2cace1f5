package com.wmux.upstream;

import com.wmux.config.WmuxConfig;
import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.WatchEvent;
import com.wmux.shared.WatchOptions;
import com.wmux.shared.WatchResponse;

import com.google.inject.Inject;

import io.etcd.jetcd.Client;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.options.WatchOption;

import java.util.ArrayList;
import java.util.List;

/**
 * Upstream watch source backed by the jetcd watch client. Stream failures
 * end the stream; reconnecting is left to the caller.
 */
public class EtcdWatchSource implements WatchSource {

    private final Client client;
    private final Watch watchClient;

    @Inject
    public EtcdWatchSource(WmuxConfig config) {
        this(Client.builder()
                .endpoints(config.getEtcdEndpoints().split(","))
                .build());
    }

    public EtcdWatchSource(Client client) {
        this.client = client;
        this.watchClient = client.getWatchClient();
    }

    @Override
    public WatchStream open(CancelScope scope, KeyRange range, WatchOptions options) {
        QueueWatchStream stream = new QueueWatchStream();

        WatchOption.Builder builder = WatchOption.newBuilder()
                .withProgressNotify(options.isProgressNotify())
                .withCreateNotify(options.isCreatedNotify());
        if (!range.isSingleKey()) {
            builder.withRange(range.getEnd());
        }
        if (options.getStartRevision() > 0) {
            builder.withRevision(options.getStartRevision());
        }

        Watch.Watcher watcher;
        try {
            watcher = watchClient.watch(range.getKey(), builder.build(), Watch.listener(
                    response -> stream.push(convert(response)),
                    error -> {
                        System.err.println("[EtcdWatchSource] Watch on " + range + " failed: " + error.getMessage());
                        stream.close();
                    },
                    stream::close));
        } catch (RuntimeException e) {
            throw new WatchSourceException("Failed to open watch on " + range, e);
        }

        scope.onCancel(() -> {
            watcher.close();
            stream.close();
        });
        return stream;
    }

    @Override
    public void close() {
        watchClient.close();
        client.close();
    }

    static WatchResponse convert(io.etcd.jetcd.watch.WatchResponse response) {
        long revision = response.getHeader().getRevision();
        if (response.isCreatedNotify()) {
            return WatchResponse.created(revision, -1);
        }
        if (response.isProgressNotify()) {
            return WatchResponse.progress(revision);
        }
        List<WatchEvent> events = new ArrayList<>();
        for (io.etcd.jetcd.watch.WatchEvent ev : response.getEvents()) {
            KeyValue kv = ev.getKeyValue();
            switch (ev.getEventType()) {
                case PUT -> events.add(new WatchEvent(WatchEvent.Type.PUT, kv.getKey(), kv.getValue(), kv.getModRevision()));
                case DELETE -> events.add(new WatchEvent(WatchEvent.Type.DELETE, kv.getKey(), kv.getValue(), kv.getModRevision()));
                default -> System.err.println("[EtcdWatchSource] Skipping unrecognized event type " + ev.getEventType());
            }
        }
        return WatchResponse.events(revision, events);
    }
}
