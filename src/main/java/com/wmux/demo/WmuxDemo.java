package com.wmux.demo;

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.wmux.SourceType;
import com.wmux.WmuxModule;
import com.wmux.config.WmuxConfig;
import com.wmux.coordination.RemoveResult;
import com.wmux.coordination.SingleWatcher;
import com.wmux.coordination.WatchGroupRegistry;
import com.wmux.receiver.Receiver;
import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.ReceiverId;
import com.wmux.shared.WatchFilter;
import com.wmux.shared.WatchResponse;
import com.wmux.upstream.InMemoryWatchSource;
import com.wmux.upstream.WatchSource;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.TimeUnit;

public class WmuxDemo {

    public static void main(String[] args) throws Exception {
        boolean useEtcd = false;
        for (String arg : args) {
            if ("--etcd".equals(arg)) {
                useEtcd = true;
            }
        }

        WmuxConfig config = WmuxConfig.builder()
                .receiverBufferSize(256)
                .sendTimeoutMs(100)
                .watchKeyPrefix("/wmux-demo/")
                .build();

        System.out.println("=== WMUX Demo ===");
        System.out.println("Config: " + config);
        System.out.println("Source: " + (useEtcd ? "etcd" : "in-memory"));
        System.out.println();

        CancelScope proxyScope = CancelScope.root();
        Injector injector = Guice.createInjector(
                new WmuxModule(config, useEtcd ? SourceType.ETCD : SourceType.IN_MEMORY, proxyScope));
        WatchGroupRegistry registry = injector.getInstance(WatchGroupRegistry.class);
        WatchSource source = injector.getInstance(WatchSource.class);
        KeyWriter writer = useEtcd ? etcdWriter(config) : memoryWriter((InMemoryWatchSource) source);

        String prefix = config.getWatchKeyPrefix();
        KeyRange users = KeyRange.of(prefix + "users/", prefix + "users0");
        KeyRange settings = KeyRange.single(prefix + "settings");

        // 1. Three clients on two ranges
        System.out.println("--- Subscribing three clients ---");
        Map<ReceiverId, Receiver> receivers = new LinkedHashMap<>();
        receivers.put(new ReceiverId("conn-A", 1), newReceiver(config, proxyScope, new ReceiverId("conn-A", 1), users));
        receivers.put(new ReceiverId("conn-B", 1), newReceiver(config, proxyScope, new ReceiverId("conn-B", 1), users));
        receivers.put(new ReceiverId("conn-B", 2), newReceiver(config, proxyScope, new ReceiverId("conn-B", 2), settings));
        for (Map.Entry<ReceiverId, Receiver> entry : receivers.entrySet()) {
            registry.addWatcher(entry.getKey(), entry.getValue());
            Thread.sleep(100);
        }
        System.out.println("Live groups: " + registry.size());

        // 2. Writes fan out to every member of the matching group
        System.out.println("\n--- Writing keys ---");
        long firstRevision = writer.put(prefix + "users/alice", "admin");
        writer.put(prefix + "users/bob", "viewer");
        writer.put(prefix + "settings", "dark-mode");
        writer.put(prefix + "unwatched", "ignored");
        Thread.sleep(500);
        for (Receiver receiver : receivers.values()) {
            drain(receiver);
        }

        // 3. A client replaying history starts private and moves into the group once caught up
        System.out.println("\n--- Replaying client from revision " + firstRevision + " ---");
        Receiver replaying = new Receiver(new ReceiverId("conn-C", 1), users,
                new ArrayBlockingQueue<>(config.getReceiverBufferSize()), proxyScope.child(),
                config.getSendTimeoutMs(), firstRevision, false, EnumSet.of(WatchFilter.NODELETE));
        SingleWatcher single = new SingleWatcher(replaying, source, proxyScope, registry);
        single.start();
        Thread.sleep(500);
        writer.put(prefix + "users/carol", "editor");
        Thread.sleep(500);
        drain(replaying);
        System.out.println("Replaying client grouped: " + registry.hasWatcher(replaying.getId()) +
                " (private stream retired: " + single.isRetired() + ")");

        // 4. Removal: the group survives until its last member leaves
        System.out.println("\n--- Removing clients ---");
        List<ReceiverId> ids = new ArrayList<>(receivers.keySet());
        ids.add(replaying.getId());
        for (ReceiverId id : ids) {
            RemoveResult result = registry.removeWatcher(id);
            System.out.println("  remove " + id + " -> " + result + ", live groups=" + registry.size());
        }
        System.out.println("  remove unknown -> " + registry.removeWatcher(new ReceiverId("conn-Z", 9)));

        // Shutdown
        System.out.println("\n--- Shutting down ---");
        registry.stop();
        proxyScope.cancel();
        source.close();
        writer.close();
        System.out.println("Done.");
    }

    private static Receiver newReceiver(WmuxConfig config, CancelScope proxyScope, ReceiverId id, KeyRange range) {
        return new Receiver(id, range, new ArrayBlockingQueue<>(config.getReceiverBufferSize()),
                proxyScope.child(), config.getSendTimeoutMs());
    }

    private static void drain(Receiver receiver) {
        List<WatchResponse> responses = new ArrayList<>();
        receiver.getQueue().drainTo(responses);
        System.out.println(receiver.getId() + " received " + responses.size() + " responses:");
        for (WatchResponse response : responses) {
            System.out.println("  " + response);
        }
    }

    private interface KeyWriter {
        long put(String key, String value) throws Exception;

        void close();
    }

    private static KeyWriter memoryWriter(InMemoryWatchSource source) {
        return new KeyWriter() {
            @Override
            public long put(String key, String value) {
                return source.put(key, value);
            }

            @Override
            public void close() {
            }
        };
    }

    private static KeyWriter etcdWriter(WmuxConfig config) {
        Client client = Client.builder()
                .endpoints(config.getEtcdEndpoints().split(","))
                .build();
        return new KeyWriter() {
            @Override
            public long put(String key, String value) throws Exception {
                return client.getKVClient()
                        .put(bs(key), bs(value))
                        .get(5, TimeUnit.SECONDS)
                        .getHeader()
                        .getRevision();
            }

            @Override
            public void close() {
                client.close();
            }
        };
    }

    private static ByteSequence bs(String s) {
        return ByteSequence.from(s, StandardCharsets.UTF_8);
    }
}
