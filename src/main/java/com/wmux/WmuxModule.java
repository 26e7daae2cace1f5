package com.wmux;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.wmux.config.WmuxConfig;
import com.wmux.coordination.WatchGroupRegistry;
import com.wmux.shared.CancelScope;
import com.wmux.upstream.EtcdWatchSource;
import com.wmux.upstream.InMemoryWatchSource;
import com.wmux.upstream.WatchSource;

public class WmuxModule extends AbstractModule {

    private final WmuxConfig config;
    private final SourceType sourceType;
    private final CancelScope proxyScope;

    public WmuxModule(WmuxConfig config, SourceType sourceType) {
        this(config, sourceType, CancelScope.root());
    }

    public WmuxModule(WmuxConfig config, SourceType sourceType, CancelScope proxyScope) {
        this.config = config;
        this.sourceType = sourceType;
        this.proxyScope = proxyScope;
    }

    @Override
    protected void configure() {
        bind(WmuxConfig.class).toInstance(config);
        bind(CancelScope.class).toInstance(proxyScope);
        bind(WatchGroupRegistry.class).in(Singleton.class);

        switch (sourceType) {
            case IN_MEMORY -> {
                bind(InMemoryWatchSource.class).in(Singleton.class);
                bind(WatchSource.class).to(InMemoryWatchSource.class);
            }
            case ETCD -> bind(WatchSource.class).to(EtcdWatchSource.class).in(Singleton.class);
        }
    }
}
