package com.wmux.config;

public class WmuxConfig {

    private final String etcdEndpoints;
    private final int receiverBufferSize;
    private final long sendTimeoutMs;
    private final String watchKeyPrefix;

    private WmuxConfig(Builder builder) {
        this.etcdEndpoints = builder.etcdEndpoints;
        this.receiverBufferSize = builder.receiverBufferSize;
        this.sendTimeoutMs = builder.sendTimeoutMs;
        this.watchKeyPrefix = builder.watchKeyPrefix;
    }

    public String getEtcdEndpoints() {
        return etcdEndpoints;
    }

    public int getReceiverBufferSize() {
        return receiverBufferSize;
    }

    public long getSendTimeoutMs() {
        return sendTimeoutMs;
    }

    public String getWatchKeyPrefix() {
        return watchKeyPrefix;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String etcdEndpoints = "http://localhost:2379";
        private int receiverBufferSize = 1024;
        private long sendTimeoutMs = 50;
        private String watchKeyPrefix = "";

        public Builder etcdEndpoints(String etcdEndpoints) {
            this.etcdEndpoints = etcdEndpoints;
            return this;
        }

        public Builder receiverBufferSize(int receiverBufferSize) {
            this.receiverBufferSize = receiverBufferSize;
            return this;
        }

        public Builder sendTimeoutMs(long sendTimeoutMs) {
            this.sendTimeoutMs = sendTimeoutMs;
            return this;
        }

        public Builder watchKeyPrefix(String watchKeyPrefix) {
            this.watchKeyPrefix = watchKeyPrefix;
            return this;
        }

        public WmuxConfig build() {
            if (receiverBufferSize <= 0) {
                throw new IllegalArgumentException("receiverBufferSize must be positive: " + receiverBufferSize);
            }
            if (sendTimeoutMs < 0) {
                throw new IllegalArgumentException("sendTimeoutMs must not be negative: " + sendTimeoutMs);
            }
            return new WmuxConfig(this);
        }
    }

    @Override
    public String toString() {
        return "WmuxConfig{etcdEndpoints='" + etcdEndpoints + "'" +
                ", receiverBufferSize=" + receiverBufferSize +
                ", sendTimeoutMs=" + sendTimeoutMs +
                ", watchKeyPrefix='" + watchKeyPrefix + "'}";
    }
}
