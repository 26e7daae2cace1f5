package com.wmux.shared;

public class WatchOptions {

    private final boolean progressNotify;
    private final boolean createdNotify;
    private final long startRevision;

    private WatchOptions(Builder builder) {
        this.progressNotify = builder.progressNotify;
        this.createdNotify = builder.createdNotify;
        this.startRevision = builder.startRevision;
    }

    public boolean isProgressNotify() {
        return progressNotify;
    }

    public boolean isCreatedNotify() {
        return createdNotify;
    }

    public long getStartRevision() {
        return startRevision;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Options every shared upstream stream is opened with.
     */
    public static WatchOptions grouped() {
        return builder().progressNotify(true).createdNotify(true).build();
    }

    public static class Builder {
        private boolean progressNotify;
        private boolean createdNotify;
        private long startRevision;

        public Builder progressNotify(boolean progressNotify) {
            this.progressNotify = progressNotify;
            return this;
        }

        public Builder createdNotify(boolean createdNotify) {
            this.createdNotify = createdNotify;
            return this;
        }

        public Builder startRevision(long startRevision) {
            this.startRevision = startRevision;
            return this;
        }

        public WatchOptions build() {
            return new WatchOptions(this);
        }
    }

    @Override
    public String toString() {
        return "WatchOptions{progressNotify=" + progressNotify +
                ", createdNotify=" + createdNotify +
                ", startRevision=" + startRevision + "}";
    }
}
