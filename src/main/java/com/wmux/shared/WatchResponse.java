package com.wmux.shared;

import java.util.Collections;
import java.util.List;

/**
 * One element of a watch stream: a created notification, a progress
 * marker, or a batch of data events. The revision is the header revision.
 */
public final class WatchResponse {

    private final long revision;
    private final long watchId;
    private final boolean created;
    private final boolean progressNotify;
    private final List<WatchEvent> events;

    private WatchResponse(long revision, long watchId, boolean created,
                          boolean progressNotify, List<WatchEvent> events) {
        this.revision = revision;
        this.watchId = watchId;
        this.created = created;
        this.progressNotify = progressNotify;
        this.events = events;
    }

    public static WatchResponse created(long revision, long watchId) {
        return new WatchResponse(revision, watchId, true, false, Collections.emptyList());
    }

    public static WatchResponse progress(long revision) {
        return new WatchResponse(revision, -1, false, true, Collections.emptyList());
    }

    public static WatchResponse events(long revision, List<WatchEvent> events) {
        return new WatchResponse(revision, -1, false, false, List.copyOf(events));
    }

    public WatchResponse withWatchId(long id) {
        return new WatchResponse(revision, id, created, progressNotify, events);
    }

    public WatchResponse withEvents(List<WatchEvent> filtered) {
        return new WatchResponse(revision, watchId, created, progressNotify, List.copyOf(filtered));
    }

    public long getRevision() {
        return revision;
    }

    public long getWatchId() {
        return watchId;
    }

    public boolean isCreated() {
        return created;
    }

    public boolean isProgressNotify() {
        return progressNotify;
    }

    public List<WatchEvent> getEvents() {
        return events;
    }

    @Override
    public String toString() {
        return "WatchResponse{revision=" + revision + ", watchId=" + watchId +
                ", created=" + created + ", progressNotify=" + progressNotify +
                ", events=" + events + "}";
    }
}
