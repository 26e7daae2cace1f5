package com.wmux.shared;

import java.util.Objects;

/**
 * Identity of one client-side watch: the owning connection plus the
 * watch id the client was given on that connection.
 */
public final class ReceiverId implements Comparable<ReceiverId> {

    private final String connectionId;
    private final long watchId;

    public ReceiverId(String connectionId, long watchId) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.watchId = watchId;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public long getWatchId() {
        return watchId;
    }

    @Override
    public int compareTo(ReceiverId other) {
        int c = connectionId.compareTo(other.connectionId);
        return c != 0 ? c : Long.compare(watchId, other.watchId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReceiverId)) {
            return false;
        }
        ReceiverId other = (ReceiverId) o;
        return watchId == other.watchId && connectionId.equals(other.connectionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connectionId, watchId);
    }

    @Override
    public String toString() {
        return "ReceiverId{connectionId='" + connectionId + "', watchId=" + watchId + "}";
    }
}
