package com.wmux.coordination;

/**
 * Outcome of {@link WatchGroupRegistry#removeWatcher}: the group's last
 * revision at removal, or revision -1 with {@code found == false} for an
 * unknown receiver.
 */
public final class RemoveResult {

    public static final RemoveResult NOT_FOUND = new RemoveResult(-1, false);

    private final long revision;
    private final boolean found;

    private RemoveResult(long revision, boolean found) {
        this.revision = revision;
        this.found = found;
    }

    public static RemoveResult found(long revision) {
        return new RemoveResult(revision, true);
    }

    public long getRevision() {
        return revision;
    }

    public boolean isFound() {
        return found;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RemoveResult)) {
            return false;
        }
        RemoveResult other = (RemoveResult) o;
        return revision == other.revision && found == other.found;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(revision) * 31 + (found ? 1 : 0);
    }

    @Override
    public String toString() {
        return "RemoveResult{revision=" + revision + ", found=" + found + "}";
    }
}
