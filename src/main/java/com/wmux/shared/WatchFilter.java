package com.wmux.shared;

public enum WatchFilter {
    NOPUT,
    NODELETE;

    public boolean drops(WatchEvent event) {
        return switch (this) {
            case NOPUT -> event.getType() == WatchEvent.Type.PUT;
            case NODELETE -> event.getType() == WatchEvent.Type.DELETE;
        };
    }
}
