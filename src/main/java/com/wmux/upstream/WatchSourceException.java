package com.wmux.upstream;

public class WatchSourceException extends RuntimeException {

    public WatchSourceException(String message) {
        super(message);
    }

    public WatchSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
