package com.wmux.shared;

import io.etcd.jetcd.ByteSequence;

import java.nio.charset.StandardCharsets;

public final class WatchEvent {

    public enum Type {
        PUT,
        DELETE
    }

    private final Type type;
    private final ByteSequence key;
    private final ByteSequence value;
    private final long modRevision;

    public WatchEvent(Type type, ByteSequence key, ByteSequence value, long modRevision) {
        this.type = type;
        this.key = key;
        this.value = value != null ? value : ByteSequence.EMPTY;
        this.modRevision = modRevision;
    }

    public Type getType() {
        return type;
    }

    public ByteSequence getKey() {
        return key;
    }

    public ByteSequence getValue() {
        return value;
    }

    public long getModRevision() {
        return modRevision;
    }

    @Override
    public String toString() {
        return "WatchEvent{type=" + type + ", key='" + key.toString(StandardCharsets.UTF_8) +
                "', value='" + value.toString(StandardCharsets.UTF_8) +
                "', modRevision=" + modRevision + "}";
    }
}
