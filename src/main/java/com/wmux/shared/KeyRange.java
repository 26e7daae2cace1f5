package com.wmux.shared;

import io.etcd.jetcd.ByteSequence;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A watched key interval [key, end). An empty end means the single key.
 * Equal ranges share one watch group.
 */
public final class KeyRange implements Comparable<KeyRange> {

    private final ByteSequence key;
    private final ByteSequence end;

    public KeyRange(ByteSequence key, ByteSequence end) {
        this.key = Objects.requireNonNull(key, "key");
        this.end = end != null ? end : ByteSequence.EMPTY;
    }

    public static KeyRange of(String key, String end) {
        return new KeyRange(bs(key), end == null ? ByteSequence.EMPTY : bs(end));
    }

    public static KeyRange single(String key) {
        return new KeyRange(bs(key), ByteSequence.EMPTY);
    }

    private static ByteSequence bs(String s) {
        return ByteSequence.from(s, StandardCharsets.UTF_8);
    }

    public ByteSequence getKey() {
        return key;
    }

    public ByteSequence getEnd() {
        return end;
    }

    public boolean isSingleKey() {
        return end.isEmpty();
    }

    public boolean contains(ByteSequence k) {
        int lower = Arrays.compareUnsigned(k.getBytes(), key.getBytes());
        if (isSingleKey()) {
            return lower == 0;
        }
        return lower >= 0 && Arrays.compareUnsigned(k.getBytes(), end.getBytes()) < 0;
    }

    @Override
    public int compareTo(KeyRange other) {
        int c = Arrays.compareUnsigned(key.getBytes(), other.key.getBytes());
        if (c != 0) {
            return c;
        }
        return Arrays.compareUnsigned(end.getBytes(), other.end.getBytes());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyRange)) {
            return false;
        }
        KeyRange other = (KeyRange) o;
        return key.equals(other.key) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, end);
    }

    @Override
    public String toString() {
        return "KeyRange{key='" + key.toString(StandardCharsets.UTF_8) +
                "', end='" + end.toString(StandardCharsets.UTF_8) + "'}";
    }
}
