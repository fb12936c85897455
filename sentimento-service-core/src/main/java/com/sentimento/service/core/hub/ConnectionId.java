package com.sentimento.service.core.hub;

/** Registry-assigned connection identity. Values are never reused within a process. */
public record ConnectionId(long value) implements Comparable<ConnectionId> {

    @Override
    public int compareTo(ConnectionId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "conn-" + value;
    }
}
