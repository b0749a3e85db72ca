package com.haven.gateway.service;

/**
 * A dashboard part together with where it came from.
 * Lets a {@code null} value travel through {@code Mono.zip}.
 */
record Sourced<T>(T value, Origin origin) {

    enum Origin { LIVE, CACHED, NONE }

    static <T> Sourced<T> live(T value) {
        return new Sourced<>(value, Origin.LIVE);
    }

    static <T> Sourced<T> cached(T value) {
        return new Sourced<>(value, Origin.CACHED);
    }

    static <T> Sourced<T> none(T value) {
        return new Sourced<>(value, Origin.NONE);
    }

    boolean isLive() {
        return origin == Origin.LIVE;
    }
}
