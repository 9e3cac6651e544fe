package com.len.directory.application.ratelimit;

public record Admission(
        boolean allowed,
        long limit,
        long remaining,
        long resetSeconds
) {

    public static Admission exempt(long limit, long windowSeconds) {
        return new Admission(true, limit, limit, windowSeconds);
    }
}
