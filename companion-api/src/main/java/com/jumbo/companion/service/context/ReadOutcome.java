package com.jumbo.companion.service.context;

import java.util.Optional;

public record ReadOutcome<T>(T value, boolean failed) {

    public static <T> ReadOutcome<T> success(T value) {
        return new ReadOutcome<>(value, false);
    }

    public static <T> ReadOutcome<T> failure() {
        return new ReadOutcome<>(null, true);
    }

    public Optional<T> result() {
        return failed ? Optional.empty() : Optional.ofNullable(value);
    }
}
