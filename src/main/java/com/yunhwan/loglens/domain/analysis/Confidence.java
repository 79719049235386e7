package com.yunhwan.loglens.domain.analysis;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum Confidence {
    HIGH, MEDIUM, LOW;

    public static Optional<Confidence> from(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.name().equals(normalized))
                .findFirst();
    }

    public static boolean isKnown(String raw) {
        return from(raw).isPresent();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
