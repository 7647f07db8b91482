package com.dbus.deviation.comparison;

import java.util.Arrays;
import java.util.Optional;

import lombok.Getter;

/**
 * Impact of a difference between two interface versions, in increasing order.
 */
@Getter
public enum Severity {
    /**
     * Purely decorative; no client is affected.
     */
    INFO("info", " INFO"),
    /**
     * Code written against the new version may not work against the old one.
     */
    FORWARDS_INCOMPATIBLE("forwards-compatibility", " WARN"),
    /**
     * Code written against the old version may not work against the new one.
     */
    BACKWARDS_INCOMPATIBLE("backwards-compatibility", "ERROR");

    private final String category;
    private final String label;

    Severity(String category, String label) {
        this.category = category;
        this.label = label;
    }

    public static Optional<Severity> fromCategory(String category) {
        return Arrays.stream(values())
                .filter(s -> s.category.equals(category))
                .findFirst();
    }
}
