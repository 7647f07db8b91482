package com.dbus.deviation.comparison;

import java.util.List;
import java.util.Set;

import lombok.Getter;

/**
 * Every difference found by one comparison, in emission order.
 *
 * Filtering by enabled severities is done here on read, so the same result
 * can be viewed with different filters without comparing again.
 */
@Getter
public class ComparisonResult {
    private final List<Difference> differences;

    public ComparisonResult(List<Difference> differences) {
        this.differences = List.copyOf(differences);
    }

    public List<Difference> filter(Set<Severity> enabled) {
        return differences.stream()
                .filter(d -> enabled.contains(d.getSeverity()))
                .toList();
    }

    public boolean contains(Severity severity) {
        return differences.stream().anyMatch(d -> d.getSeverity() == severity);
    }

    public long count(Severity severity) {
        return differences.stream().filter(d -> d.getSeverity() == severity).count();
    }

    public boolean isEmpty() {
        return differences.isEmpty();
    }
}
