package com.dbus.deviation.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import lombok.Getter;

/**
 * The introspection grammar as data: one entry per structural element, with
 * the tag it is written as, the label used when naming it in messages, the
 * attributes it must carry and the structural children it may contain.
 *
 * Documentation elements are not listed here; they are permitted everywhere.
 */
@Getter
public enum NodeKind {
    NODE("node", "root", List.of(), Set.of("interface")),
    INTERFACE("interface", "interface", List.of("name"), Set.of("method", "signal", "property", "annotation")),
    METHOD("method", "method", List.of("name"), Set.of("arg", "annotation")),
    SIGNAL("signal", "signal", List.of("name"), Set.of("arg", "annotation")),
    PROPERTY("property", "property", List.of("name", "type", "access"), Set.of("annotation")),
    ARGUMENT("arg", "argument", List.of("type"), Set.of("annotation")),
    ANNOTATION("annotation", "annotation", List.of("name", "value"), Set.of());

    private static final Map<String, NodeKind> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NodeKind::getTag, Function.identity()));

    private final String tag;
    private final String label;
    private final List<String> requiredAttributes;
    private final Set<String> childTags;

    NodeKind(String tag, String label, List<String> requiredAttributes, Set<String> childTags) {
        this.tag = tag;
        this.label = label;
        this.requiredAttributes = requiredAttributes;
        this.childTags = childTags;
    }

    public static Optional<NodeKind> forTag(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }

    public boolean permits(NodeKind child) {
        return childTags.contains(child.getTag());
    }

    /**
     * Context phrase for messages, e.g. {@code root} or {@code method 'Frobnicate'}.
     */
    public String describe(String displayName) {
        if (this == NODE) {
            return label;
        }
        return label + " '" + displayName + "'";
    }
}
