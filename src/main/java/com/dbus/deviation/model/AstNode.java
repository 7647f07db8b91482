package com.dbus.deviation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Base class for all introspection AST nodes.
 *
 * The parent link is established once, when the node is inserted into its
 * container, and never changes afterwards.
 */
@Getter
@ToString
public abstract class AstNode {
    protected final String name;
    @ToString.Exclude
    private AstNode parent;
    @Setter
    private String comment;
    @Getter(AccessLevel.NONE)
    private final Map<String, Annotation> annotations = new LinkedHashMap<>();

    protected AstNode(String name) {
        this.name = name;
    }

    public abstract NodeKind getKind();

    /**
     * Qualified name used in diagnostics and difference messages.
     */
    public abstract String formatName();

    /**
     * Name as shown in "in &lt;context&gt;" phrases.
     */
    public String getDisplayName() {
        return name;
    }

    void attachTo(AstNode parent) {
        if (this.parent != null) {
            throw new IllegalStateException("Node '" + formatName() + "' already has a parent");
        }
        this.parent = parent;
    }

    /**
     * Attach an annotation; a later annotation with the same name replaces an earlier one.
     */
    public void addAnnotation(Annotation annotation) {
        annotation.attachTo(this);
        annotations.put(annotation.getName(), annotation);
    }

    public Map<String, Annotation> getAnnotations() {
        return Collections.unmodifiableMap(annotations);
    }

    public Optional<Annotation> findAnnotation(String annotationName) {
        return Optional.ofNullable(annotations.get(annotationName));
    }

    public String getAnnotationValue(String annotationName, String defaultValue) {
        return findAnnotation(annotationName)
                .map(Annotation::getValue)
                .orElse(defaultValue);
    }

    /**
     * Boolean annotations are true only when their value is exactly {@code true}.
     */
    public boolean getBooleanAnnotation(String annotationName, boolean defaultValue) {
        return findAnnotation(annotationName)
                .map(a -> "true".equals(a.getValue()))
                .orElse(defaultValue);
    }
}
