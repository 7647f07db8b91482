package com.dbus.deviation.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A name/value metadata pair attached to exactly one node.
 */
@Getter
@ToString(callSuper = true)
public class Annotation extends AstNode {
    private final String value;

    public Annotation(String name, String value) {
        super(name);
        this.value = value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ANNOTATION;
    }

    @Override
    public String formatName() {
        if (getParent() == null) {
            return name;
        }
        return getParent().formatName() + "@" + name;
    }
}
