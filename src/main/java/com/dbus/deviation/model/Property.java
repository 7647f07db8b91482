package com.dbus.deviation.model;

import lombok.Getter;
import lombok.ToString;

/**
 * An interface property. The type signature and access mode are kept as written.
 */
@Getter
@ToString(callSuper = true)
public class Property extends AstNode {
    public static final String ACCESS_READ = "read";
    public static final String ACCESS_WRITE = "write";
    public static final String ACCESS_READWRITE = "readwrite";

    private final String type;
    private final String access;

    public Property(String name, String type, String access) {
        super(name);
        this.type = type;
        this.access = access;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.PROPERTY;
    }

    @Override
    public String formatName() {
        if (getParent() == null) {
            return name;
        }
        return getParent().formatName() + "." + name;
    }
}
