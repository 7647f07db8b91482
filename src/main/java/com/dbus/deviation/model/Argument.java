package com.dbus.deviation.model;

import lombok.Getter;
import lombok.ToString;

/**
 * A method or signal argument. The name is optional (empty when absent) and
 * the direction is {@code null} when not declared.
 */
@Getter
@ToString(callSuper = true)
public class Argument extends AstNode {
    public static final String UNNAMED = "unnamed";

    private final String type;
    private final String direction;
    private int index = -1;

    public Argument(String name, String type, String direction) {
        super(name != null ? name : "");
        this.type = type;
        this.direction = direction;
    }

    void assignIndex(int index) {
        this.index = index;
    }

    public boolean isNamed() {
        return !name.isEmpty();
    }

    @Override
    public String getDisplayName() {
        return isNamed() ? name : UNNAMED;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.ARGUMENT;
    }

    @Override
    public String formatName() {
        if (!isNamed()) {
            return String.valueOf(index);
        }
        return index + " ('" + name + "')";
    }
}
