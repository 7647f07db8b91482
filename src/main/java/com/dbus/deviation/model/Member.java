package com.dbus.deviation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.ToString;

/**
 * A method or signal: a named member of an interface with a positional argument list.
 */
@ToString(callSuper = true)
public abstract class Member extends AstNode {
    private final List<Argument> arguments = new ArrayList<>();

    protected Member(String name) {
        super(name);
    }

    /**
     * Append an argument, assigning it the next position.
     */
    public void addArgument(Argument argument) {
        argument.assignIndex(arguments.size());
        argument.attachTo(this);
        arguments.add(argument);
    }

    public List<Argument> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    @Override
    public String formatName() {
        if (getParent() == null) {
            return name;
        }
        return getParent().formatName() + "." + name;
    }
}
