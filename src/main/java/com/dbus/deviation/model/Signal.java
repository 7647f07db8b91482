package com.dbus.deviation.model;

public class Signal extends Member {

    public Signal(String name) {
        super(name);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.SIGNAL;
    }
}
