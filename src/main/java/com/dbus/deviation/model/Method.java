package com.dbus.deviation.model;

public class Method extends Member {

    public Method(String name) {
        super(name);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.METHOD;
    }
}
