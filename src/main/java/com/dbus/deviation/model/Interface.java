package com.dbus.deviation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.ToString;

/**
 * A named collection of methods, signals and properties.
 * Each member map keeps document order and rejects duplicate names.
 */
@ToString(callSuper = true)
public class Interface extends AstNode {
    private final Map<String, Method> methods = new LinkedHashMap<>();
    private final Map<String, Signal> signals = new LinkedHashMap<>();
    private final Map<String, Property> properties = new LinkedHashMap<>();

    public Interface(String name) {
        super(name);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INTERFACE;
    }

    @Override
    public String formatName() {
        return name;
    }

    public void addMethod(Method method) {
        insert(methods, method);
    }

    public void addSignal(Signal signal) {
        insert(signals, signal);
    }

    public void addProperty(Property property) {
        insert(properties, property);
    }

    public Map<String, Method> getMethods() {
        return Collections.unmodifiableMap(methods);
    }

    public Map<String, Signal> getSignals() {
        return Collections.unmodifiableMap(signals);
    }

    public Map<String, Property> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    private <T extends AstNode> void insert(Map<String, T> members, T member) {
        if (members.containsKey(member.getName())) {
            throw new IllegalStateException("Duplicate " + member.getKind().getLabel()
                    + " '" + member.getName() + "' in interface '" + name + "'");
        }
        member.attachTo(this);
        members.put(member.getName(), member);
    }
}
