package com.dbus.deviation.comparison;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dbus.deviation.model.Annotation;
import com.dbus.deviation.model.Argument;
import com.dbus.deviation.model.AstNode;
import com.dbus.deviation.model.Interface;
import com.dbus.deviation.model.Member;
import com.dbus.deviation.model.Property;
import com.dbus.deviation.model.WellKnownAnnotations;

/**
 * Compares two versions of a set of D-Bus interfaces and classifies every
 * difference by its effect on clients.
 *
 * Removals and modifications are reported in the order of the old
 * interfaces, followed by additions in the order of the new ones. Within an
 * interface, methods come first, then properties, then signals, then the
 * interface's own annotations.
 *
 * Neither input is modified.
 */
public class InterfaceComparator {
    private static final Logger log = LoggerFactory.getLogger(InterfaceComparator.class);

    private static final String PROPERTIES_CHANGED = "org.freedesktop.DBus.Properties.PropertiesChanged";

    private static final String ECS_TRUE = "true";
    private static final String ECS_INVALIDATES = "invalidates";
    private static final String ECS_FALSE = "false";
    private static final String ECS_CONST = "const";

    private static final Set<String> ECS_NOTIFYING = Set.of(ECS_TRUE, ECS_INVALIDATES);
    private static final Set<String> ECS_SILENT = Set.of(ECS_FALSE, ECS_CONST);

    private final Map<String, Interface> oldInterfaces;
    private final Map<String, Interface> newInterfaces;
    private final List<Difference> output = new ArrayList<>();

    public InterfaceComparator(Map<String, Interface> oldInterfaces, Map<String, Interface> newInterfaces) {
        this.oldInterfaces = oldInterfaces;
        this.newInterfaces = newInterfaces;
    }

    /**
     * Run the comparison. Every difference is kept regardless of severity;
     * use {@link ComparisonResult#filter} to select categories.
     */
    public ComparisonResult compare() {
        output.clear();

        oldInterfaces.forEach((name, oldInterface) -> {
            Interface newInterface = newInterfaces.get(name);
            if (newInterface == null) {
                issue(Severity.BACKWARDS_INCOMPATIBLE, "Interface '" + name + "' has been removed.");
            } else {
                compareInterfaces(oldInterface, newInterface);
            }
        });

        newInterfaces.forEach((name, newInterface) -> {
            if (!oldInterfaces.containsKey(name)) {
                issue(Severity.FORWARDS_INCOMPATIBLE, "Interface '" + name + "' has been added.");
            }
        });

        ComparisonResult result = new ComparisonResult(output);
        log.debug("Comparison found {} backwards-incompatible, {} forwards-incompatible and {} info difference(s)",
                result.count(Severity.BACKWARDS_INCOMPATIBLE),
                result.count(Severity.FORWARDS_INCOMPATIBLE),
                result.count(Severity.INFO));
        return result;
    }

    private void compareInterfaces(Interface oldInterface, Interface newInterface) {
        compareMembers(oldInterface.getMethods(), newInterface.getMethods());

        oldInterface.getProperties().forEach((name, oldProperty) -> {
            Property newProperty = newInterface.getProperties().get(name);
            if (newProperty == null) {
                issue(Severity.BACKWARDS_INCOMPATIBLE,
                        "Property '" + oldProperty.formatName() + "' has been removed.");
            } else {
                compareProperties(oldProperty, newProperty);
            }
        });
        newInterface.getProperties().forEach((name, newProperty) -> {
            if (!oldInterface.getProperties().containsKey(name)) {
                issue(Severity.FORWARDS_INCOMPATIBLE,
                        "Property '" + newProperty.formatName() + "' has been added.");
            }
        });

        compareMembers(oldInterface.getSignals(), newInterface.getSignals());

        compareAnnotations(oldInterface, newInterface);
    }

    /**
     * Methods and signals follow the same rules: removal breaks old clients,
     * addition breaks new clients running against the old version.
     */
    private <T extends Member> void compareMembers(Map<String, T> oldMembers, Map<String, T> newMembers) {
        oldMembers.forEach((name, oldMember) -> {
            T newMember = newMembers.get(name);
            if (newMember == null) {
                issue(Severity.BACKWARDS_INCOMPATIBLE,
                        capitalize(oldMember.getKind().getLabel()) + " '" + oldMember.formatName()
                                + "' has been removed.");
            } else {
                compareArgumentLists(oldMember, newMember);
                compareAnnotations(oldMember, newMember);
            }
        });
        newMembers.forEach((name, newMember) -> {
            if (!oldMembers.containsKey(name)) {
                issue(Severity.FORWARDS_INCOMPATIBLE,
                        capitalize(newMember.getKind().getLabel()) + " '" + newMember.formatName()
                                + "' has been added.");
            }
        });
    }

    private void compareArgumentLists(Member oldMember, Member newMember) {
        List<Argument> oldArgs = oldMember.getArguments();
        List<Argument> newArgs = newMember.getArguments();
        String kind = oldMember.getKind().getLabel();

        for (int i = 0; i < Math.max(oldArgs.size(), newArgs.size()); i++) {
            if (i >= oldArgs.size()) {
                issue(Severity.BACKWARDS_INCOMPATIBLE,
                        "Argument " + newArgs.get(i).formatName() + " of " + kind + " '"
                                + newMember.formatName() + "' has been added.");
            } else if (i >= newArgs.size()) {
                issue(Severity.BACKWARDS_INCOMPATIBLE,
                        "Argument " + oldArgs.get(i).formatName() + " of " + kind + " '"
                                + oldMember.formatName() + "' has been removed.");
            } else {
                compareArguments(oldArgs.get(i), newArgs.get(i));
            }
        }
    }

    private void compareArguments(Argument oldArg, Argument newArg) {
        String prefix = "Argument " + oldArg.getIndex() + " of '" + oldArg.getParent().formatName() + "'";

        if (!oldArg.getName().equals(newArg.getName())) {
            issue(Severity.INFO, prefix + " has changed name from '" + oldArg.getDisplayName()
                    + "' to '" + newArg.getDisplayName() + "'.");
        }

        if (!oldArg.getType().equals(newArg.getType())) {
            issue(Severity.BACKWARDS_INCOMPATIBLE, prefix + " has changed type from '" + oldArg.getType()
                    + "' to '" + newArg.getType() + "'.");
        }

        if (!Objects.equals(oldArg.getDirection(), newArg.getDirection())) {
            issue(Severity.BACKWARDS_INCOMPATIBLE, prefix + " has changed direction from '"
                    + formatDirection(oldArg) + "' to '" + formatDirection(newArg) + "'.");
        }

        compareAnnotations(oldArg, newArg);
    }

    private void compareProperties(Property oldProperty, Property newProperty) {
        if (!oldProperty.getType().equals(newProperty.getType())) {
            issue(Severity.BACKWARDS_INCOMPATIBLE, "Property '" + oldProperty.formatName()
                    + "' has changed type from '" + oldProperty.getType() + "' to '" + newProperty.getType() + "'.");
        }

        String oldAccess = oldProperty.getAccess();
        String newAccess = newProperty.getAccess();
        boolean restrictedBefore = Property.ACCESS_READ.equals(oldAccess) || Property.ACCESS_WRITE.equals(oldAccess);

        if (restrictedBefore && Property.ACCESS_READWRITE.equals(newAccess)) {
            issue(Severity.FORWARDS_INCOMPATIBLE, "Property '" + oldProperty.formatName()
                    + "' has changed access from '" + oldAccess + "' to '" + newAccess
                    + "', becoming less restrictive.");
        } else if (!oldAccess.equals(newAccess)) {
            issue(Severity.BACKWARDS_INCOMPATIBLE, "Property '" + oldProperty.formatName()
                    + "' has changed access from '" + oldAccess + "' to '" + newAccess + "'.");
        }

        compareAnnotations(oldProperty, newProperty);
    }

    /**
     * Only annotations with meaning defined by the D-Bus specification are
     * compared; all others are ignored.
     */
    private void compareAnnotations(AstNode oldNode, AstNode newNode) {
        String node = "Node '" + oldNode.formatName() + "'";

        boolean oldDeprecated = oldNode.getBooleanAnnotation(WellKnownAnnotations.DEPRECATED, false);
        boolean newDeprecated = newNode.getBooleanAnnotation(WellKnownAnnotations.DEPRECATED, false);
        if (oldDeprecated && !newDeprecated) {
            issue(Severity.INFO, node + " has been un-deprecated.");
        } else if (!oldDeprecated && newDeprecated) {
            issue(Severity.INFO, node + " has been deprecated.");
        }

        String oldSymbol = oldNode.getAnnotationValue(WellKnownAnnotations.C_SYMBOL, "");
        String newSymbol = newNode.getAnnotationValue(WellKnownAnnotations.C_SYMBOL, "");
        if (!oldSymbol.equals(newSymbol)) {
            issue(Severity.INFO, node + " has changed its C symbol from '" + oldSymbol + "' to '" + newSymbol + "'.");
        }

        boolean oldNoReply = oldNode.getBooleanAnnotation(WellKnownAnnotations.NO_REPLY, false);
        boolean newNoReply = newNode.getBooleanAnnotation(WellKnownAnnotations.NO_REPLY, false);
        if (oldNoReply && !newNoReply) {
            issue(Severity.BACKWARDS_INCOMPATIBLE, node + " has been marked as returning a reply.");
        } else if (!oldNoReply && newNoReply) {
            issue(Severity.BACKWARDS_INCOMPATIBLE, node + " has been marked as not returning a reply.");
        }

        compareEmitsChangedSignal(node, emitsChangedSignal(oldNode), emitsChangedSignal(newNode));
    }

    private void compareEmitsChangedSignal(String node, String oldValue, String newValue) {
        if (ECS_NOTIFYING.contains(oldValue) && ECS_SILENT.contains(newValue)) {
            issue(Severity.FORWARDS_INCOMPATIBLE, node + " stopped emitting " + PROPERTIES_CHANGED + ".");
        } else if (ECS_SILENT.contains(oldValue) && ECS_NOTIFYING.contains(newValue)) {
            issue(Severity.BACKWARDS_INCOMPATIBLE, node + " started emitting " + PROPERTIES_CHANGED + ".");
        } else if (ECS_TRUE.equals(oldValue) && ECS_INVALIDATES.equals(newValue)) {
            issue(Severity.BACKWARDS_INCOMPATIBLE,
                    node + " stopped emitting its new value in " + PROPERTIES_CHANGED + ".");
        } else if (ECS_INVALIDATES.equals(oldValue) && ECS_TRUE.equals(newValue)) {
            issue(Severity.BACKWARDS_INCOMPATIBLE,
                    node + " started emitting its new value in " + PROPERTIES_CHANGED + ".");
        } else if (ECS_CONST.equals(oldValue) && ECS_FALSE.equals(newValue)) {
            issue(Severity.BACKWARDS_INCOMPATIBLE, node + " stopped being a constant.");
        } else if (ECS_FALSE.equals(oldValue) && ECS_CONST.equals(newValue)) {
            issue(Severity.FORWARDS_INCOMPATIBLE, node + " became a constant.");
        }
    }

    /**
     * A property without its own annotation inherits the value declared on
     * its interface; everything else defaults to {@code true}.
     */
    private static String emitsChangedSignal(AstNode node) {
        return node.findAnnotation(WellKnownAnnotations.EMITS_CHANGED_SIGNAL)
                .map(Annotation::getValue)
                .orElseGet(() -> node instanceof Property && node.getParent() != null
                        ? emitsChangedSignal(node.getParent())
                        : ECS_TRUE);
    }

    private static String formatDirection(Argument argument) {
        return argument.getDirection() != null ? argument.getDirection() : "default";
    }

    private static String capitalize(String label) {
        return Character.toUpperCase(label.charAt(0)) + label.substring(1);
    }

    private void issue(Severity severity, String message) {
        output.add(new Difference(severity, message));
    }
}
