package com.dbus.deviation.model;

import lombok.experimental.UtilityClass;

/**
 * Annotation names with meaning defined by the D-Bus and GLib specifications.
 */
@UtilityClass
public class WellKnownAnnotations {

    public static final String DEPRECATED = "org.freedesktop.DBus.Deprecated";

    public static final String C_SYMBOL = "org.freedesktop.DBus.GLib.CSymbol";

    public static final String NO_REPLY = "org.freedesktop.DBus.Method.NoReply";

    /**
     * One of {@code true}, {@code invalidates}, {@code false}, {@code const}.
     */
    public static final String EMITS_CHANGED_SIGNAL = "org.freedesktop.DBus.Property.EmitsChangedSignal";

    public static final String DOC_STRING = "org.gtk.GDBus.DocString";
}
