package com.dbus.deviation;

import com.dbus.deviation.cli.InterfaceDiffCommand;
import picocli.CommandLine;

/**
 * Main entry point for dbus-interface-diff.
 * Compares two D-Bus introspection XML files and reports API breaks between them.
 */
public class DbusInterfaceDiffApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new InterfaceDiffCommand()).execute(args);
        System.exit(exitCode);
    }
}
