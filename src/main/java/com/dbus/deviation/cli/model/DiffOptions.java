package com.dbus.deviation.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds the raw command-line options of dbus-interface-diff. No validation,
 * no execution logic, no printing.
 */
@Getter
public class DiffOptions {

    @Parameters(index = "0", paramLabel = "OLD_FILE", description = "Introspection XML of the old API version")
    private Path oldFile;

    @Parameters(index = "1", paramLabel = "NEW_FILE", description = "Introspection XML of the new API version")
    private Path newFile;

    @Option(names = { "--warnings" }, split = ",", defaultValue = "all", paramLabel = "CATEGORY",
            description = "Categories to print: info, forwards-compatibility, backwards-compatibility, all or none (default: all)")
    private List<String> warnings;

    @Option(names = { "--fail-fast" }, description = "Stop at the first parse error instead of reporting all of them")
    private boolean failFast;

    @Option(names = { "--fatal-forwards" }, description = "Also fail when only forwards-incompatible differences are found")
    private boolean fatalForwards;
}
