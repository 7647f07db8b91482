package com.dbus.deviation.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dbus.deviation.cli.exception.OptionsValidationException;
import com.dbus.deviation.cli.model.DiffConfig;
import com.dbus.deviation.cli.model.DiffOptions;
import com.dbus.deviation.cli.output.DiffResultsPrinter;
import com.dbus.deviation.cli.validation.DiffOptionsValidator;
import com.dbus.deviation.comparison.ComparisonResult;
import com.dbus.deviation.comparison.InterfaceComparator;
import com.dbus.deviation.comparison.Severity;
import com.dbus.deviation.diagnostics.DiagnosticsLedger;
import com.dbus.deviation.model.Interface;
import com.dbus.deviation.parser.InterfaceParser;
import com.dbus.deviation.parser.exception.InterfaceParseException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command comparing two versions of a D-Bus API.
 *
 * Exit status is {@value #EXIT_COMPATIBLE} when no backwards-incompatible
 * difference was found, {@value #EXIT_INCOMPATIBLE} when one was (or, with
 * {@code --fatal-forwards}, a forwards-incompatible one), and
 * {@value #EXIT_INVALID_INPUT} when the options or input files are unusable.
 */
@Command(
        name = "dbus-interface-diff",
        mixinStandardHelpOptions = true,
        version = "dbus-interface-diff 0.1.0",
        description = "Compares two D-Bus introspection XML files and reports API compatibility differences."
)
public class InterfaceDiffCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InterfaceDiffCommand.class);

    public static final int EXIT_COMPATIBLE = 0;
    public static final int EXIT_INCOMPATIBLE = 1;
    public static final int EXIT_INVALID_INPUT = 2;

    @Mixin
    private DiffOptions options;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        DiffResultsPrinter printer = new DiffResultsPrinter(spec.commandLine().getOut(), spec.commandLine().getErr());

        DiffConfig config;
        try {
            config = new DiffOptionsValidator().validate(options);
        } catch (OptionsValidationException e) {
            printer.printOptionErrors(e.getErrors());
            return EXIT_INVALID_INPUT;
        }

        log.debug("Comparing {} against {} (recover={}, enabled={})",
                config.getOldFile(), config.getNewFile(), config.isRecover(), config.getEnabledSeverities());

        DiagnosticsLedger ledger = new DiagnosticsLedger();
        InterfaceParser parser = new InterfaceParser(ledger);

        Optional<Map<String, Interface>> oldInterfaces;
        Optional<Map<String, Interface>> newInterfaces;
        try {
            oldInterfaces = parse(parser, config.getOldFile(), config.isRecover(), printer);
            newInterfaces = parse(parser, config.getNewFile(), config.isRecover(), printer);
        } catch (IOException e) {
            log.error("Unable to read interface file", e);
            return EXIT_INVALID_INPUT;
        }

        if (oldInterfaces.isEmpty() || newInterfaces.isEmpty()) {
            printer.printLedger(ledger.getEntries());
            return EXIT_INVALID_INPUT;
        }

        ComparisonResult result = new InterfaceComparator(oldInterfaces.get(), newInterfaces.get()).compare();
        printer.printDifferences(result, config.getEnabledSeverities());

        return exitStatus(result, config);
    }

    private Optional<Map<String, Interface>> parse(InterfaceParser parser, Path file, boolean recover,
                                                   DiffResultsPrinter printer) throws IOException {
        try {
            return parser.parse(file, recover);
        } catch (InterfaceParseException e) {
            printer.printParseFailure(file.toString(), e);
            return Optional.empty();
        }
    }

    static int exitStatus(ComparisonResult result, DiffConfig config) {
        if (result.contains(Severity.BACKWARDS_INCOMPATIBLE)) {
            return EXIT_INCOMPATIBLE;
        }
        if (config.isFatalForwards() && result.contains(Severity.FORWARDS_INCOMPATIBLE)) {
            return EXIT_INCOMPATIBLE;
        }
        return EXIT_COMPATIBLE;
    }
}
