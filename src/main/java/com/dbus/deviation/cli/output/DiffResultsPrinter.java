package com.dbus.deviation.cli.output;

import java.io.PrintWriter;
import java.util.List;
import java.util.Set;

import com.dbus.deviation.comparison.ComparisonResult;
import com.dbus.deviation.comparison.Difference;
import com.dbus.deviation.comparison.Severity;
import com.dbus.deviation.diagnostics.LedgerEntry;
import com.dbus.deviation.parser.InterfaceParser;
import com.dbus.deviation.parser.exception.InterfaceParseException;

/**
 * Responsible only for printing the output of dbus-interface-diff.
 * Info lines go to the standard writer, everything else to the error writer.
 */
public class DiffResultsPrinter {

    private final PrintWriter out;
    private final PrintWriter err;

    public DiffResultsPrinter(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    public void printDifferences(ComparisonResult result, Set<Severity> enabled) {
        for (Difference difference : result.filter(enabled)) {
            PrintWriter target = difference.getSeverity() == Severity.INFO ? out : err;
            target.println(difference.getSeverity().getLabel() + ": " + difference.getMessage());
        }
        out.flush();
        err.flush();
    }

    public void printLedger(List<LedgerEntry> entries) {
        for (LedgerEntry entry : entries) {
            printProblem(entry.getSourceId(), entry.getStage(), entry.getMessage(), entry.getCode());
        }
        err.flush();
    }

    public void printParseFailure(String sourceId, InterfaceParseException e) {
        printProblem(sourceId, InterfaceParser.STAGE, e.getMessage(), e.getErrorCode().getCode());
        err.flush();
    }

    public void printOptionErrors(List<String> errors) {
        errors.forEach(err::println);
        err.flush();
    }

    private void printProblem(String sourceId, String stage, String message, String code) {
        err.println(sourceId + ": " + stage + ": " + message + " [" + code + "]");
    }
}
