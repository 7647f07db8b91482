package com.dbus.deviation.diagnostics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Append-only log of problems found while processing input documents.
 *
 * One ledger is owned by whoever drives a run and passed to the parser
 * explicitly. Not thread safe: concurrent parses need separate ledgers.
 */
public class DiagnosticsLedger {

    private final List<LedgerEntry> entries = new ArrayList<>();

    public void log(String sourceId, String stage, String code, String message) {
        entries.add(new LedgerEntry(sourceId, stage, code, message));
    }

    public void log(String sourceId, String stage, ErrorCode code, String message) {
        log(sourceId, stage, code.getCode(), message);
    }

    /**
     * Forget everything logged so far, so the ledger can serve an unrelated run.
     */
    public void reset() {
        entries.clear();
    }

    public List<LedgerEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean hasEntries() {
        return !entries.isEmpty();
    }

    /**
     * All codes any error condition can produce, in declaration order.
     */
    public static List<String> registeredCodes() {
        return Arrays.stream(ErrorCode.values())
                .map(ErrorCode::getCode)
                .toList();
    }
}
