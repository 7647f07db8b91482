package com.dbus.deviation.diagnostics;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DiagnosticsLedgerTest {

    @Test
    void testRegisteredCodesAreUnique() {
        List<String> codes = DiagnosticsLedger.registeredCodes();

        assertThat(new HashSet<>(codes)).hasSameSizeAs(codes);
    }

    @Test
    void testRegisteredCodesAreNonEmpty() {
        assertThat(DiagnosticsLedger.registeredCodes())
                .isNotEmpty()
                .contains("unknown-node", "missing-attribute", "duplicate-node");
    }

    @Test
    void testEntriesKeepInsertionOrder() {
        DiagnosticsLedger ledger = new DiagnosticsLedger();

        ledger.log("a.xml", "parser", ErrorCode.UNKNOWN_NODE, "first");
        ledger.log("b.xml", "parser", "custom-code", "second");

        assertThat(ledger.getEntries()).containsExactly(
                new LedgerEntry("a.xml", "parser", "unknown-node", "first"),
                new LedgerEntry("b.xml", "parser", "custom-code", "second"));
    }

    @Test
    void testResetEmptiesLedger() {
        DiagnosticsLedger ledger = new DiagnosticsLedger();
        ledger.log("a.xml", "parser", ErrorCode.DUPLICATE_NODE, "duplicate");
        assertThat(ledger.hasEntries()).isTrue();

        ledger.reset();

        assertThat(ledger.hasEntries()).isFalse();
        assertThat(ledger.getEntries()).isEmpty();
    }

    @Test
    void testEntriesViewIsReadOnly() {
        DiagnosticsLedger ledger = new DiagnosticsLedger();

        assertThatThrownBy(() -> ledger.getEntries().add(new LedgerEntry("x", "y", "z", "w")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
