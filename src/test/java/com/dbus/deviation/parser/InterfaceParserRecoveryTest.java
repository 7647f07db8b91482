package com.dbus.deviation.parser;

import com.dbus.deviation.diagnostics.DiagnosticsLedger;
import com.dbus.deviation.diagnostics.LedgerEntry;
import com.dbus.deviation.model.Interface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests that recovery mode keeps parsing after an error and reports every
 * subsequent one.
 */
class InterfaceParserRecoveryTest {

    private static final String SOURCE = "test.xml";

    private DiagnosticsLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new DiagnosticsLedger();
    }

    @Test
    void testAnnotationInInterface() {
        assertOutput("<node><interface name='I'>"
                        + "<annotation/><method/>"
                        + "</interface></node>",
                entry("missing-attribute", "Missing required attribute 'name' in annotation."),
                entry("missing-attribute", "Missing required attribute 'value' in annotation."),
                entry("missing-attribute", "Missing required attribute 'name' in method."));
    }

    @Test
    void testAnnotationInMethod() {
        assertOutput("<node><interface name='I'><method name='M'>"
                        + "<annotation/><arg/>"
                        + "</method></interface></node>",
                entry("missing-attribute", "Missing required attribute 'name' in annotation."),
                entry("missing-attribute", "Missing required attribute 'value' in annotation."),
                entry("missing-attribute", "Missing required attribute 'type' in arg."));
    }

    @Test
    void testAnnotationInSignal() {
        assertOutput("<node><interface name='I'><signal name='S'>"
                        + "<annotation/><arg/>"
                        + "</signal></interface></node>",
                entry("missing-attribute", "Missing required attribute 'name' in annotation."),
                entry("missing-attribute", "Missing required attribute 'value' in annotation."),
                entry("missing-attribute", "Missing required attribute 'type' in arg."));
    }

    @Test
    void testAnnotationInProperty() {
        assertOutput("<node><interface name='I'>"
                        + "<property name='P' type='s' access='read'>"
                        + "<annotation/><badnode/>"
                        + "</property>"
                        + "</interface></node>",
                entry("missing-attribute", "Missing required attribute 'name' in annotation."),
                entry("missing-attribute", "Missing required attribute 'value' in annotation."),
                entry("unknown-node", "Unknown node 'badnode' in property 'P'."));
    }

    @Test
    void testAnnotationInArgument() {
        assertOutput("<node><interface name='I'><method name='M'><arg type='s'>"
                        + "<annotation/><badnode/>"
                        + "</arg></method></interface></node>",
                entry("missing-attribute", "Missing required attribute 'name' in annotation."),
                entry("missing-attribute", "Missing required attribute 'value' in annotation."),
                entry("unknown-node", "Unknown node 'badnode' in argument 'unnamed'."));
    }

    @Test
    void testDuplicatesAndUnknownNodesAcrossInterfaces() {
        assertOutput("<node>"
                        + "<interface name='A'><method name='M'/><method name='M'/></interface>"
                        + "<interface name='A'/>"
                        + "<bogus/>"
                        + "<interface name='B'><signal name='S'><nonsense/></signal></interface>"
                        + "</node>",
                entry("duplicate-node", "Duplicate method definition 'A.M'."),
                entry("duplicate-node", "Duplicate interface definition 'A'."),
                entry("unknown-node", "Unknown node 'bogus' in root."),
                entry("unknown-node", "Unknown node 'nonsense' in signal 'S'."));
    }

    @Test
    void testUnknownRootIsLogged() {
        assertOutput("<notnode/>",
                entry("unknown-node", "Unknown root node 'notnode'."));
    }

    @Test
    void testMalformedDocumentIsLogged() {
        Optional<Map<String, Interface>> interfaces =
                new InterfaceParser(ledger).parse("<node><interface name='I'>", SOURCE, true);

        assertThat(interfaces).isEmpty();
        assertThat(ledger.getEntries()).singleElement()
                .satisfies(e -> {
                    assertThat(e.getCode()).isEqualTo("malformed-document");
                    assertThat(e.getStage()).isEqualTo("parser");
                    assertThat(e.getSourceId()).isEqualTo(SOURCE);
                });
    }

    @Test
    void testValidDocumentInRecoveryModeParses() {
        Optional<Map<String, Interface>> interfaces = new InterfaceParser(ledger)
                .parse("<node><interface name='I'><method name='M'/></interface></node>", SOURCE, true);

        assertThat(interfaces).hasValueSatisfying(i -> assertThat(i).containsOnlyKeys("I"));
        assertThat(ledger.hasEntries()).isFalse();
    }

    @Test
    void testBrokenFixtureFromFile() throws IOException, URISyntaxException {
        Path file = Path.of(getClass().getResource("/interfaces/broken.xml").toURI());

        Optional<Map<String, Interface>> interfaces = new InterfaceParser(ledger).parse(file, true);

        assertThat(interfaces).isEmpty();
        assertThat(ledger.getEntries())
                .extracting(LedgerEntry::getMessage)
                .containsExactly(
                        "Missing required attribute 'name' in method.",
                        "Missing required attribute 'access' in property.",
                        "Unknown node 'frobnicate' in interface 'com.example.Broken'.");
        assertThat(ledger.getEntries())
                .extracting(LedgerEntry::getSourceId)
                .containsOnly(file.toString());
    }

    @Test
    void testParserCanBeReusedAcrossDocuments() {
        InterfaceParser parser = new InterfaceParser(ledger);

        assertThat(parser.parse("<node><bogus/></node>", "first.xml", true)).isEmpty();
        assertThat(parser.parse("<node><interface name='I'/></node>", "second.xml", true)).isPresent();
        assertThat(ledger.getEntries()).hasSize(1);
    }

    private void assertOutput(String xml, LedgerEntry... expected) {
        ledger.reset();
        Optional<Map<String, Interface>> interfaces = new InterfaceParser(ledger).parse(xml, SOURCE, true);

        assertThat(interfaces).isEmpty();
        assertThat(ledger.getEntries()).containsExactly(expected);
    }

    private static LedgerEntry entry(String code, String message) {
        return new LedgerEntry(SOURCE, InterfaceParser.STAGE, code, message);
    }
}
