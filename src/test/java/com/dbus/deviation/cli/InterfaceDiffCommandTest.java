package com.dbus.deviation.cli;

import com.dbus.deviation.cli.model.DiffConfig;
import com.dbus.deviation.comparison.ComparisonResult;
import com.dbus.deviation.comparison.Difference;
import com.dbus.deviation.comparison.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests for the dbus-interface-diff command.
 */
class InterfaceDiffCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new InterfaceDiffCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void testCompatibleChangeExitsZero() throws URISyntaxException {
        int exitCode = run(fixture("media-player-v1.xml"), fixture("media-player-v2.xml"));

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_COMPATIBLE);
        assertThat(out.toString().lines()).containsExactly(
                " INFO: Argument 0 of 'com.example.MediaPlayer.Play' has changed name from 'uri' to 'location'.",
                " INFO: Node 'com.example.Legacy' has been deprecated.");
        assertThat(err.toString().lines()).containsExactly(
                " WARN: Method 'com.example.MediaPlayer.Pause' has been added.",
                " WARN: Property 'com.example.MediaPlayer.Volume' has changed access from 'read' to 'readwrite',"
                        + " becoming less restrictive.");
    }

    @Test
    void testFatalForwardsTurnsAdditionsIntoFailure() throws URISyntaxException {
        int exitCode = run("--fatal-forwards", fixture("media-player-v1.xml"), fixture("media-player-v2.xml"));

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_INCOMPATIBLE);
    }

    @Test
    void testBackwardsIncompatibleChangeExitsOne() throws URISyntaxException {
        int exitCode = run(fixture("media-player-v1.xml"), fixture("media-player-v3.xml"));

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_INCOMPATIBLE);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString().lines()).containsExactly(
                "ERROR: Method 'com.example.MediaPlayer.Stop' has been removed.",
                "ERROR: Argument 0 of 'com.example.MediaPlayer.Seek' has changed type from 'x' to 'i'.");
    }

    @Test
    void testWarningsFilterOnlyAffectsOutput() throws URISyntaxException {
        int exitCode = run("--warnings", "none", fixture("media-player-v1.xml"), fixture("media-player-v3.xml"));

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_INCOMPATIBLE);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testWarningsSelectCategories() throws URISyntaxException {
        int exitCode = run("--warnings", "info", fixture("media-player-v1.xml"), fixture("media-player-v2.xml"));

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_COMPATIBLE);
        assertThat(out.toString().lines()).hasSize(2);
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testIdenticalFilesPrintNothing() throws URISyntaxException {
        String v1 = fixture("media-player-v1.xml");

        assertThat(run(v1, v1)).isEqualTo(InterfaceDiffCommand.EXIT_COMPATIBLE);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testInvalidInputReportsEveryProblem() throws URISyntaxException {
        String broken = fixture("broken.xml");

        int exitCode = run(fixture("media-player-v1.xml"), broken);

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_INVALID_INPUT);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString().lines()).containsExactly(
                broken + ": parser: Missing required attribute 'name' in method. [missing-attribute]",
                broken + ": parser: Missing required attribute 'access' in property. [missing-attribute]",
                broken + ": parser: Unknown node 'frobnicate' in interface 'com.example.Broken'. [unknown-node]");
    }

    @Test
    void testFailFastReportsFirstProblemOnly() throws URISyntaxException {
        String broken = fixture("broken.xml");

        int exitCode = run("--fail-fast", broken, fixture("media-player-v1.xml"));

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_INVALID_INPUT);
        assertThat(err.toString().lines()).containsExactly(
                broken + ": parser: Missing required attribute 'name' in method. [missing-attribute]");
    }

    @Test
    void testMalformedXmlIsInvalidInput() throws IOException, URISyntaxException {
        Path malformed = tempDir.resolve("malformed.xml");
        Files.writeString(malformed, "<node><interface name='I'>");

        int exitCode = run(fixture("media-player-v1.xml"), malformed.toString());

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("[malformed-document]");
    }

    @Test
    void testMissingFileIsInvalidInput() throws URISyntaxException {
        int exitCode = run(fixture("media-player-v1.xml"), tempDir.resolve("absent.xml").toString());

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("New interface file does not exist or is not a regular file");
    }

    @Test
    void testUnknownWarningCategoryIsInvalidInput() throws URISyntaxException {
        String v1 = fixture("media-player-v1.xml");

        int exitCode = run("--warnings", "info,bogus", v1, v1);

        assertThat(exitCode).isEqualTo(InterfaceDiffCommand.EXIT_INVALID_INPUT);
        assertThat(err.toString()).contains("Unknown warning category 'bogus'");
    }

    @Test
    void testExitStatusIgnoresInfoDifferences() {
        ComparisonResult result = new ComparisonResult(List.of(new Difference(Severity.INFO, "renamed")));
        DiffConfig config = DiffConfig.builder()
                .enabledSeverities(EnumSet.allOf(Severity.class))
                .recover(true)
                .fatalForwards(true)
                .build();

        assertThat(InterfaceDiffCommand.exitStatus(result, config)).isEqualTo(InterfaceDiffCommand.EXIT_COMPATIBLE);
    }

    private int run(String... args) {
        return commandLine.execute(args);
    }

    private String fixture(String name) throws URISyntaxException {
        return Path.of(getClass().getResource("/interfaces/" + name).toURI()).toString();
    }
}
