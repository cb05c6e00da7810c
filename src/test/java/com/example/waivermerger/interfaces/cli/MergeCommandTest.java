package com.example.waivermerger.interfaces.cli;

import com.example.waivermerger.config.WaiverMergeProperties;
import com.example.waivermerger.support.TestDocuments;
import com.example.waivermerger.support.TestPipelines;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the command-line flow: argument checks, strict naming, confirmation and output files.
 */
class MergeCommandTest {

    @TempDir
    Path tempDir;

    private Path folder;
    private Path roster;
    private Path output;
    private final ByteArrayOutputStream console = new ByteArrayOutputStream();
    private final MergeCommand command = new MergeCommand(
            TestPipelines.pipeline(WaiverMergeProperties.defaults()), WaiverMergeProperties.defaults());

    @BeforeEach
    void setUp() throws Exception {
        folder = Files.createDirectory(tempDir.resolve("waivers"));
        roster = tempDir.resolve("roster.xlsx");
        output = tempDir.resolve("merged.pdf");
        Files.write(roster, TestDocuments.xlsx(
                new Object[]{"EYFID", "Name"},
                new Object[]{1001, "Ana Diaz"},
                new Object[]{1002, "Ben Cole"},
                new Object[]{1003, "Cy Park"}
        ));
        Files.write(folder.resolve("1001_Ana Diaz_KCS Records Consent_scan.pdf"), TestDocuments.pdf("Ana"));
        Files.write(folder.resolve("1002_Ben Cole_KCS Records Consent_scan.pdf"), TestDocuments.pdf("Ben 1", "Ben 2"));
    }

    @Test
    void wrongArgumentCountPrintsUsage() {
        int exitCode = run("n", folder.toString(), roster.toString());

        assertThat(exitCode).isEqualTo(MergeCommand.EXIT_ERROR);
        assertThat(console()).contains("Usage:");
    }

    @Test
    void badlyNamedFileAbortsBeforeMatching() throws Exception {
        Files.write(folder.resolve("1003_waiver.pdf"), TestDocuments.pdf("Cy"));

        int exitCode = run("y", folder.toString(), roster.toString(), output.toString());

        assertThat(exitCode).isEqualTo(MergeCommand.EXIT_ERROR);
        assertThat(console()).contains("do not match the expected format", "1003_waiver.pdf");
        assertThat(console()).doesNotContain("Proceed with PDF generation?");
        assertThat(output).doesNotExist();
    }

    @Test
    void declinedConfirmationWritesNothing() {
        int exitCode = run("n", folder.toString(), roster.toString(), output.toString());

        assertThat(exitCode).isEqualTo(MergeCommand.EXIT_OK);
        assertThat(console()).contains(
                "ERROR: No waiver found for EYF ID 1003",
                "Successfully matched waivers for 2 out of 3 EYF IDs. Proceed with PDF generation?",
                "Operation cancelled.");
        assertThat(output).doesNotExist();
    }

    @Test
    void confirmedRunWritesMergedPdfAndStatusReport() throws Exception {
        int exitCode = run("y", folder.toString(), roster.toString(), output.toString());

        assertThat(exitCode).isEqualTo(MergeCommand.EXIT_OK);
        assertThat(TestDocuments.pageTexts(Files.readAllBytes(output))).containsExactly("Ana", "Ben 1", "Ben 2");
        Path report = tempDir.resolve("merged_status_report.txt");
        assertThat(Files.readString(report, StandardCharsets.UTF_8)).contains("MISSING WAIVERS (1 students)", "1003");
        assertThat(console()).contains("Successfully merged 2 files");
    }

    @Test
    void existingOutputIsNotOverwritten() throws Exception {
        Files.writeString(output, "existing content");

        int exitCode = run("y", folder.toString(), roster.toString(), output.toString());

        assertThat(exitCode).isEqualTo(MergeCommand.EXIT_ERROR);
        assertThat(Files.readString(output)).isEqualTo("existing content");
        assertThat(console()).contains("Output file already exists");
    }

    @Test
    void duplicateRosterIdsStopTheRun() throws Exception {
        Files.write(roster, TestDocuments.xlsx(
                new Object[]{"EYFID"},
                new Object[]{1001},
                new Object[]{1001}
        ));

        int exitCode = run("y", folder.toString(), roster.toString(), output.toString());

        assertThat(exitCode).isEqualTo(MergeCommand.EXIT_ERROR);
        assertThat(console()).contains("Duplicate student IDs found in roster: 1001");
    }

    @Test
    void allCorruptDocumentsProduceNoOutput() throws Exception {
        Files.writeString(folder.resolve("1001_Ana Diaz_KCS Records Consent_scan.pdf"), "not a pdf");
        Files.writeString(folder.resolve("1002_Ben Cole_KCS Records Consent_scan.pdf"), "not a pdf either");

        int exitCode = run("y", folder.toString(), roster.toString(), output.toString());

        assertThat(exitCode).isEqualTo(MergeCommand.EXIT_ERROR);
        assertThat(console()).contains("[SKIPPED]", "Merge skipped");
        assertThat(output).doesNotExist();
    }

    @Test
    void damagedRosterWorkbookExitsWithError() throws Exception {
        Path damaged = tempDir.resolve("roster.xls");
        Files.write(damaged, TestDocuments.truncatedXls(
                new Object[]{"EYFID"},
                new Object[]{1001},
                new Object[]{1002}
        ));

        int exitCode = run("y", folder.toString(), damaged.toString(), output.toString());

        assertThat(exitCode).isEqualTo(MergeCommand.EXIT_ERROR);
        assertThat(console()).contains("ERROR: Could not read the roster roster.xls");
        assertThat(output).doesNotExist();
    }

    @Test
    void reportPathSitsNextToOutput() {
        assertThat(MergeCommand.reportPathFor(Path.of("out", "waivers.pdf")))
                .isEqualTo(Path.of("out", "waivers_status_report.txt"));
    }

    private int run(String answer, String... args) {
        BufferedReader input = new BufferedReader(new StringReader(answer + "\n"));
        return command.run(List.of(args), input, new PrintStream(console, true, StandardCharsets.UTF_8));
    }

    private String console() {
        return console.toString(StandardCharsets.UTF_8);
    }
}
