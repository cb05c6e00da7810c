package com.example.waivermerger.interfaces.cli;

import com.example.waivermerger.application.service.MergePipelineService;
import com.example.waivermerger.config.WaiverMergeProperties;
import com.example.waivermerger.domain.exception.DomainException;
import com.example.waivermerger.domain.exception.FilenameFormatException;
import com.example.waivermerger.domain.model.AssemblyResult;
import com.example.waivermerger.domain.model.DuplicateConflict;
import com.example.waivermerger.domain.model.MergePlan;
import com.example.waivermerger.domain.model.MergePolicy;
import com.example.waivermerger.infrastructure.exception.InfrastructureException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Non-interactive merge: {@code <document_folder> <identifier_source> <output_path>}.
 * Plans the merge, prints the match summary, asks for confirmation, then writes the PDF and, when
 * anything is missing or duplicated, a status report next to it.
 */
@Component
public class MergeCommand {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    private final MergePipelineService pipelineService;
    private final WaiverMergeProperties properties;

    public MergeCommand(MergePipelineService pipelineService, WaiverMergeProperties properties) {
        this.pipelineService = pipelineService;
        this.properties = properties;
    }

    /**
     * Runs the command.
     *
     * @param args  positional arguments
     * @param input console input used for the confirmation prompt
     * @param out   console output
     * @return process exit code: 1 on usage or input errors, 0 on success or cancellation
     */
    public int run(List<String> args, BufferedReader input, PrintStream out) {
        if (args.size() != 3) {
            printUsage(out);
            return EXIT_ERROR;
        }
        Path documentFolder = Path.of(args.get(0));
        Path identifierSource = Path.of(args.get(1));
        Path outputPath = Path.of(args.get(2));
        MergePolicy policy = properties.cliPolicy();

        if (Files.exists(outputPath) && !policy.overwriteExisting()) {
            out.println("Output file already exists: " + outputPath);
            out.println("Set 'waiver.overwrite-existing=true' to force merging and replacement.");
            return EXIT_ERROR;
        }

        MergePlan plan;
        try {
            plan = pipelineService.planFolder(documentFolder, identifierSource, properties.columnName(), policy);
        } catch (FilenameFormatException e) {
            out.println("ERROR: Some files do not match the expected format: " + policy.filenamePattern().pattern());
            e.getInvalidNames().forEach(out::println);
            return EXIT_ERROR;
        } catch (DomainException | InfrastructureException e) {
            out.println("ERROR: " + e.getMessage());
            return EXIT_ERROR;
        }

        printMatches(plan, out);
        if (!confirm(input, out)) {
            out.println("Operation cancelled.");
            return EXIT_OK;
        }
        return execute(plan, outputPath, out);
    }

    private void printMatches(MergePlan plan, PrintStream out) {
        for (String identifier : plan.matches().missing()) {
            out.println("ERROR: No waiver found for EYF ID " + identifier);
        }
        for (DuplicateConflict conflict : plan.matches().duplicates()) {
            out.println("ERROR: Multiple waivers found for EYF ID " + conflict.identifier() + ":");
            conflict.fileNames().forEach(name -> out.println("  " + name));
        }
        for (String name : plan.matches().unclaimed()) {
            out.println("WARNING: No EYF ID in the roster for " + name);
        }
        out.println("Successfully matched waivers for " + plan.matches().matched().size() + " out of "
                + plan.identifiers().size() + " EYF IDs. Proceed with PDF generation?");
    }

    private boolean confirm(BufferedReader input, PrintStream out) {
        out.print("Enter 'y' to continue or 'n' to cancel: ");
        out.flush();
        try {
            String answer = input.readLine();
            return answer != null && answer.strip().toLowerCase(Locale.ROOT).equals("y");
        } catch (IOException e) {
            log.warn("Could not read confirmation", e);
            return false;
        }
    }

    private int execute(MergePlan plan, Path outputPath, PrintStream out) {
        if (!plan.hasMatches()) {
            out.println("No matching waivers found. Please check that PDF filenames start with the correct EYF ID.");
            return EXIT_ERROR;
        }
        AssemblyResult result;
        try {
            result = pipelineService.executeMerge(plan);
        } catch (InfrastructureException e) {
            out.println("ERROR: " + e.getMessage());
            return EXIT_ERROR;
        }
        result.errors().forEach(error -> out.println("  [SKIPPED] " + error));
        if (!result.hasDocument()) {
            out.println("No valid PDF files were successfully appended. Merge skipped.");
            return EXIT_ERROR;
        }

        try {
            Files.write(outputPath, result.document());
            if (!plan.matches().isComplete()) {
                Path reportPath = reportPathFor(outputPath);
                Files.writeString(reportPath, pipelineService.report(plan), StandardCharsets.UTF_8);
                out.println("Status report written to " + reportPath);
            }
        } catch (IOException e) {
            out.println("ERROR: Failed to write output file: " + e.getMessage());
            return EXIT_ERROR;
        }
        out.println("Successfully merged " + result.mergedCount() + " files into " + outputPath
                + " (" + result.pageCount() + " pages)");
        return EXIT_OK;
    }

    static Path reportPathFor(Path outputPath) {
        String fileName = outputPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return outputPath.resolveSibling(base + "_status_report.txt");
    }

    private void printUsage(PrintStream out) {
        out.println("Usage: waiver-merger <document_folder> <identifier_source> <output_path>");
        out.println("  <document_folder>:   folder containing the FERPA waiver PDFs");
        out.println("  <identifier_source>: roster workbook (.xlsx/.xls) or text file with one EYF ID per line");
        out.println("  <output_path>:       merged PDF to write");
    }
}
