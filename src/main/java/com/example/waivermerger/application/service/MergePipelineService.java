package com.example.waivermerger.application.service;

import com.example.waivermerger.application.exception.MergeRequestValidationException;
import com.example.waivermerger.domain.exception.FilenameFormatException;
import com.example.waivermerger.domain.exception.SourceNotFoundException;
import com.example.waivermerger.domain.model.AssemblyResult;
import com.example.waivermerger.domain.model.IdentifierSet;
import com.example.waivermerger.domain.model.MatchResult;
import com.example.waivermerger.domain.model.MergePlan;
import com.example.waivermerger.domain.model.MergePolicy;
import com.example.waivermerger.infrastructure.exception.PdfProcessingException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Application-layer service that runs the reconciliation pipeline in two phases: {@code planMerge}
 * extracts and matches, {@code executeMerge} assembles. Callers decide whether to confirm in between.
 * All state lives in the returned {@link MergePlan}.
 */
@Service
public class MergePipelineService {

    private static final Logger log = LoggerFactory.getLogger(MergePipelineService.class);

    private final RosterImportService rosterImportService;
    private final DocumentMatcher matcher;
    private final DocumentAssembler assembler;
    private final StatusReportService reportService;

    public MergePipelineService(RosterImportService rosterImportService,
                                DocumentMatcher matcher,
                                DocumentAssembler assembler,
                                StatusReportService reportService) {
        this.rosterImportService = rosterImportService;
        this.matcher = matcher;
        this.assembler = assembler;
        this.reportService = reportService;
    }

    /**
     * Validates document names against the policy and classifies every identifier.
     *
     * @param identifiers roster identifiers
     * @param candidates  document file name to content
     * @param policy      merge policy
     * @return plan ready for execution and reporting
     * @throws FilenameFormatException when the policy requires a name format and any name violates it
     */
    public MergePlan planMerge(IdentifierSet identifiers, Map<String, byte[]> candidates, MergePolicy policy) {
        verifyFilenames(candidates, policy);
        MatchResult matches = matcher.match(candidates, identifiers);
        MergePlan plan = new MergePlan(identifiers, matches, policy);
        log.info(plan.summary());
        if (!matches.unclaimed().isEmpty()) {
            log.info("Files not claimed by any student ID: {}", matches.unclaimed());
        }
        return plan;
    }

    /**
     * Plans a merge from uploaded files.
     *
     * @param roster     uploaded roster
     * @param documents  uploaded waiver PDFs
     * @param columnName roster identifier column
     * @param policy     merge policy
     * @return plan ready for execution and reporting
     * @throws MergeRequestValidationException when no documents were uploaded
     */
    public MergePlan planUpload(MultipartFile roster, List<MultipartFile> documents, String columnName,
                                MergePolicy policy) {
        IdentifierSet identifiers = rosterImportService.importRoster(roster, columnName, policy.headerFallbackRows());
        if (documents == null || documents.stream().allMatch(MultipartFile::isEmpty)) {
            throw new MergeRequestValidationException("Please upload at least one waiver PDF.");
        }
        Map<String, byte[]> candidates = new LinkedHashMap<>();
        for (MultipartFile document : documents) {
            if (document.isEmpty()) {
                continue;
            }
            String name = document.getOriginalFilename() != null ? document.getOriginalFilename() : document.getName();
            try {
                candidates.put(name, document.getBytes());
            } catch (IOException e) {
                throw new PdfProcessingException("Unable to read the uploaded file " + name, e);
            }
        }
        return planMerge(identifiers, candidates, policy);
    }

    /**
     * Plans a merge from a roster file and a folder of waiver PDFs. Files are taken in name order.
     *
     * @param documentFolder folder holding the waivers
     * @param rosterPath     roster workbook or ID list
     * @param columnName     roster identifier column
     * @param policy         merge policy
     * @return plan ready for execution and reporting
     * @throws SourceNotFoundException when the folder does not exist
     */
    public MergePlan planFolder(Path documentFolder, Path rosterPath, String columnName, MergePolicy policy) {
        if (!Files.isDirectory(documentFolder)) {
            throw new SourceNotFoundException(documentFolder.toAbsolutePath().toString());
        }
        Map<String, byte[]> candidates = readFolder(documentFolder);
        verifyFilenames(candidates, policy);
        IdentifierSet identifiers = rosterImportService.importRoster(rosterPath, columnName, policy.headerFallbackRows());
        return planMerge(identifiers, candidates, policy);
    }

    /**
     * @param plan result of a planning phase
     * @return merged document and per-document errors
     */
    public AssemblyResult executeMerge(MergePlan plan) {
        return assembler.assemble(plan.matches().matched(), plan.policy().includeCoverPage());
    }

    /**
     * @param plan result of a planning phase
     * @return status report text
     */
    public String report(MergePlan plan) {
        return reportService.report(plan.matches().missing(), plan.matches().duplicates());
    }

    private void verifyFilenames(Map<String, byte[]> candidates, MergePolicy policy) {
        if (!policy.requireFilenamePattern()) {
            return;
        }
        List<String> invalid = candidates.keySet().stream()
                .filter(name -> !policy.filenamePattern().matcher(name).matches())
                .toList();
        if (!invalid.isEmpty()) {
            throw new FilenameFormatException(policy.filenamePattern().pattern(), invalid);
        }
    }

    private Map<String, byte[]> readFolder(Path folder) {
        Map<String, byte[]> candidates = new LinkedHashMap<>();
        try (Stream<Path> files = Files.list(folder)) {
            List<Path> sorted = files.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
            for (Path file : sorted) {
                candidates.put(file.getFileName().toString(), Files.readAllBytes(file));
            }
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the documents in " + folder, e);
        }
        return candidates;
    }
}
