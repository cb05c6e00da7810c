package com.example.waivermerger.interfaces.api;

import com.example.waivermerger.application.exception.NoOutputProducedException;
import com.example.waivermerger.application.service.MergePipelineService;
import com.example.waivermerger.config.WaiverMergeProperties;
import com.example.waivermerger.domain.model.AssemblyResult;
import com.example.waivermerger.domain.model.MergePlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Interfaces-layer controller for roster/waiver uploads. Every request carries its own roster and
 * documents; nothing is cached between calls.
 */
@Controller
public class WaiverMergeController {

    static final String SKIPPED_HEADER = "X-Skipped-Documents";

    private static final Logger log = LoggerFactory.getLogger(WaiverMergeController.class);
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final MergePipelineService pipelineService;
    private final WaiverMergeProperties properties;
    private final Clock clock;

    /**
     * Creates the controller with the pipeline and its settings.
     *
     * @param pipelineService reconciliation pipeline
     * @param properties      default column name and policy
     * @param clock           clock used for download file names
     */
    public WaiverMergeController(MergePipelineService pipelineService, WaiverMergeProperties properties, Clock clock) {
        this.pipelineService = pipelineService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the match classification so a client can review it before merging.
     *
     * @param roster    uploaded roster workbook
     * @param documents uploaded waiver PDFs
     * @param column    identifier column, defaults to the configured one
     * @return JSON match summary
     */
    @PostMapping(value = "/api/plan", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<MergePlanResponse> plan(@RequestParam(value = "roster", required = false) MultipartFile roster,
                                                  @RequestParam(value = "documents", required = false) List<MultipartFile> documents,
                                                  @RequestParam(value = "column", required = false) String column) {
        MergePlan plan = planUpload(roster, documents, column);
        return ResponseEntity.ok(MergePlanResponse.from(plan));
    }

    /**
     * Merges every uniquely matched waiver into one PDF download.
     * Skipped documents are counted in the {@value #SKIPPED_HEADER} header.
     *
     * @param roster    uploaded roster workbook
     * @param documents uploaded waiver PDFs
     * @param column    identifier column, defaults to the configured one
     * @return merged PDF
     * @throws NoOutputProducedException when no matched document could be merged
     */
    @PostMapping("/api/merge")
    public ResponseEntity<byte[]> merge(@RequestParam(value = "roster", required = false) MultipartFile roster,
                                        @RequestParam(value = "documents", required = false) List<MultipartFile> documents,
                                        @RequestParam(value = "column", required = false) String column) {
        MergePlan plan = planUpload(roster, documents, column);
        AssemblyResult result = pipelineService.executeMerge(plan);
        if (!result.hasDocument()) {
            throw new NoOutputProducedException(result.errors());
        }
        if (result.isPartial()) {
            log.warn("Merged with {} skipped files: {}", result.errors().size(), result.errors());
        }
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment("merged_ferpa_waivers_", ".pdf"))
                .header(SKIPPED_HEADER, String.valueOf(result.errors().size()))
                .contentType(MediaType.APPLICATION_PDF)
                .body(result.document());
    }

    /**
     * Streams the status report listing missing and duplicate waivers.
     *
     * @param roster    uploaded roster workbook
     * @param documents uploaded waiver PDFs
     * @param column    identifier column, defaults to the configured one
     * @return UTF-8 text report
     */
    @PostMapping("/api/report")
    public ResponseEntity<byte[]> report(@RequestParam(value = "roster", required = false) MultipartFile roster,
                                         @RequestParam(value = "documents", required = false) List<MultipartFile> documents,
                                         @RequestParam(value = "column", required = false) String column) {
        MergePlan plan = planUpload(roster, documents, column);
        String report = pipelineService.report(plan);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, attachment("waiver_status_report_", ".txt"))
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(report.getBytes(StandardCharsets.UTF_8));
    }

    private MergePlan planUpload(MultipartFile roster, List<MultipartFile> documents, String column) {
        String columnName = column == null || column.isBlank() ? properties.columnName() : column.trim();
        return pipelineService.planUpload(roster, documents, columnName, properties.uploadPolicy());
    }

    private String attachment(String prefix, String extension) {
        return ContentDisposition.attachment()
                .filename(prefix + FILE_DATE.format(LocalDate.now(clock)) + extension)
                .build()
                .toString();
    }
}
