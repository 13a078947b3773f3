package com.esshopzilla.analytics.keywordperformance.api;

import com.esshopzilla.analytics.keywordperformance.engine.ReportService;
import com.esshopzilla.analytics.keywordperformance.model.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Triggers a report run for a file visible to this process.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;

    @PostMapping("/reports")
    public ResponseEntity<?> generate(@RequestBody(required = false) ReportRequest request) {
        if (request == null || request.getInputFile() == null || request.getInputFile().isBlank()) {
            log.warn("Rejecting report request without input_file: {}", request);
            return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid request"));
        }
        log.info("Report requested: {}", request);

        Path input = Paths.get(request.getInputFile());
        Path outputDir = request.getOutputDir() == null || request.getOutputDir().isBlank()
                ? null
                : Paths.get(request.getOutputDir());

        RunSummary summary = reportService.generate(input, outputDir);
        return ResponseEntity.ok(summary);
    }
}
