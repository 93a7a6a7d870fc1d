package com.eduanalytics.api;

import com.eduanalytics.domain.etl.EtlService;
import com.eduanalytics.domain.model.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * REST API for bulk loads.
 *
 * Endpoints:
 * - POST /api/v1/etl/upload - Upload a file and start a job
 * - POST /api/v1/etl/process - Start a job over inline records or a server-side file
 * - GET /api/v1/etl/status/{jobId} - Job status and progress
 * - GET /api/v1/etl/jobs - Recent jobs, newest first
 * - POST /api/v1/etl/jobs/{jobId}/cancel - Cancel a running job
 * - POST /api/v1/etl/validate-data - Dry-run validation of a file
 * - GET /api/v1/etl/validation-rules - Expected columns per job type
 *
 * Job submission returns 202 with the job id; the load itself runs in the background.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/etl")
@RequiredArgsConstructor
public class EtlController {

    private final EtlService etlService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<EtlJobSubmission> upload(
            @RequestParam("file") MultipartFile file,
            @RequestParam("job_type") String jobType,
            @RequestParam(name = "file_type", required = false) String fileType) throws IOException {

        log.info("ETL upload: file={}, size={}, jobType={}", file.getOriginalFilename(), file.getSize(), jobType);
        EtlJobSubmission submission = etlService.upload(file.getOriginalFilename(), file.getBytes(), jobType, fileType);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submission);
    }

    @PostMapping("/process")
    public ResponseEntity<EtlJobSubmission> process(@Valid @RequestBody EtlProcessRequest request) {
        log.info("ETL process: jobType={}, filePath={}", request.getJobType(), request.getFilePath());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(etlService.process(request));
    }

    @GetMapping("/status/{jobId}")
    public ResponseEntity<EtlJobStatusResponse> status(@PathVariable String jobId) {
        return ResponseEntity.ok(etlService.status(jobId));
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<EtlJobStatusResponse>> jobs(
            @RequestParam(required = false) String status,
            @RequestParam(name = "job_type", required = false) String jobType,
            @RequestParam(required = false) Integer limit) {

        return ResponseEntity.ok(etlService.listJobs(status, jobType, limit));
    }

    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<EtlJobStatusResponse> cancel(@PathVariable String jobId) {
        log.info("ETL cancel: {}", jobId);
        return ResponseEntity.ok(etlService.cancel(jobId));
    }

    @PostMapping(value = "/validate-data", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ValidationReport> validate(
            @RequestParam("file") MultipartFile file,
            @RequestParam(name = "job_type", required = false) String jobType) throws IOException {

        return ResponseEntity.ok(etlService.validate(file.getOriginalFilename(), file.getBytes(), jobType));
    }

    @GetMapping("/validation-rules")
    public ResponseEntity<Map<String, ValidationRules>> validationRules() {
        return ResponseEntity.ok(etlService.validationRules());
    }
}
