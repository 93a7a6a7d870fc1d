package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.JobNotCancellableException;
import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.*;
import com.eduanalytics.infrastructure.document.model.EtlJobLogDocument;
import com.eduanalytics.infrastructure.document.repository.EtlJobLogRepository;
import com.eduanalytics.infrastructure.store.DataStoreContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;

/**
 * Entry point of the ETL pipeline.
 *
 * Job type and file type are resolved before a job record exists, so an unsupported request
 * never leaves a job behind. Everything after submission happens on the ETL executor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EtlService {

    static final int DEFAULT_JOB_LISTING = 50;

    private final EtlJobLogRepository jobLogRepository;
    private final EtlJobRunner jobRunner;
    private final EtlJobRegistry jobRegistry;
    private final FileParserFactory parserFactory;
    private final JsonFileParser jsonFileParser;
    private final RecordLoaderRegistry loaderRegistry;
    private final DataStoreContext dataStoreContext;

    @Value("${app.etl.max-job-listing:100}")
    private int maxJobListing = 100;

    /**
     * Starts a job over an uploaded file.
     *
     * @param fileTypeToken optional explicit type; otherwise detected from the file name
     */
    public EtlJobSubmission upload(String filename, byte[] content, String jobTypeToken, String fileTypeToken) {
        dataStoreContext.requireReady();
        EtlJobType jobType = EtlJobType.fromToken(jobTypeToken);
        FileType fileType = resolveFileType(filename, fileTypeToken);
        TabularFileParser parser = parserFactory.getParser(fileType);

        return submit(jobType, filename, () -> parser.parse(new ByteArrayInputStream(content)));
    }

    /**
     * Starts a job over inline records (parameters.records) or a file path readable by the server.
     */
    public EtlJobSubmission process(EtlProcessRequest request) {
        dataStoreContext.requireReady();
        EtlJobType jobType = EtlJobType.fromToken(request.getJobType());

        List<Map<String, Object>> inline = inlineRecords(request.getParameters());
        if (inline != null) {
            return submit(jobType, request.getFilePath(), () -> jsonFileParser.fromObjects(inline));
        }

        if (request.getFilePath() == null || request.getFilePath().isBlank()) {
            throw new ValidationException("Either file_path or parameters.records is required");
        }
        Path path = Path.of(request.getFilePath());
        TabularFileParser parser = parserFactory.getParser(FileType.fromFilename(path.getFileName().toString()));

        return submit(jobType, request.getFilePath(), () -> {
            try (InputStream input = Files.newInputStream(path)) {
                return parser.parse(input);
            }
        });
    }

    public EtlJobStatusResponse status(String jobId) {
        return EtlJobStatusResponse.from(find(jobId));
    }

    /**
     * Newest first. Limit defaults to 50 and is capped at the configured maximum.
     */
    public List<EtlJobStatusResponse> listJobs(String statusToken, String jobTypeToken, Integer limit) {
        EtlJobState status = EtlJobState.fromToken(statusToken);
        EtlJobType jobType = jobTypeToken == null || jobTypeToken.isBlank() ? null : EtlJobType.fromToken(jobTypeToken);
        int effectiveLimit = limit == null ? DEFAULT_JOB_LISTING : Math.max(1, Math.min(limit, maxJobListing));

        return jobLogRepository.findJobs(status, jobType, effectiveLimit).stream()
                .map(EtlJobStatusResponse::from)
                .toList();
    }

    /**
     * Moves a running job to cancelled and signals its worker to stop.
     *
     * @throws JobNotCancellableException when the job already reached a terminal state
     */
    public EtlJobStatusResponse cancel(String jobId) {
        EtlJobLogDocument job = find(jobId);
        if (job.getStatus() != EtlJobState.RUNNING) {
            throw new JobNotCancellableException(jobId, job.getStatus().token());
        }

        if (!jobLogRepository.finishIfRunning(jobId, EtlJobState.CANCELLED, null, Instant.now())) {
            EtlJobLogDocument current = find(jobId);
            throw new JobNotCancellableException(jobId, current.getStatus().token());
        }
        jobRegistry.cancel(jobId);

        log.info("ETL job {} cancelled", jobId);
        return status(jobId);
    }

    /**
     * Dry run over an uploaded file. Never writes anything.
     */
    public ValidationReport validate(String filename, byte[] content, String jobTypeToken) {
        ValidationReport report = ValidationReport.builder().build();

        EtlJobType jobType;
        ParsedFile file;
        try {
            jobType = jobTypeToken == null || jobTypeToken.isBlank()
                    ? EtlJobType.STUDENT_DATA
                    : EtlJobType.fromToken(jobTypeToken);
            TabularFileParser parser = parserFactory.getParser(FileType.fromFilename(filename));
            file = parser.parse(new ByteArrayInputStream(content == null ? new byte[0] : content));
        } catch (ValidationException e) {
            report.getErrors().add(e.getMessage());
            return report;
        }

        report.setColumns(file.getColumns());
        report.setTotalRecords(file.getRecords().size());

        if (file.isEmpty()) {
            report.getErrors().add("File contains no data");
            return report;
        }

        for (String column : jobType.requiredColumns()) {
            if (!file.getColumns().contains(column)) {
                report.getWarnings().add("Missing expected column: " + column);
            }
        }

        report.setValid(report.getErrors().isEmpty());
        return report;
    }

    public Map<String, ValidationRules> validationRules() {
        Map<String, ValidationRules> rules = new LinkedHashMap<>();
        for (EtlJobType type : EtlJobType.values()) {
            rules.put(type.token(), ValidationRules.builder()
                    .requiredFields(type.requiredColumns())
                    .optionalFields(type.optionalColumns())
                    .constraints(loaderRegistry.loaderFor(type).constraints())
                    .build());
        }
        return rules;
    }

    private EtlJobSubmission submit(EtlJobType jobType, String filePath, RecordSource source) {
        String jobId = UUID.randomUUID().toString();
        Instant now = Instant.now();

        jobLogRepository.save(EtlJobLogDocument.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(EtlJobState.RUNNING)
                .startTime(now)
                .filePath(filePath)
                .createdAt(now)
                .build());
        jobRegistry.register(jobId);

        try {
            jobRunner.runAsync(jobId, jobType, source);
        } catch (TaskRejectedException e) {
            log.warn("ETL executor rejected job {}: {}", jobId, e.getMessage());
            jobRegistry.remove(jobId);
            jobLogRepository.finishIfRunning(jobId, EtlJobState.FAILED, "ETL executor queue is full", Instant.now());
            return EtlJobSubmission.builder()
                    .jobId(jobId)
                    .status(EtlJobState.FAILED)
                    .message("ETL executor queue is full")
                    .build();
        }

        log.info("ETL job {} submitted (type: {}, source: {})", jobId, jobType.token(), filePath);
        return EtlJobSubmission.builder()
                .jobId(jobId)
                .status(EtlJobState.RUNNING)
                .message("ETL job started")
                .build();
    }

    private EtlJobLogDocument find(String jobId) {
        return jobLogRepository.findByJobId(jobId)
                .orElseThrow(() -> ResourceNotFoundException.of("ETL job", jobId));
    }

    private static FileType resolveFileType(String filename, String fileTypeToken) {
        if (fileTypeToken != null && !fileTypeToken.isBlank()) {
            return FileType.fromToken(fileTypeToken);
        }
        return FileType.fromFilename(filename);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> inlineRecords(Map<String, Object> parameters) {
        if (parameters == null || !parameters.containsKey("records")) {
            return null;
        }
        Object records = parameters.get("records");
        if (!(records instanceof List<?> list)) {
            throw new ValidationException("parameters.records must be an array of objects");
        }
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new ValidationException("parameters.records must be an array of objects");
            }
        }
        return (List<Map<String, Object>>) records;
    }
}
