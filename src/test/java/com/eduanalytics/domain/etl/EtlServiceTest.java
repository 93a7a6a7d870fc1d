package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.JobNotCancellableException;
import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.exception.UnsupportedFileTypeException;
import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.EtlJobStatusResponse;
import com.eduanalytics.domain.model.EtlJobSubmission;
import com.eduanalytics.domain.model.EtlProcessRequest;
import com.eduanalytics.domain.model.ValidationReport;
import com.eduanalytics.infrastructure.document.model.EtlJobLogDocument;
import com.eduanalytics.infrastructure.document.repository.EtlJobLogRepository;
import com.eduanalytics.infrastructure.store.DataStoreContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EtlService.
 *
 * The runner is mocked; parsing uses the real parsers.
 */
@ExtendWith(MockitoExtension.class)
class EtlServiceTest {

    private static final String STUDENT_CSV = """
            student_number,first_name,last_name,email,date_of_birth,gender,enrollment_date
            S001,Ada,Lovelace,ada@example.edu,2001-12-10,female,2020-09-01
            S002,Alan,Turing,alan@example.edu,2002-06-23,male,2020-09-01
            """;

    @Mock
    private EtlJobLogRepository jobLogRepository;

    @Mock
    private EtlJobRunner jobRunner;

    @Mock
    private RecordLoaderRegistry loaderRegistry;

    @Mock
    private DataStoreContext dataStoreContext;

    private EtlJobRegistry jobRegistry;
    private EtlService etlService;

    @BeforeEach
    void setUp() {
        JsonFileParser jsonFileParser = new JsonFileParser(new ObjectMapper());
        FileParserFactory parserFactory = new FileParserFactory(
                new CsvFileParser(), new ExcelFileParser(), jsonFileParser);
        jobRegistry = new EtlJobRegistry();
        etlService = new EtlService(jobLogRepository, jobRunner, jobRegistry, parserFactory,
                jsonFileParser, loaderRegistry, dataStoreContext);
    }

    @Test
    void testUpload_StartsRunningJob() {
        // When
        EtlJobSubmission submission = etlService.upload("students.csv", bytes(STUDENT_CSV), "student_data", null);

        // Then
        assertEquals(EtlJobState.RUNNING, submission.getStatus());
        assertNotNull(submission.getJobId());

        ArgumentCaptor<EtlJobLogDocument> captor = ArgumentCaptor.forClass(EtlJobLogDocument.class);
        verify(jobLogRepository).save(captor.capture());
        EtlJobLogDocument saved = captor.getValue();
        assertEquals(submission.getJobId(), saved.getJobId());
        assertEquals(EtlJobType.STUDENT_DATA, saved.getJobType());
        assertEquals(EtlJobState.RUNNING, saved.getStatus());
        assertEquals("students.csv", saved.getFilePath());
        assertNull(saved.getEndTime());

        verify(jobRunner).runAsync(eq(submission.getJobId()), eq(EtlJobType.STUDENT_DATA), any(RecordSource.class));
        assertNotNull(jobRegistry.get(submission.getJobId()));
    }

    @Test
    void testUpload_UnsupportedExtensionLeavesNoJob() {
        assertThrows(UnsupportedFileTypeException.class,
                () -> etlService.upload("students.pdf", bytes("x"), "student_data", null));

        verify(jobLogRepository, never()).save(any());
        verifyNoInteractions(jobRunner);
    }

    @Test
    void testUpload_UnknownJobTypeLeavesNoJob() {
        assertThrows(ValidationException.class,
                () -> etlService.upload("students.csv", bytes(STUDENT_CSV), "grades", null));

        verify(jobLogRepository, never()).save(any());
        verifyNoInteractions(jobRunner);
    }

    @Test
    void testUpload_ExplicitFileTypeOverridesExtension() throws Exception {
        // When
        etlService.upload("export.dat", bytes("[{\"student_number\": \"S001\"}]"), "student_data", "json");

        // Then - the submitted source parses as JSON
        ArgumentCaptor<RecordSource> captor = ArgumentCaptor.forClass(RecordSource.class);
        verify(jobRunner).runAsync(anyString(), eq(EtlJobType.STUDENT_DATA), captor.capture());
        ParsedFile file = captor.getValue().read();
        assertEquals("S001", file.getRecords().get(0).get("student_number"));
    }

    @Test
    void testUpload_RejectedByExecutorFailsJob() {
        // Given
        doThrow(new TaskRejectedException("queue full"))
                .when(jobRunner).runAsync(anyString(), any(EtlJobType.class), any(RecordSource.class));

        // When
        EtlJobSubmission submission = etlService.upload("students.csv", bytes(STUDENT_CSV), "student_data", null);

        // Then
        assertEquals(EtlJobState.FAILED, submission.getStatus());
        verify(jobLogRepository).finishIfRunning(eq(submission.getJobId()), eq(EtlJobState.FAILED),
                eq("ETL executor queue is full"), any(Instant.class));
        assertEquals(0, jobRegistry.size());
    }

    @Test
    void testProcess_InlineRecords() throws Exception {
        // Given
        EtlProcessRequest request = new EtlProcessRequest();
        request.setJobType("course_data");
        request.setParameters(Map.of("records", List.of(
                Map.of("course_code", "CS101", "credits", 3),
                Map.of("course_code", "CS102", "credits", 4))));

        // When
        etlService.process(request);

        // Then
        ArgumentCaptor<RecordSource> captor = ArgumentCaptor.forClass(RecordSource.class);
        verify(jobRunner).runAsync(anyString(), eq(EtlJobType.COURSE_DATA), captor.capture());
        ParsedFile file = captor.getValue().read();
        assertEquals(2, file.getRecords().size());
        assertEquals("4", file.getRecords().get(1).get("credits"));
    }

    @Test
    void testProcess_RecordsMustBeObjects() {
        EtlProcessRequest request = new EtlProcessRequest();
        request.setJobType("course_data");
        request.setParameters(Map.of("records", List.of("CS101")));

        assertThrows(ValidationException.class, () -> etlService.process(request));
        verify(jobLogRepository, never()).save(any());
    }

    @Test
    void testProcess_NoSourceRejected() {
        EtlProcessRequest request = new EtlProcessRequest();
        request.setJobType("student_data");

        assertThrows(ValidationException.class, () -> etlService.process(request));
        verifyNoInteractions(jobRunner);
    }

    @Test
    void testCancel_RunningJob() {
        // Given
        when(jobLogRepository.findByJobId("job-1"))
                .thenReturn(Optional.of(job("job-1", EtlJobState.RUNNING)))
                .thenReturn(Optional.of(job("job-1", EtlJobState.CANCELLED)));
        when(jobLogRepository.finishIfRunning(eq("job-1"), eq(EtlJobState.CANCELLED), isNull(), any(Instant.class)))
                .thenReturn(true);
        CancellationToken token = jobRegistry.register("job-1");

        // When
        EtlJobStatusResponse response = etlService.cancel("job-1");

        // Then
        assertEquals(EtlJobState.CANCELLED, response.getStatus());
        assertTrue(token.isCancelled());
    }

    @Test
    void testCancel_CompletedJobNotCancellable() {
        // Given
        when(jobLogRepository.findByJobId("job-1")).thenReturn(Optional.of(job("job-1", EtlJobState.COMPLETED)));

        // When / Then
        assertThrows(JobNotCancellableException.class, () -> etlService.cancel("job-1"));
        verify(jobLogRepository, never()).finishIfRunning(anyString(), any(), any(), any());
    }

    @Test
    void testCancel_JobFinishedConcurrently() {
        // Given - the job completes between the read and the conditional update
        when(jobLogRepository.findByJobId("job-1"))
                .thenReturn(Optional.of(job("job-1", EtlJobState.RUNNING)))
                .thenReturn(Optional.of(job("job-1", EtlJobState.COMPLETED)));
        when(jobLogRepository.finishIfRunning(eq("job-1"), eq(EtlJobState.CANCELLED), isNull(), any(Instant.class)))
                .thenReturn(false);

        // When / Then
        assertThrows(JobNotCancellableException.class, () -> etlService.cancel("job-1"));
    }

    @Test
    void testStatus_UnknownJob() {
        when(jobLogRepository.findByJobId("missing")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> etlService.status("missing"));
    }

    @Test
    void testListJobs_LimitClamped() {
        // Given
        when(jobLogRepository.findJobs(any(), any(), anyInt())).thenReturn(List.of());

        // When
        etlService.listJobs(null, null, 1000);
        etlService.listJobs("running", "student_data", 0);
        etlService.listJobs(null, null, null);

        // Then
        verify(jobLogRepository).findJobs(null, null, 100);
        verify(jobLogRepository).findJobs(EtlJobState.RUNNING, EtlJobType.STUDENT_DATA, 1);
        verify(jobLogRepository).findJobs(null, null, 50);
    }

    @Test
    void testValidate_ValidFile() {
        // When
        ValidationReport report = etlService.validate("students.csv", bytes(STUDENT_CSV), "student_data");

        // Then
        assertTrue(report.isValid());
        assertEquals(2, report.getTotalRecords());
        assertTrue(report.getWarnings().isEmpty());
        verifyNoInteractions(jobLogRepository, jobRunner);
    }

    @Test
    void testValidate_MissingColumnsAreWarnings() {
        // When
        ValidationReport report = etlService.validate("students.csv",
                bytes("student_number,first_name\nS001,Ada\n"), null);

        // Then
        assertTrue(report.isValid());
        assertTrue(report.getWarnings().contains("Missing expected column: email"));
        assertTrue(report.getWarnings().contains("Missing expected column: last_name"));
    }

    @Test
    void testValidate_EmptyFileIsInvalid() {
        // When
        ValidationReport report = etlService.validate("students.json", bytes("[]"), "student_data");

        // Then
        assertFalse(report.isValid());
        assertEquals(List.of("File contains no data"), report.getErrors());
    }

    @Test
    void testValidate_UnsupportedTypeReportedAsError() {
        // When
        ValidationReport report = etlService.validate("students.docx", bytes("x"), "student_data");

        // Then
        assertFalse(report.isValid());
        assertEquals(List.of("Unsupported file type: .docx"), report.getErrors());
    }

    private static EtlJobLogDocument job(String jobId, EtlJobState status) {
        return EtlJobLogDocument.builder()
                .jobId(jobId)
                .jobType(EtlJobType.STUDENT_DATA)
                .status(status)
                .startTime(Instant.now())
                .build();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
