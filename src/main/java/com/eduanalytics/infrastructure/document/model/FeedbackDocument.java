package com.eduanalytics.infrastructure.document.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Student feedback on a course.
 *
 * sentiment is an opaque label supplied by the caller; nothing here computes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "student_feedback")
@CompoundIndex(name = "student_course_idx", def = "{'studentId': 1, 'courseId': 1}")
public class FeedbackDocument {

    @Id
    private String id;

    @Indexed
    private Long studentId;

    @Indexed
    private Long courseId;

    private String feedbackType;

    private Integer rating;

    private String comment;

    private String sentiment;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Indexed
    private Instant createdAt;

    private Instant updatedAt;
}
