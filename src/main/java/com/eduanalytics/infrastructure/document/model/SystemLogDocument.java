package com.eduanalytics.infrastructure.document.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "system_logs")
public class SystemLogDocument {

    @Id
    private String id;

    @Indexed
    private String level;

    private String message;

    @Indexed
    private String module;

    private Map<String, Object> metadata;

    @Indexed
    private Instant createdAt;
}
