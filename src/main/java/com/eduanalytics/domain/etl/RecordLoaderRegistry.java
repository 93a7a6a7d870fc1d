package com.eduanalytics.domain.etl;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Job type to loader dispatch. Every job type must have exactly one loader.
 */
@Component
public class RecordLoaderRegistry {

    private final Map<EtlJobType, RecordLoader> loaders = new EnumMap<>(EtlJobType.class);

    public RecordLoaderRegistry(List<RecordLoader> recordLoaders) {
        for (RecordLoader loader : recordLoaders) {
            RecordLoader previous = loaders.put(loader.jobType(), loader);
            if (previous != null) {
                throw new IllegalStateException("Duplicate loader for job type " + loader.jobType());
            }
        }
        for (EtlJobType type : EtlJobType.values()) {
            if (!loaders.containsKey(type)) {
                throw new IllegalStateException("No loader registered for job type " + type);
            }
        }
    }

    public RecordLoader loaderFor(EtlJobType jobType) {
        return loaders.get(jobType);
    }
}
