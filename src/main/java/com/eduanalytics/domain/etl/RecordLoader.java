package com.eduanalytics.domain.etl;

import java.util.Map;

/**
 * Loads one parsed row into the warehouse. Implementations throw a runtime exception for
 * a row that cannot be loaded; the job counts it as failed and moves on.
 */
public interface RecordLoader {

    EtlJobType jobType();

    void load(RecordFields fields);

    /**
     * Value constraints per column, reported by the validation rules endpoint.
     */
    Map<String, String> constraints();
}
