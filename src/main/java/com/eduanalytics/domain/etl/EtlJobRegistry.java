package com.eduanalytics.domain.etl;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation tokens of the jobs running in this process.
 */
@Component
public class EtlJobRegistry {

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    public CancellationToken register(String jobId) {
        CancellationToken token = new CancellationToken();
        tokens.put(jobId, token);
        return token;
    }

    public CancellationToken get(String jobId) {
        return tokens.get(jobId);
    }

    /**
     * @return false when the job is not running in this process
     */
    public boolean cancel(String jobId) {
        CancellationToken token = tokens.get(jobId);
        if (token == null) {
            return false;
        }
        token.cancel();
        return true;
    }

    public void remove(String jobId) {
        tokens.remove(jobId);
    }

    public int size() {
        return tokens.size();
    }
}
