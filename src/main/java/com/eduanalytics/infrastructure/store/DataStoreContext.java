package com.eduanalytics.infrastructure.store;

import com.eduanalytics.domain.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the relational and document store handles for the lifetime of the process.
 *
 * Lifecycle is INITIALIZING -> READY -> SHUTDOWN. Startup fails with
 * {@link StoreUnavailableException} if either store does not answer a ping.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataStoreContext implements SmartLifecycle {

    public enum State {
        INITIALIZING,
        READY,
        SHUTDOWN
    }

    private final JdbcTemplate jdbcTemplate;
    private final MongoTemplate mongoTemplate;

    private final AtomicReference<State> state = new AtomicReference<>(State.INITIALIZING);

    @Override
    public void start() {
        pingRelational();
        pingDocuments();
        state.set(State.READY);
        log.info("Data stores ready");
    }

    @Override
    public void stop() {
        state.set(State.SHUTDOWN);
        log.info("Data store context shut down");
    }

    @Override
    public boolean isRunning() {
        return state.get() == State.READY;
    }

    public State getState() {
        return state.get();
    }

    /**
     * @throws StoreUnavailableException unless the context is READY
     */
    public void requireReady() {
        State current = state.get();
        if (current != State.READY) {
            throw new StoreUnavailableException("Data stores not available (state: " + current + ")");
        }
    }

    public JdbcTemplate relational() {
        requireReady();
        return jdbcTemplate;
    }

    public MongoTemplate documents() {
        requireReady();
        return mongoTemplate;
    }

    private void pingRelational() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);
        } catch (Exception e) {
            throw new StoreUnavailableException("Relational store unreachable: " + e.getMessage(), e);
        }
    }

    private void pingDocuments() {
        try {
            mongoTemplate.executeCommand(new Document("ping", 1));
        } catch (Exception e) {
            throw new StoreUnavailableException("Document store unreachable: " + e.getMessage(), e);
        }
    }
}
