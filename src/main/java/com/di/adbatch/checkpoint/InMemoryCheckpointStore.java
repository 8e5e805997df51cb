package com.di.adbatch.checkpoint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local store for dry runs and tests. Records are copied in and out so callers
 * never share state with the store.
 */
public class InMemoryCheckpointStore extends AbstractCheckpointStore {

    private final Map<String, CheckpointRecord> records = new LinkedHashMap<>();

    @Override
    protected synchronized Optional<CheckpointRecord> read(String sessionId) {
        return Optional.ofNullable(records.get(sessionId)).map(CheckpointRecord::copy);
    }

    @Override
    protected synchronized void write(CheckpointRecord record) {
        records.put(record.getSessionId(), record.copy());
    }

    @Override
    protected synchronized void remove(String sessionId) {
        records.remove(sessionId);
    }

    @Override
    protected synchronized List<String> sessionIds() {
        return new ArrayList<>(records.keySet());
    }
}
