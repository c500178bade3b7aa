package org.realityforge.sqldeploy.ledger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class InMemoryExecutionLedger implements ExecutionLedger {
    private final Map<Key, ExecutionRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized Optional<ExecutionRecord> find(final String deploymentId, final String scriptName) {
        return Optional.ofNullable(records.get(new Key(deploymentId, scriptName)));
    }

    @Override
    public synchronized void put(final ExecutionRecord record) {
        records.put(new Key(record.deploymentId(), record.scriptName()), record);
    }

    public synchronized List<ExecutionRecord> records() {
        return List.copyOf(new ArrayList<>(records.values()));
    }

    private record Key(String deploymentId, String scriptName) {}
}
