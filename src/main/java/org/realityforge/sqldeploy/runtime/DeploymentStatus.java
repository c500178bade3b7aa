package org.realityforge.sqldeploy.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

public enum DeploymentStatus {
    NO_FILES,
    COMPLETED;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(Map.of("status", name()));
        } catch (final JsonProcessingException jpe) {
            throw new IllegalStateException("Failed to serialize status " + name(), jpe);
        }
    }
}
