package org.realityforge.sqldeploy.request;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

public final class DeploymentRequestParser {
    private final ObjectMapper objectMapper;

    public DeploymentRequestParser() {
        this(new ObjectMapper(new JsonFactoryBuilder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxStringLength(Integer.MAX_VALUE)
                        .build())
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build()));
    }

    DeploymentRequestParser(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public DeploymentRequest parse(final InputStream input, final String sourceName) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(input);
        } catch (final JsonProcessingException jpe) {
            throw malformed(sourceName, jpe);
        } catch (final IOException ioe) {
            throw new RequestFormatException("Failed to read request from " + sourceName, ioe);
        }
        return toRequest(root, sourceName);
    }

    public DeploymentRequest parse(final String json, final String sourceName) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (final JsonProcessingException jpe) {
            throw malformed(sourceName, jpe);
        }
        return toRequest(root, sourceName);
    }

    private static DeploymentRequest toRequest(final @Nullable JsonNode root, final String sourceName) {
        if (null == root || root.isMissingNode() || root.isNull()) {
            return new DeploymentRequest(List.of());
        }
        if (!root.isObject()) {
            throw invalid("Expected root object in " + sourceName + " to be a map.");
        }
        final JsonNode entries = root.path("files");
        if (entries.isMissingNode() || entries.isNull()) {
            return new DeploymentRequest(List.of());
        }
        if (!entries.isArray()) {
            throw invalid("Expected list for key 'files' at " + sourceName + '.');
        }
        final List<ScriptFile> files = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            final JsonNode entry = entries.get(i);
            final String path = sourceName + ".files[" + i + ']';
            if (!entry.isObject()) {
                throw invalid("Expected map entry at " + path + " but got: " + entry);
            }
            final JsonNode filename = entry.path("filename");
            if (!filename.isTextual()) {
                throw invalid("Missing required string key 'filename' at " + path + '.');
            }
            final JsonNode content = entry.path("content");
            if (!content.isMissingNode() && !content.isNull() && !content.isTextual()) {
                throw invalid("Expected string for key 'content' at " + path + '.');
            }
            files.add(new ScriptFile(filename.textValue(), content.isTextual() ? content.textValue() : ""));
        }
        return new DeploymentRequest(files);
    }

    private static RequestFormatException malformed(final String sourceName, final JsonProcessingException cause) {
        return new RequestFormatException(
                "Malformed deployment request: Unable to parse " + sourceName + ": " + cause.getOriginalMessage(),
                cause);
    }

    private static RequestFormatException invalid(final String message) {
        return new RequestFormatException("Malformed deployment request: " + message);
    }
}
