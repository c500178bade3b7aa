package org.realityforge.sqldeploy.request;

import java.util.Objects;

public record ScriptFile(String path, String content) {
    public ScriptFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
    }

    public String scriptName() {
        final int separator = path.lastIndexOf('/');
        return -1 == separator ? path : path.substring(separator + 1);
    }
}
