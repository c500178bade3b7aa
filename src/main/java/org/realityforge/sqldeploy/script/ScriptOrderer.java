package org.realityforge.sqldeploy.script;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.realityforge.sqldeploy.request.ScriptFile;

public final class ScriptOrderer {
    static final long MISSING_VERSION = 9999L;

    private final FilenameValidator filenameValidator;

    public ScriptOrderer(final FilenameValidator filenameValidator) {
        this.filenameValidator = filenameValidator;
    }

    public List<ScriptFile> order(final List<ScriptFile> scripts) {
        final List<ScriptFile> ordered = new ArrayList<>(scripts);
        ordered.sort(Comparator.comparingLong(this::sortVersion).thenComparing(ScriptFile::path));
        return List.copyOf(ordered);
    }

    private long sortVersion(final ScriptFile script) {
        return filenameValidator.version(script.scriptName()).orElse(MISSING_VERSION);
    }
}
