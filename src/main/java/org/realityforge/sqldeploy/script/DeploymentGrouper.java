package org.realityforge.sqldeploy.script;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.realityforge.sqldeploy.request.ScriptFile;

public final class DeploymentGrouper {
    private static final Logger LOGGER = Logger.getLogger(DeploymentGrouper.class.getName());
    private static final int MIN_SEGMENTS = 4;

    private final String deploymentRoot;
    private final String deploymentIdPrefix;

    public DeploymentGrouper(final String deploymentRoot, final String deploymentIdPrefix) {
        this.deploymentRoot = deploymentRoot;
        this.deploymentIdPrefix = deploymentIdPrefix;
    }

    public List<DeploymentGroup> group(final List<ScriptFile> files) {
        final Map<String, List<ScriptFile>> grouped = new TreeMap<>();
        for (final ScriptFile file : files) {
            final String deploymentId = deploymentId(file.path());
            if (null == deploymentId) {
                LOGGER.log(Level.FINE, "Skipping {0}: not a deployment script path", file.path());
                continue;
            }
            grouped.computeIfAbsent(deploymentId, key -> new ArrayList<>()).add(file);
        }
        final List<DeploymentGroup> groups = new ArrayList<>(grouped.size());
        for (final Map.Entry<String, List<ScriptFile>> entry : grouped.entrySet()) {
            groups.add(new DeploymentGroup(entry.getKey(), entry.getValue()));
        }
        return List.copyOf(groups);
    }

    private @Nullable String deploymentId(final String path) {
        final String[] segments = path.split("/", -1);
        if (segments.length < MIN_SEGMENTS) {
            return null;
        }
        final String deploymentId = segments[2];
        if (!deploymentRoot.equals(segments[1])
                || deploymentId.isEmpty()
                || !deploymentId.startsWith(deploymentIdPrefix)
                || segments[segments.length - 1].isEmpty()) {
            return null;
        }
        return deploymentId;
    }
}
