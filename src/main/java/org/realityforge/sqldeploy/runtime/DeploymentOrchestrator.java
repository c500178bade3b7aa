package org.realityforge.sqldeploy.runtime;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.realityforge.sqldeploy.config.DeployConfig;
import org.realityforge.sqldeploy.db.ScriptExecutor;
import org.realityforge.sqldeploy.ledger.ExecutionLedger;
import org.realityforge.sqldeploy.ledger.ExecutionRecord;
import org.realityforge.sqldeploy.ledger.ExecutionStatus;
import org.realityforge.sqldeploy.ledger.LedgerClient;
import org.realityforge.sqldeploy.ledger.LedgerException;
import org.realityforge.sqldeploy.notify.Notification;
import org.realityforge.sqldeploy.notify.Notifier;
import org.realityforge.sqldeploy.notify.SafeNotifier;
import org.realityforge.sqldeploy.request.DeploymentRequest;
import org.realityforge.sqldeploy.request.ScriptFile;
import org.realityforge.sqldeploy.script.AgePolicy;
import org.realityforge.sqldeploy.script.DeploymentGroup;
import org.realityforge.sqldeploy.script.DeploymentGrouper;
import org.realityforge.sqldeploy.script.FilenameCheck;
import org.realityforge.sqldeploy.script.FilenameValidator;
import org.realityforge.sqldeploy.script.ScriptOrderer;

public final class DeploymentOrchestrator {
    public static final String ALREADY_EXECUTED_REASON = LedgerClient.ALREADY_EXECUTED_REASON;

    private static final Logger LOGGER = Logger.getLogger(DeploymentOrchestrator.class.getName());

    private final DeploymentGrouper grouper;
    private final FilenameValidator filenameValidator;
    private final ScriptOrderer orderer;
    private final AgePolicy agePolicy;
    private final LedgerClient ledger;
    private final ScriptExecutor executor;
    private final Notifier notifier;
    private final Clock clock;
    private final boolean notifyAlreadyExecuted;

    public DeploymentOrchestrator(
            final DeploymentGrouper grouper,
            final FilenameValidator filenameValidator,
            final ScriptOrderer orderer,
            final AgePolicy agePolicy,
            final LedgerClient ledger,
            final ScriptExecutor executor,
            final Notifier notifier,
            final Clock clock,
            final boolean notifyAlreadyExecuted) {
        this.grouper = grouper;
        this.filenameValidator = filenameValidator;
        this.orderer = orderer;
        this.agePolicy = agePolicy;
        this.ledger = ledger;
        this.executor = executor;
        this.notifier = new SafeNotifier(notifier);
        this.clock = clock;
        this.notifyAlreadyExecuted = notifyAlreadyExecuted;
    }

    public static DeploymentOrchestrator create(
            final DeployConfig config,
            final ExecutionLedger ledger,
            final ScriptExecutor executor,
            final Notifier notifier,
            final Clock clock) {
        final var filenameValidator = new FilenameValidator();
        return new DeploymentOrchestrator(
                new DeploymentGrouper(config.deploymentRoot(), config.deploymentIdPrefix()),
                filenameValidator,
                new ScriptOrderer(filenameValidator),
                new AgePolicy(config.maxSqlAgeMonths(), clock),
                new LedgerClient(ledger, config.ledgerFailOpen()),
                executor,
                notifier,
                clock,
                config.notifyAlreadyExecuted());
    }

    public DeploymentReport deploy(final DeploymentRequest request) {
        final List<DeploymentGroup> groups = grouper.group(request.files());
        if (groups.isEmpty()) {
            LOGGER.log(Level.INFO, "No deployment scripts in request of {0} files", request.files().size());
            return DeploymentReport.noFiles();
        }

        final List<ScriptResult> results = new ArrayList<>();
        final List<String> halted = new ArrayList<>();
        final List<ScriptFile> pending = new ArrayList<>();
        for (final DeploymentGroup group : groups) {
            final String deploymentId = group.deploymentId();
            final List<ScriptFile> scripts = orderer.order(group.scripts());
            LOGGER.log(Level.INFO, "Deploying {0} ({1} scripts)", new Object[] {deploymentId, scripts.size()});
            for (int i = 0; i < scripts.size(); i++) {
                final ScriptFile script = scripts.get(i);
                final Outcome outcome = processScript(deploymentId, script);
                results.add(new ScriptResult(deploymentId, script, outcome));
                if (outcome.isFailure()) {
                    final List<ScriptFile> remaining = scripts.subList(i + 1, scripts.size());
                    LOGGER.log(
                            Level.WARNING,
                            "Halting {0} after {1} failed; {2} scripts not attempted",
                            new Object[] {deploymentId, script.scriptName(), remaining.size()});
                    halted.add(deploymentId);
                    pending.addAll(remaining);
                    break;
                }
            }
        }
        final var report = new DeploymentReport(DeploymentStatus.COMPLETED, results, halted, pending);
        LOGGER.log(Level.INFO, report.summary());
        return report;
    }

    Outcome processScript(final String deploymentId, final ScriptFile script) {
        final String scriptName = script.scriptName();
        final FilenameCheck check = filenameValidator.check(scriptName);
        if (check instanceof FilenameCheck.Rejected rejected) {
            return recordAndNotify(deploymentId, script, Outcome.ignored(rejected.reason()));
        }
        final var accepted = (FilenameCheck.Accepted) check;
        if (AgePolicy.Verdict.TOO_OLD == agePolicy.check(accepted.date())) {
            return recordAndNotify(deploymentId, script, Outcome.ignored(AgePolicy.TOO_OLD_REASON));
        }

        final boolean alreadyExecuted;
        try {
            alreadyExecuted = ledger.lookup(deploymentId, scriptName);
        } catch (final LedgerException le) {
            return recordAndNotify(deploymentId, script, Outcome.failed(le.getMessage()));
        }
        if (alreadyExecuted) {
            final var outcome = Outcome.ignored(ALREADY_EXECUTED_REASON);
            return notifyAlreadyExecuted
                    ? recordAndNotify(deploymentId, script, outcome)
                    : record(deploymentId, script, outcome);
        }

        try {
            executor.execute(script);
        } catch (final RuntimeException re) {
            LOGGER.log(Level.FINE, "Script " + script.path() + " failed", re);
            return recordAndNotify(deploymentId, script, Outcome.failed(failureReason(re)));
        }
        return record(deploymentId, script, Outcome.success());
    }

    private Outcome recordAndNotify(final String deploymentId, final ScriptFile script, final Outcome outcome) {
        record(deploymentId, script, outcome);
        notifier.notify(new Notification(
                deploymentId, script.scriptName(), script.path(), outcome.status(), outcome.reason()));
        return outcome;
    }

    private Outcome record(final String deploymentId, final ScriptFile script, final Outcome outcome) {
        LOGGER.log(
                Level.FINE,
                "{0}/{1}: {2} {3}",
                new Object[] {deploymentId, script.scriptName(), outcome.status(), reasonText(outcome.reason())});
        ledger.put(new ExecutionRecord(
                deploymentId,
                script.scriptName(),
                script.path(),
                clock.instant(),
                outcome.status(),
                ExecutionStatus.SUCCESS == outcome.status() ? null : outcome.reason()));
        return outcome;
    }

    private static String failureReason(final RuntimeException exception) {
        final String message = exception.getMessage();
        return null == message || message.isBlank() ? exception.getClass().getName() : message;
    }

    private static String reasonText(final @Nullable String reason) {
        return null == reason ? "" : reason;
    }
}
