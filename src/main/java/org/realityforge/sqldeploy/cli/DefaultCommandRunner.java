package org.realityforge.sqldeploy.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.realityforge.sqldeploy.config.ConfigException;
import org.realityforge.sqldeploy.config.DeployConfig;
import org.realityforge.sqldeploy.config.DeployConfigLoader;
import org.realityforge.sqldeploy.db.ConnectionFactory;
import org.realityforge.sqldeploy.db.DatabaseConnection;
import org.realityforge.sqldeploy.db.ScriptExecutorFactory;
import org.realityforge.sqldeploy.db.SqlDialect;
import org.realityforge.sqldeploy.ledger.ExecutionLedger;
import org.realityforge.sqldeploy.ledger.InMemoryExecutionLedger;
import org.realityforge.sqldeploy.ledger.JdbcExecutionLedger;
import org.realityforge.sqldeploy.notify.LoggingNotifier;
import org.realityforge.sqldeploy.notify.Notifier;
import org.realityforge.sqldeploy.notify.WebhookNotifier;
import org.realityforge.sqldeploy.request.DeploymentRequest;
import org.realityforge.sqldeploy.request.DeploymentRequestParser;
import org.realityforge.sqldeploy.request.RequestFormatException;
import org.realityforge.sqldeploy.request.ScriptFile;
import org.realityforge.sqldeploy.runtime.DeploymentOrchestrator;
import org.realityforge.sqldeploy.runtime.DeploymentReport;
import org.realityforge.sqldeploy.script.AgePolicy;
import org.realityforge.sqldeploy.script.DeploymentGroup;
import org.realityforge.sqldeploy.script.DeploymentGrouper;
import org.realityforge.sqldeploy.script.FilenameCheck;
import org.realityforge.sqldeploy.script.FilenameValidator;
import org.realityforge.sqldeploy.script.ScriptOrderer;

public final class DefaultCommandRunner implements CommandRunner {
    static final String STDIN_REQUEST = "-";

    private final DeployConfigLoader configLoader;
    private final InputStream stdin;
    private final Clock clock;
    private final ScriptExecutorFactory scriptExecutorFactory;
    private final DeploymentRequestParser requestParser = new DeploymentRequestParser();

    public DefaultCommandRunner(final Map<String, String> environment, final InputStream stdin) {
        this(new DeployConfigLoader(environment), stdin, Clock.systemUTC(), new ScriptExecutorFactory());
    }

    DefaultCommandRunner(
            final DeployConfigLoader configLoader,
            final InputStream stdin,
            final Clock clock,
            final ScriptExecutorFactory scriptExecutorFactory) {
        this.configLoader = configLoader;
        this.stdin = stdin;
        this.clock = clock;
        this.scriptExecutorFactory = scriptExecutorFactory;
    }

    @Override
    public DeploymentReport run(
            final String request,
            final @Nullable Path configFile,
            final String driver,
            final LedgerType ledger,
            final @Nullable DatabaseConnection target) {
        final DeployConfig config = configLoader.load(configFile);
        final DeploymentRequest deploymentRequest = readRequest(request);
        final var executor = scriptExecutorFactory.create(driver, target, config.scriptTimeoutSeconds());
        final var orchestrator = DeploymentOrchestrator.create(
                config, ledger(ledger, driver, target, config), executor, notifier(config), clock);
        return orchestrator.deploy(deploymentRequest);
    }

    @Override
    public List<String> validate(final String request, final @Nullable Path configFile) {
        final DeployConfig config = configLoader.load(configFile);
        final DeploymentRequest deploymentRequest = readRequest(request);
        final var grouper = new DeploymentGrouper(config.deploymentRoot(), config.deploymentIdPrefix());
        final var filenameValidator = new FilenameValidator();
        final var orderer = new ScriptOrderer(filenameValidator);
        final var agePolicy = new AgePolicy(config.maxSqlAgeMonths(), clock);

        final List<String> lines = new ArrayList<>();
        for (final DeploymentGroup group : grouper.group(deploymentRequest.files())) {
            for (final ScriptFile script : orderer.order(group.scripts())) {
                final FilenameCheck check = filenameValidator.check(script.scriptName());
                final String verdict;
                if (check instanceof FilenameCheck.Rejected rejected) {
                    verdict = rejected.reason();
                } else if (AgePolicy.Verdict.TOO_OLD
                        == agePolicy.check(((FilenameCheck.Accepted) check).date())) {
                    verdict = AgePolicy.TOO_OLD_REASON;
                } else {
                    verdict = "OK";
                }
                lines.add(group.deploymentId() + ' ' + script.scriptName() + ' ' + verdict);
            }
        }
        return List.copyOf(lines);
    }

    private DeploymentRequest readRequest(final String request) {
        if (STDIN_REQUEST.equals(request)) {
            return requestParser.parse(stdin, "stdin");
        }
        final Path path = Path.of(request);
        try {
            return requestParser.parse(Files.readString(path), path.toString());
        } catch (final IOException ioe) {
            throw new RequestFormatException("Failed to read request file " + path, ioe);
        }
    }

    private static ExecutionLedger ledger(
            final LedgerType ledger,
            final String driver,
            final @Nullable DatabaseConnection target,
            final DeployConfig config) {
        if (LedgerType.MEMORY == ledger) {
            return new InMemoryExecutionLedger();
        }
        if (null == target || "noop".equalsIgnoreCase(driver)) {
            throw new ConfigException("The jdbc ledger requires a database driver and target connection options");
        }
        final var dialect = SqlDialect.fromDriver(driver);
        return new JdbcExecutionLedger(ConnectionFactory.driverManager(dialect, target), dialect, config.ledgerTable());
    }

    private static Notifier notifier(final DeployConfig config) {
        final var notifyUrl = config.notifyUrl();
        return null == notifyUrl ? new LoggingNotifier() : new WebhookNotifier(notifyUrl, config.notifyRecipient());
    }
}
