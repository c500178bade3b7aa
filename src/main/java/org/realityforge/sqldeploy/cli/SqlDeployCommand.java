package org.realityforge.sqldeploy.cli;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.jspecify.annotations.Nullable;
import org.realityforge.sqldeploy.db.DatabaseConnection;
import picocli.CommandLine;

@CommandLine.Command(
        name = "sqldeploy",
        mixinStandardHelpOptions = true,
        description = "Idempotent, ordered deployment of SQL scripts",
        subcommands = {SqlDeployCommand.RunCommand.class, SqlDeployCommand.ValidateCommand.class})
public final class SqlDeployCommand implements Callable<Integer> {
    static final int USAGE_EXIT_CODE = 2;
    private final CommandRunner runner;
    private final PasswordResolver passwordResolver;

    private SqlDeployCommand(final CommandRunner runner, final PasswordResolver passwordResolver) {
        this.runner = runner;
        this.passwordResolver = passwordResolver;
    }

    public static int execute(final String[] args) {
        return execute(
                args,
                new DefaultCommandRunner(System.getenv(), System.in),
                new PasswordResolver(System.getenv(), System.in));
    }

    static int execute(final String[] args, final CommandRunner runner, final PasswordResolver passwordResolver) {
        final var effectiveArgs = 0 == args.length ? new String[] {"--help"} : args;
        return new CommandLine(new SqlDeployCommand(runner, passwordResolver))
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(effectiveArgs);
    }

    @Override
    public Integer call() {
        return USAGE_EXIT_CODE;
    }

    private abstract static class BaseCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        private @Nullable SqlDeployCommand parent;

        @CommandLine.Spec
        private CommandLine.Model.@Nullable CommandSpec spec;

        @CommandLine.Option(
                names = "--request",
                defaultValue = DefaultCommandRunner.STDIN_REQUEST,
                description = "JSON request file listing the changed files, or '-' for stdin")
        private String request = DefaultCommandRunner.STDIN_REQUEST;

        @CommandLine.Option(names = "--config", description = "Optional YAML configuration file")
        private @Nullable Path configFile;

        protected final CommandRunner runner() {
            return Objects.requireNonNull(parent).runner;
        }

        protected final PasswordResolver passwordResolver() {
            return Objects.requireNonNull(parent).passwordResolver;
        }

        protected final String request() {
            return request;
        }

        protected final @Nullable Path configFile() {
            return configFile;
        }

        protected final void println(final String line) {
            Objects.requireNonNull(spec).commandLine().getOut().println(line);
        }
    }

    @SuppressWarnings("FieldCanBeFinal")
    static final class TargetConnectionOptions {
        @CommandLine.Option(names = "--target-host", required = true, description = "Target database host")
        private String host = "";

        @CommandLine.Option(names = "--target-port", defaultValue = "1433", description = "Target database port")
        private int port = 1433;

        @CommandLine.Option(names = "--target-database", required = true, description = "Target database name")
        private String database = "";

        @CommandLine.Option(names = "--target-username", required = true, description = "Target database username")
        private String username = "";

        @CommandLine.ArgGroup(exclusive = true, multiplicity = "1")
        private TargetPasswordOptions password = new TargetPasswordOptions();

        private DatabaseConnection toConnection(final PasswordResolver passwordResolver) {
            return new DatabaseConnection(host, port, database, username, password.resolve(passwordResolver));
        }
    }

    static final class TargetPasswordOptions {
        @CommandLine.Option(names = "--password", description = "Target password")
        private @Nullable String password;

        @CommandLine.Option(names = "--password-env", description = "Environment variable containing target password")
        private @Nullable String passwordEnv;

        @CommandLine.Option(names = "--password-stdin", description = "Read target password from stdin")
        private boolean passwordStdin;

        private String resolve(final PasswordResolver passwordResolver) {
            if (null != password) {
                return passwordResolver.fromDirectValue(password);
            }
            if (null != passwordEnv) {
                return passwordResolver.fromEnvironment(passwordEnv);
            }
            if (passwordStdin) {
                return passwordResolver.fromStdin();
            }
            throw new IllegalStateException("No target password source selected");
        }
    }

    @CommandLine.Command(name = "run", description = "Execute the deployment scripts listed in a request")
    static final class RunCommand extends BaseCommand {
        @CommandLine.Option(
                names = "--driver",
                defaultValue = "sqlserver",
                description = "Database driver. Supported values: sqlserver, postgres, noop")
        private String driver = "sqlserver";

        @CommandLine.Option(
                names = "--ledger",
                defaultValue = "JDBC",
                description = "Execution ledger. Supported values: ${COMPLETION-CANDIDATES}")
        private CommandRunner.LedgerType ledger = CommandRunner.LedgerType.JDBC;

        @CommandLine.ArgGroup(exclusive = false, multiplicity = "0..1")
        private @Nullable TargetConnectionOptions target;

        @Override
        public Integer call() {
            final @Nullable DatabaseConnection connection = null == target ? null : target.toConnection(passwordResolver());
            final var report = runner().run(request(), configFile(), driver, ledger, connection);
            println(report.status().toJson());
            return 0;
        }
    }

    @CommandLine.Command(name = "validate", description = "Group, order and validate scripts without executing them")
    static final class ValidateCommand extends BaseCommand {
        @Override
        public Integer call() {
            for (final String line : runner().validate(request(), configFile())) {
                println(line);
            }
            return 0;
        }
    }
}
