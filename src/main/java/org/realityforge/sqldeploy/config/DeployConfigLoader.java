package org.realityforge.sqldeploy.config;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

public final class DeployConfigLoader {
    static final String MAX_SQL_AGE_MONTHS_ENV = "MAX_SQL_AGE_MONTHS";
    static final String LEDGER_FAIL_OPEN_ENV = "SQLDEPLOY_LEDGER_FAIL_OPEN";
    static final String NOTIFY_ALREADY_EXECUTED_ENV = "SQLDEPLOY_NOTIFY_ALREADY_EXECUTED";
    static final String DEPLOYMENT_ROOT_ENV = "SQLDEPLOY_DEPLOYMENT_ROOT";
    static final String DEPLOYMENT_ID_PREFIX_ENV = "SQLDEPLOY_DEPLOYMENT_ID_PREFIX";
    static final String LEDGER_TABLE_ENV = "SQLDEPLOY_LEDGER_TABLE";
    static final String NOTIFY_URL_ENV = "SQLDEPLOY_NOTIFY_URL";
    static final String NOTIFY_RECIPIENT_ENV = "SQLDEPLOY_NOTIFY_RECIPIENT";
    static final String SCRIPT_TIMEOUT_SECONDS_ENV = "SQLDEPLOY_SCRIPT_TIMEOUT_SECONDS";

    private static final Set<String> FILE_KEYS = Set.of(
            "maxSqlAgeMonths",
            "ledgerFailOpen",
            "notifyAlreadyExecuted",
            "deploymentRoot",
            "deploymentIdPrefix",
            "ledgerTable",
            "notifyUrl",
            "notifyRecipient",
            "scriptTimeoutSeconds");

    private final Map<String, String> environment;

    public DeployConfigLoader(final Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    public DeployConfig load(final @Nullable Path configFile) {
        if (null == configFile) {
            return load(null, "environment");
        }
        try {
            return load(Files.readString(configFile), configFile.toString());
        } catch (final IOException ioe) {
            throw new ConfigException("Failed to read configuration file " + configFile, ioe);
        }
    }

    public DeployConfig load(final @Nullable String yaml, final String sourceName) {
        final var defaults = DeployConfig.defaults();
        final Map<String, Object> file =
                null == yaml ? Map.of() : YamlMapSupport.parseRoot(yaml, sourceName);
        YamlMapSupport.assertKeys(file, FILE_KEYS, sourceName);

        final int maxSqlAgeMonths = integerSetting(
                MAX_SQL_AGE_MONTHS_ENV,
                YamlMapSupport.optionalInteger(file, "maxSqlAgeMonths", sourceName),
                defaults.maxSqlAgeMonths());
        final boolean ledgerFailOpen = booleanSetting(
                LEDGER_FAIL_OPEN_ENV,
                YamlMapSupport.optionalBoolean(file, "ledgerFailOpen", sourceName),
                defaults.ledgerFailOpen());
        final boolean notifyAlreadyExecuted = booleanSetting(
                NOTIFY_ALREADY_EXECUTED_ENV,
                YamlMapSupport.optionalBoolean(file, "notifyAlreadyExecuted", sourceName),
                defaults.notifyAlreadyExecuted());
        final String deploymentRoot = stringSetting(
                DEPLOYMENT_ROOT_ENV,
                YamlMapSupport.optionalString(file, "deploymentRoot", sourceName),
                defaults.deploymentRoot());
        final String deploymentIdPrefix = stringSetting(
                DEPLOYMENT_ID_PREFIX_ENV,
                YamlMapSupport.optionalString(file, "deploymentIdPrefix", sourceName),
                defaults.deploymentIdPrefix());
        final String ledgerTable = stringSetting(
                LEDGER_TABLE_ENV,
                YamlMapSupport.optionalString(file, "ledgerTable", sourceName),
                defaults.ledgerTable());
        final String notifyUrl = stringSetting(
                NOTIFY_URL_ENV, YamlMapSupport.optionalString(file, "notifyUrl", sourceName), null);
        final String notifyRecipient = stringSetting(
                NOTIFY_RECIPIENT_ENV,
                YamlMapSupport.optionalString(file, "notifyRecipient", sourceName),
                defaults.notifyRecipient());
        final int scriptTimeoutSeconds = integerSetting(
                SCRIPT_TIMEOUT_SECONDS_ENV,
                YamlMapSupport.optionalInteger(file, "scriptTimeoutSeconds", sourceName),
                defaults.scriptTimeoutSeconds());

        return new DeployConfig(
                maxSqlAgeMonths,
                ledgerFailOpen,
                notifyAlreadyExecuted,
                deploymentRoot,
                deploymentIdPrefix,
                ledgerTable,
                null == notifyUrl || notifyUrl.isBlank() ? null : parseUri(notifyUrl),
                notifyRecipient,
                scriptTimeoutSeconds);
    }

    private int integerSetting(final String variable, final @Nullable Integer fileValue, final int defaultValue) {
        final var value = environment.get(variable);
        if (null == value || value.isBlank()) {
            return null == fileValue ? defaultValue : fileValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException nfe) {
            throw new ConfigException(
                    "Expected integer in environment variable '" + variable + "' but got '" + value + "'.", nfe);
        }
    }

    private boolean booleanSetting(final String variable, final @Nullable Boolean fileValue, final boolean defaultValue) {
        final var value = environment.get(variable);
        if (null == value || value.isBlank()) {
            return null == fileValue ? defaultValue : fileValue;
        }
        final var normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new ConfigException(
                "Expected true or false in environment variable '" + variable + "' but got '" + value + "'.");
    }

    private @Nullable String stringSetting(
            final String variable, final @Nullable String fileValue, final @Nullable String defaultValue) {
        final var value = environment.get(variable);
        if (null != value && !value.isBlank()) {
            return value.trim();
        }
        return null == fileValue ? defaultValue : fileValue;
    }

    private static URI parseUri(final String value) {
        try {
            final var uri = new URI(value);
            if (null == uri.getScheme() || null == uri.getHost()) {
                throw new ConfigException("Notification URL must be absolute: '" + value + "'");
            }
            return uri;
        } catch (final URISyntaxException use) {
            throw new ConfigException("Invalid notification URL '" + value + "'", use);
        }
    }
}
