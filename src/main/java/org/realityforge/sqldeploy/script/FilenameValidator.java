package org.realityforge.sqldeploy.script;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class FilenameValidator {
    public static final String NO_DATE_REASON = "No valid date in filename";
    public static final String NO_VERSION_REASON = "No version in filename";
    public static final String INVALID_DATE_REASON = "Invalid date in filename";

    private static final Pattern DATE_PATTERN = Pattern.compile("\\d{4}_\\d{2}_\\d{2}");
    private static final Pattern VERSION_PATTERN = Pattern.compile("_v(\\d+)\\.sql$");
    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("uuuu_MM_dd").withResolverStyle(ResolverStyle.STRICT);

    public FilenameCheck check(final String scriptName) {
        final Matcher dateMatcher = DATE_PATTERN.matcher(scriptName);
        if (!dateMatcher.find()) {
            return new FilenameCheck.Rejected(NO_DATE_REASON);
        }
        final OptionalLong version = version(scriptName);
        if (version.isEmpty()) {
            return new FilenameCheck.Rejected(NO_VERSION_REASON);
        }
        final LocalDate date;
        try {
            date = LocalDate.parse(dateMatcher.group(), DATE_FORMAT);
        } catch (final DateTimeParseException dtpe) {
            return new FilenameCheck.Rejected(INVALID_DATE_REASON);
        }
        return new FilenameCheck.Accepted(date, version.getAsLong());
    }

    public OptionalLong version(final String scriptName) {
        final Matcher matcher = VERSION_PATTERN.matcher(scriptName);
        if (!matcher.find()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(matcher.group(1)));
        } catch (final NumberFormatException nfe) {
            return OptionalLong.empty();
        }
    }
}
