package org.realityforge.sqldeploy.script;

import java.time.LocalDate;

public sealed interface FilenameCheck permits FilenameCheck.Accepted, FilenameCheck.Rejected {
    record Accepted(LocalDate date, long version) implements FilenameCheck {}

    record Rejected(String reason) implements FilenameCheck {}
}
