package org.realityforge.sqldeploy.script;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

final class FilenameValidatorTest {
    private final FilenameValidator validator = new FilenameValidator();

    @Test
    void acceptsWellFormedName() {
        assertThat(validator.check("add_column_2024_01_15_v3.sql"))
                .isEqualTo(new FilenameCheck.Accepted(LocalDate.of(2024, 1, 15), 3L));
    }

    @Test
    void firstDateTokenWins() {
        assertThat(validator.check("a_2024_02_01_b_2023_01_01_v12.sql"))
                .isEqualTo(new FilenameCheck.Accepted(LocalDate.of(2024, 2, 1), 12L));
    }

    @Test
    void rejectsNameWithoutDate() {
        assertThat(validator.check("add_column_v1.sql"))
                .isEqualTo(new FilenameCheck.Rejected(FilenameValidator.NO_DATE_REASON));
    }

    @Test
    void dateIsCheckedBeforeVersion() {
        assertThat(validator.check("notes.txt")).isEqualTo(new FilenameCheck.Rejected(FilenameValidator.NO_DATE_REASON));
    }

    @Test
    void rejectsNameWithoutVersion() {
        assertThat(validator.check("a_2024_01_01.sql"))
                .isEqualTo(new FilenameCheck.Rejected(FilenameValidator.NO_VERSION_REASON));
        assertThat(validator.check("a_2024_01_01_v1.sql.bak"))
                .isEqualTo(new FilenameCheck.Rejected(FilenameValidator.NO_VERSION_REASON));
        assertThat(validator.check("a_2024_01_01_v.sql"))
                .isEqualTo(new FilenameCheck.Rejected(FilenameValidator.NO_VERSION_REASON));
    }

    @Test
    void rejectsVersionTooLargeToRepresent() {
        assertThat(validator.check("a_2024_01_01_v99999999999999999999.sql"))
                .isEqualTo(new FilenameCheck.Rejected(FilenameValidator.NO_VERSION_REASON));
    }

    @Test
    void rejectsDateThatIsNotOnTheCalendar() {
        assertThat(validator.check("a_9999_99_99_v1.sql"))
                .isEqualTo(new FilenameCheck.Rejected(FilenameValidator.INVALID_DATE_REASON));
        assertThat(validator.check("a_2023_02_29_v1.sql"))
                .isEqualTo(new FilenameCheck.Rejected(FilenameValidator.INVALID_DATE_REASON));
    }

    @Test
    void acceptsLeapDay() {
        assertThat(validator.check("a_2024_02_29_v1.sql"))
                .isEqualTo(new FilenameCheck.Accepted(LocalDate.of(2024, 2, 29), 1L));
    }

    @Test
    void versionExtractionIgnoresDate() {
        assertThat(validator.version("x_v7.sql")).hasValue(7L);
        assertThat(validator.version("x_2024_01_01.sql")).isEmpty();
    }
}
