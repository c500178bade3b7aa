package org.realityforge.sqldeploy;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

final class MainTest {
    @Test
    void runReturnsSuccessForHelp() {
        assertThat(Main.run(new String[] {"--help"})).isZero();
    }

    @Test
    void runShowsHelpWhenCommandMissing() {
        assertThat(Main.run(new String[0])).isZero();
    }

    @Test
    void runReturnsUsageCodeForUnknownCommand() {
        assertThat(Main.run(new String[] {"deploy-everything"})).isEqualTo(2);
    }
}
