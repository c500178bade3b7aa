package org.realityforge.sqldeploy.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.realityforge.sqldeploy.config.ConfigException;

final class PasswordResolverTest {
    @Test
    void resolvesDirectAndEnvironmentValues() {
        final PasswordResolver resolver =
                new PasswordResolver(Map.of("SQL_PASS", "from-env"), new ByteArrayInputStream(new byte[0]));

        assertThat(resolver.fromDirectValue("secret")).isEqualTo("secret");
        assertThat(resolver.fromEnvironment("SQL_PASS")).isEqualTo("from-env");
    }

    @Test
    void environmentValueMustExist() {
        final PasswordResolver resolver = new PasswordResolver(Map.of(), new ByteArrayInputStream(new byte[0]));

        assertThatThrownBy(() -> resolver.fromEnvironment("SQL_PASS"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("SQL_PASS");
    }

    @Test
    void readsStdinOneLineAtATime() {
        final PasswordResolver resolver = new PasswordResolver(
                Map.of(), new ByteArrayInputStream("first\nsecond\n".getBytes(StandardCharsets.UTF_8)));

        assertThat(resolver.fromStdin()).isEqualTo("first");
        assertThat(resolver.fromStdin()).isEqualTo("second");
        assertThatThrownBy(resolver::fromStdin)
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("stdin");
    }

    @Test
    void leavesInputAfterPasswordLineUnread() throws Exception {
        final var stdin = new ByteArrayInputStream("s3cret\r\n{\"files\": []}".getBytes(StandardCharsets.UTF_8));
        final PasswordResolver resolver = new PasswordResolver(Map.of(), stdin);

        assertThat(resolver.fromStdin()).isEqualTo("s3cret");
        assertThat(new String(stdin.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("{\"files\": []}");
    }

    @Test
    void lastLineWithoutNewlineIsPassword() {
        final PasswordResolver resolver =
                new PasswordResolver(Map.of(), new ByteArrayInputStream("pässword".getBytes(StandardCharsets.UTF_8)));

        assertThat(resolver.fromStdin()).isEqualTo("pässword");
    }
}
