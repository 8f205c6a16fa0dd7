package com.cabinet.api;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

public class ConfigFilesGuardTest {

    @Test
    void jsonIsSnakeCaseAndSecretsComeFromEnvironment() throws Exception {
        var path = "src/main/resources/application.yml";
        var content = java.nio.file.Files.readString(java.nio.file.Path.of(path), StandardCharsets.UTF_8);

        // Request and response field names (tg_username, family_group_id, ...) depend on this.
        assertThat(content).contains("property-naming-strategy: SNAKE_CASE");
        assertThat(content)
                .contains("jwt-secret: ${CABINET_JWT_SECRET:}")
                .contains("token: ${CABINET_TELEGRAM_BOT_TOKEN:}");
    }

    @Test
    void pendingInviteUniquenessIsEnforcedBySchema() throws Exception {
        var path = "src/main/resources/db/migration/V1__init.sql";
        var content = java.nio.file.Files.readString(java.nio.file.Path.of(path), StandardCharsets.UTF_8);

        assertThat(content).contains("uq_family_invites_pending_tuple");
        assertThat(content).contains("WHERE status = 'pending'");
    }
}
