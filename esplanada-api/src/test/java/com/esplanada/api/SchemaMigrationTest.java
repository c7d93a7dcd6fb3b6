package com.esplanada.api;

import com.esplanada.api.config.TestClockConfiguration;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * The schema used by every integration test comes from the Flyway migrations, not from Hibernate.
 */
@SpringBootTest(classes = EsplanadaApiApplication.class)
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
class SchemaMigrationTest {

    @Autowired
    private Flyway flyway;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private List<String> columnsOf(String table) {
        return jdbcTemplate.queryForList(
                "SELECT column_name FROM information_schema.columns WHERE table_name = ?", String.class, table);
    }

    @Test
    void allMigrationsAreApplied() {
        assertThat(flyway.info().pending()).isEmpty();
        assertThat(flyway.info().current().getVersion().getVersion()).isEqualTo("2");
    }

    @Test
    void migratedTablesCarryMappedColumns() {
        assertThat(columnsOf("subject_statistics"))
                .contains("rating_count", "mean", "weighted_average", "mode_score", "trend", "last_updated");
        assertThat(columnsOf("rating_records"))
                .contains("identity_digest", "active_key", "accepted_at", "revision", "version");
        assertThat(columnsOf("rating_photo_refs")).contains("rating_id", "photo_position", "photo_ref");
        assertThat(columnsOf("security_events")).contains("sequence_number", "previous_event_hash", "event_hash");
    }

    @Test
    void onlyOneActiveRatingPerKey() {
        String subject = "schema-" + UUID.randomUUID();
        String insert = "INSERT INTO rating_records (id, subject_id, identity_digest, score, submitted_at, "
                + "accepted_at, revision, active, active_key) "
                + "VALUES (RANDOM_UUID(), ?, 'identity-abc', 4, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP, 1, TRUE, ?)";
        jdbcTemplate.update(insert, subject, "identity-abc|" + subject);

        assertThatThrownBy(() -> jdbcTemplate.update(insert, subject, "identity-abc|" + subject))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void scoreOutsideRangeIsRefusedByStorage() {
        assertThatThrownBy(() -> jdbcTemplate.update(
                "INSERT INTO rating_records (id, subject_id, identity_digest, score, submitted_at, accepted_at, "
                        + "revision, active) VALUES (RANDOM_UUID(), ?, 'identity-abc', 6, CURRENT_TIMESTAMP, "
                        + "CURRENT_TIMESTAMP, 1, FALSE)", "schema-" + UUID.randomUUID()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }
}
