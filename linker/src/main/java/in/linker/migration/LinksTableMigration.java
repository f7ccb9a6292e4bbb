package in.linker.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Links table migration - creates the links table and its indexes on startup.
 *
 * Idempotent: every statement uses IF NOT EXISTS, so it is safe to run on
 * each boot and from several instances at once.
 */
public final class LinksTableMigration {
    private static final Logger log = LoggerFactory.getLogger(LinksTableMigration.class);

    private final DataSource dataSource;

    public LinksTableMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Run migration - creates the table and indexes if they don't exist.
     */
    public void migrate() {
        log.info("[LINKS MIGRATION] Starting links table migration");

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS links (
                    code        VARCHAR(64)   NOT NULL,
                    destination VARCHAR(2048) NOT NULL,
                    hidden      BOOLEAN       NOT NULL DEFAULT FALSE,
                    status      VARCHAR(16)   NOT NULL DEFAULT 'ACTIVE',
                    created_at  TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    updated_at  TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    CONSTRAINT links_pkey PRIMARY KEY (code),
                    CONSTRAINT links_status_check CHECK (status IN ('ACTIVE', 'DELETED'))
                )
                """);

            // Reverse lookups filter on destination
            stmt.execute("CREATE INDEX IF NOT EXISTS links_destination_idx ON links (destination)");

            log.info("[LINKS MIGRATION] Migration completed successfully");

        } catch (SQLException e) {
            log.error("[LINKS MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Links migration failed", e);
        }
    }
}
