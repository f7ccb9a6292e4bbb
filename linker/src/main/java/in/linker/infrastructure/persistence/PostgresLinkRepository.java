package in.linker.infrastructure.persistence;

import in.linker.domain.link.LinkRecord;
import in.linker.domain.link.LinkStatus;
import in.linker.domain.repository.InsertResult;
import in.linker.domain.repository.LinkRepository;
import in.linker.domain.repository.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * PostgreSQL implementation of LinkRepository.
 *
 * Every statement carries the configured store timeout as its JDBC query
 * timeout. Unique violations are detected by SQLSTATE 23505.
 */
public final class PostgresLinkRepository implements LinkRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresLinkRepository.class);

    static final String UNIQUE_VIOLATION = "23505";

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;
    private final Clock clock;

    public PostgresLinkRepository(DataSource dataSource, Duration storeTimeout) {
        this(dataSource, storeTimeout, Clock.systemUTC());
    }

    public PostgresLinkRepository(DataSource dataSource, Duration storeTimeout, Clock clock) {
        this.dataSource = dataSource;
        // JDBC timeouts are whole seconds; round up so short timeouts still apply
        this.queryTimeoutSeconds = (int) Math.max(1, (storeTimeout.toMillis() + 999) / 1000);
        this.clock = clock;
    }

    @Override
    public InsertResult insert(String code, String destination, boolean hidden) throws StoreException {
        String sql = """
            INSERT INTO links (code, destination, hidden, status, created_at, updated_at)
            VALUES (?, ?, ?, 'ACTIVE', ?, ?)
            """;

        Instant now = clock.instant();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setString(1, code);
            ps.setString(2, destination);
            ps.setBoolean(3, hidden);
            ps.setTimestamp(4, Timestamp.from(now));
            ps.setTimestamp(5, Timestamp.from(now));
            ps.executeUpdate();

            log.debug("Link inserted: code={}", code);
            return InsertResult.inserted(LinkRecord.newActive(code, destination, hidden, now));

        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                log.debug("Code collision on insert: code={}", code);
                return InsertResult.duplicate();
            }
            log.error("Failed to insert link {}: {}", code, e.getMessage());
            throw new StoreException("insert", "Failed to insert link", e);
        }
    }

    @Override
    public Optional<LinkRecord> fetchActive(String code) throws StoreException {
        String sql = """
            SELECT code, destination, hidden, status, created_at, updated_at
            FROM links
            WHERE code = ? AND status = 'ACTIVE'
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to fetch link {}: {}", code, e.getMessage());
            throw new StoreException("fetch_active", "Failed to fetch link", e);
        }
        return Optional.empty();
    }

    @Override
    public Optional<LinkStatus> fetchStatus(String code) throws StoreException {
        String sql = "SELECT status FROM links WHERE code = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(LinkStatus.fromDb(rs.getString("status")));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to fetch status of {}: {}", code, e.getMessage());
            throw new StoreException("fetch_status", "Failed to fetch link status", e);
        }
        return Optional.empty();
    }

    @Override
    public boolean markDeleted(String code) throws StoreException {
        String sql = """
            UPDATE links
            SET status = 'DELETED', updated_at = ?
            WHERE code = ? AND status = 'ACTIVE'
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setString(2, code);
            int rows = ps.executeUpdate();

            if (rows > 0) {
                log.debug("Link marked deleted: code={}", code);
            }
            return rows > 0;

        } catch (SQLException e) {
            log.error("Failed to delete link {}: {}", code, e.getMessage());
            throw new StoreException("mark_deleted", "Failed to delete link", e);
        }
    }

    @Override
    public Optional<String> findActiveCodeByDestination(String destination) throws StoreException {
        String sql = """
            SELECT code FROM links
            WHERE destination = ? AND status = 'ACTIVE'
            ORDER BY created_at DESC
            LIMIT 1
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setString(1, destination);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString("code"));
                }
            }
        } catch (SQLException e) {
            log.error("Failed reverse lookup: {}", e.getMessage());
            throw new StoreException("reverse", "Failed reverse lookup", e);
        }
        return Optional.empty();
    }

    @Override
    public long forEach(Consumer<LinkRecord> sink) throws StoreException {
        String sql = """
            SELECT code, destination, hidden, status, created_at, updated_at
            FROM links
            ORDER BY created_at, code
            """;

        long count = 0;
        try (Connection conn = dataSource.getConnection()) {
            // The driver only honours the fetch size inside a transaction
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setFetchSize(500);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        sink.accept(mapRow(rs));
                        count++;
                    }
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            log.error("Failed to list links: {}", e.getMessage());
            throw new StoreException("list", "Failed to list links", e);
        }
        return count;
    }

    private LinkRecord mapRow(ResultSet rs) throws SQLException {
        Timestamp createdAt = rs.getTimestamp("created_at");
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new LinkRecord(
            rs.getString("code"),
            rs.getString("destination"),
            rs.getBoolean("hidden"),
            LinkStatus.fromDb(rs.getString("status")),
            createdAt != null ? createdAt.toInstant() : null,
            updatedAt != null ? updatedAt.toInstant() : null
        );
    }
}
