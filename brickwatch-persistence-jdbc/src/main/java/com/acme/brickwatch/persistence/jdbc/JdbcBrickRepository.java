package com.acme.brickwatch.persistence.jdbc;

import com.acme.brickwatch.core.Jsons;
import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.domain.BrickFilter;
import com.acme.brickwatch.domain.HistoryEntry;
import com.acme.brickwatch.domain.HistoryPolicy;
import com.acme.brickwatch.domain.WakeTarget;
import com.acme.brickwatch.repository.BrickRepository;
import com.acme.brickwatch.service.DuplicateSlugException;
import io.micronaut.transaction.annotation.Transactional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Abstract JDBC implementation of BrickRepository using Template Method pattern.
 * Subclasses supply the dialect-specific insert and regular expression search.
 */
public abstract class JdbcBrickRepository implements BrickRepository {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcBrickRepository.class);

    protected static final String BRICK_COLUMNS =
            "pk, brick_id, name, slug, description, periodicity, emails, paused, late, notify_pending, "
                    + "deadline, resume_at, notify_claim_token, notify_claimed_at, notify_claim_late, version, created_at";

    static final String SLUG_CONSTRAINT = "uk_brick_slug";

    /**
     * Rolls a claim back. The notice is owed again only while the brick is still in the claimed
     * state; a pause or trigger in the meantime has already settled what is owed.
     */
    private static final String ROLLBACK_CLAIM = """
            notify_pending = CASE WHEN paused = FALSE AND late = notify_claim_late THEN TRUE
                                  ELSE notify_pending END,
            notify_claim_token = NULL, notify_claimed_at = NULL, notify_claim_late = NULL,
            version = version + 1
            """;

    protected final DataSource dataSource;

    protected JdbcBrickRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    // Dialect hooks

    /**
     * Inserts the brick row and returns its generated store key.
     */
    protected abstract long insertBrickRow(Connection conn, Brick brick) throws SQLException;

    /**
     * Boolean SQL expression matching a regular expression bound to each of its four parameters
     * against name, slug, brick_id and emails.
     */
    protected abstract String getSearchClause();

    // Insert operations

    @Override
    @Transactional
    public void insert(Brick brick) {
        try (Connection conn = dataSource.getConnection()) {
            long pk = insertBrickRow(conn, brick);
            brick.setStoreKey(pk);
            insertHistory(conn, pk, brick.getUnsavedHistory());
            brick.clearUnsavedHistory();
            LOG.debug("Inserted brick id={} pk={}", brick.getId(), pk);
        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e, SLUG_CONSTRAINT)) {
                LOG.info("Slug '{}' taken concurrently while inserting brick id={}", brick.getSlug(), brick.getId());
                throw new DuplicateSlugException(brick.getSlug());
            }
            throw ExceptionTranslator.translateException(e, "insert brick", LOG);
        }
    }

    protected String getInsertBrickSql() {
        return """
                INSERT INTO brick
                (brick_id, name, slug, description, periodicity, emails, paused, late, notify_pending,
                 deadline, resume_at, version, created_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
    }

    protected void bindInsert(PreparedStatement ps, Brick brick) throws SQLException {
        ps.setString(1, brick.getId());
        ps.setString(2, brick.getName());
        ps.setString(3, brick.getSlug());
        ps.setString(4, nullToEmpty(brick.getDescription()));
        ps.setString(5, brick.getPeriodicity());
        ps.setString(6, Jsons.toJson(brick.getEmails()));
        ps.setBoolean(7, brick.isPaused());
        ps.setBoolean(8, brick.isLate());
        ps.setBoolean(9, brick.isNotifyPending());
        setInstant(ps, 10, brick.getDeadline());
        setInstant(ps, 11, brick.getResumeAt());
        ps.setLong(12, brick.getVersion());
        setInstant(ps, 13, brick.getCreatedAt());
    }

    // Query operations

    @Override
    @Transactional(readOnly = true)
    public Optional<Brick> findById(String id) {
        String sql = "SELECT " + BRICK_COLUMNS + " FROM brick WHERE brick_id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);

            Brick brick = null;
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    brick = mapResultSetToBrick(rs);
                }
            }
            if (brick == null) {
                return Optional.empty();
            }
            brick.setHistory(loadHistory(conn, brick.getStoreKey()));
            return Optional.of(brick);

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find brick by id", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findIdBySlug(String slug) {
        String sql = "SELECT brick_id FROM brick WHERE slug = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, slug);

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString("brick_id"));
                }
            }
            return Optional.empty();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find brick by slug", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Brick> list(BrickFilter filter, boolean withHistory) {
        StringBuilder sql = new StringBuilder("SELECT " + BRICK_COLUMNS + " FROM brick WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (filter.paused() != null) {
            sql.append(" AND paused = ?");
            params.add(filter.paused());
        }
        if (filter.late() != null) {
            sql.append(" AND late = ?");
            params.add(filter.late());
        }
        if (filter.search() != null && !filter.search().isEmpty()) {
            sql.append(" AND ").append(getSearchClause());
            for (int i = 0; i < 4; i++) {
                params.add(filter.search());
            }
        }
        sql.append(" ORDER BY name, pk");

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            List<Brick> bricks = readBricks(ps);
            if (withHistory) {
                for (Brick brick : bricks) {
                    brick.setHistory(loadHistory(conn, brick.getStoreKey()));
                }
            }
            return bricks;

        } catch (SQLException e) {
            if (filter.search() != null && ExceptionTranslator.isInvalidRegex(e)) {
                LOG.debug("Search pattern '{}' rejected by the database: {}", filter.search(), e.getMessage());
                throw new IllegalArgumentException("Invalid search pattern: " + filter.search(), e);
            }
            throw ExceptionTranslator.translateException(e, "list bricks", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Brick> findWithDeadlineBefore(Instant time, int limit) {
        String sql = """
                SELECT %s FROM brick
                WHERE paused = FALSE
                  AND ((late = FALSE AND deadline IS NOT NULL AND deadline <= ?)
                       OR (deadline IS NULL AND resume_at IS NOT NULL AND resume_at <= ?))
                ORDER BY COALESCE(deadline, resume_at), pk
                LIMIT ?
                """.formatted(BRICK_COLUMNS);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, time);
            setInstant(ps, 2, time);
            ps.setInt(3, limit);

            List<Brick> bricks = readBricks(ps);
            for (Brick brick : bricks) {
                brick.setHistory(loadHistory(conn, brick.getStoreKey()));
            }
            return bricks;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find bricks with passed deadline", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<WakeTarget> listActive() {
        String sql = """
                SELECT brick_id, deadline, resume_at FROM brick
                WHERE paused = FALSE AND late = FALSE
                  AND (deadline IS NOT NULL OR resume_at IS NOT NULL)
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {

            List<WakeTarget> targets = new ArrayList<>();
            while (rs.next()) {
                Instant deadline = getInstant(rs, "deadline");
                Instant wakeAt = deadline != null ? deadline : getInstant(rs, "resume_at");
                targets.add(new WakeTarget(rs.getString("brick_id"), wakeAt));
            }
            return targets;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "list active bricks", LOG);
        }
    }

    // Update operations

    @Override
    @Transactional
    public boolean update(Brick brick, long expectedVersion) {
        String sql = """
                UPDATE brick
                SET name = ?, slug = ?, description = ?, periodicity = ?, emails = ?,
                    paused = ?, late = ?, notify_pending = ?, deadline = ?, resume_at = ?,
                    version = version + 1
                WHERE brick_id = ? AND version = ?
                """;

        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, brick.getName());
                ps.setString(2, brick.getSlug());
                ps.setString(3, nullToEmpty(brick.getDescription()));
                ps.setString(4, brick.getPeriodicity());
                ps.setString(5, Jsons.toJson(brick.getEmails()));
                ps.setBoolean(6, brick.isPaused());
                ps.setBoolean(7, brick.isLate());
                ps.setBoolean(8, brick.isNotifyPending());
                setInstant(ps, 9, brick.getDeadline());
                setInstant(ps, 10, brick.getResumeAt());
                ps.setString(11, brick.getId());
                ps.setLong(12, expectedVersion);

                if (ps.executeUpdate() == 0) {
                    LOG.debug("Version conflict updating brick id={} expectedVersion={}", brick.getId(), expectedVersion);
                    return false;
                }
            }

            brick.setVersion(expectedVersion + 1);
            List<HistoryEntry> unsaved = brick.getUnsavedHistory();
            if (!unsaved.isEmpty()) {
                insertHistory(conn, brick.getStoreKey(), unsaved);
                pruneHistory(conn, brick.getStoreKey(), unsaved.get(unsaved.size() - 1).at());
                brick.clearUnsavedHistory();
            }
            return true;

        } catch (SQLException e) {
            if (ExceptionTranslator.isUniqueViolation(e, SLUG_CONSTRAINT)) {
                LOG.info("Slug '{}' taken concurrently while updating brick id={}", brick.getSlug(), brick.getId());
                throw new DuplicateSlugException(brick.getSlug());
            }
            throw ExceptionTranslator.translateException(e, "update brick", LOG);
        }
    }

    @Override
    @Transactional
    public boolean delete(String id) {
        String historySql = "DELETE FROM brick_history WHERE brick_pk IN (SELECT pk FROM brick WHERE brick_id = ?)";
        String brickSql = "DELETE FROM brick WHERE brick_id = ?";

        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(historySql)) {
                ps.setString(1, id);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(brickSql)) {
                ps.setString(1, id);
                return ps.executeUpdate() > 0;
            }
        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "delete brick", LOG);
        }
    }

    // Notification claim operations

    @Override
    @Transactional
    public boolean claimNotification(String id, boolean expectedLate, String claimToken, Instant claimedAt) {
        String sql = """
                UPDATE brick
                SET notify_pending = FALSE, notify_claim_token = ?, notify_claimed_at = ?,
                    notify_claim_late = late, version = version + 1
                WHERE brick_id = ? AND notify_pending = TRUE AND late = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, claimToken);
            setInstant(ps, 2, claimedAt);
            ps.setString(3, id);
            ps.setBoolean(4, expectedLate);

            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "claim brick notification", LOG);
        }
    }

    @Override
    @Transactional
    public void completeNotification(String id, String claimToken) {
        String sql = """
                UPDATE brick
                SET notify_claim_token = NULL, notify_claimed_at = NULL, notify_claim_late = NULL,
                    version = version + 1
                WHERE brick_id = ? AND notify_claim_token = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            ps.setString(2, claimToken);

            if (ps.executeUpdate() == 0) {
                LOG.warn("No claim to complete for brick id={} token={}", id, claimToken);
            }

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "complete brick notification", LOG);
        }
    }

    @Override
    @Transactional
    public boolean releaseNotification(String id, String claimToken) {
        String sql = "UPDATE brick SET " + ROLLBACK_CLAIM + " WHERE brick_id = ? AND notify_claim_token = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            ps.setString(2, claimToken);

            return ps.executeUpdate() > 0;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "release brick notification", LOG);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Brick> findPendingNotifications(int limit) {
        String sql = """
                SELECT %s FROM brick
                WHERE notify_pending = TRUE AND notify_claim_token IS NULL
                ORDER BY pk
                LIMIT ?
                """.formatted(BRICK_COLUMNS);

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);

            List<Brick> bricks = readBricks(ps);
            for (Brick brick : bricks) {
                brick.setHistory(loadHistory(conn, brick.getStoreKey()));
            }
            return bricks;

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "find pending notifications", LOG);
        }
    }

    @Override
    @Transactional
    public int recoverStaleClaims(Instant claimedBefore) {
        String sql = "UPDATE brick SET " + ROLLBACK_CLAIM
                + " WHERE notify_claim_token IS NOT NULL AND notify_claimed_at < ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            setInstant(ps, 1, claimedBefore);
            return ps.executeUpdate();

        } catch (SQLException e) {
            throw ExceptionTranslator.translateException(e, "recover stale notification claims", LOG);
        }
    }

    // History

    protected void insertHistory(Connection conn, long brickPk, List<HistoryEntry> entries) throws SQLException {
        if (entries.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO brick_history (brick_pk, event_at, event_comment) VALUES (?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (HistoryEntry entry : entries) {
                ps.setLong(1, brickPk);
                setInstant(ps, 2, entry.at());
                ps.setString(3, entry.comment());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    protected List<HistoryEntry> loadHistory(Connection conn, long brickPk) throws SQLException {
        String sql = "SELECT event_at, event_comment FROM brick_history WHERE brick_pk = ? ORDER BY event_at, pk";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, brickPk);
            List<HistoryEntry> history = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    history.add(new HistoryEntry(getInstant(rs, "event_at"), rs.getString("event_comment")));
                }
            }
            return history;
        }
    }

    /**
     * Deletes the oldest history rows that fall outside {@link HistoryPolicy}.
     */
    protected void pruneHistory(Connection conn, long brickPk, Instant now) throws SQLException {
        List<HistoryEntry> history = loadHistory(conn, brickPk);
        int drop = HistoryPolicy.firstRetained(history.stream().map(HistoryEntry::at).toList(), now);
        if (drop == 0) {
            return;
        }
        String sql = """
                DELETE FROM brick_history WHERE pk IN (
                    SELECT pk FROM brick_history WHERE brick_pk = ? ORDER BY event_at, pk LIMIT ?)
                """;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, brickPk);
            ps.setInt(2, drop);
            int deleted = ps.executeUpdate();
            LOG.debug("Pruned {} history entries of brick pk={}", deleted, brickPk);
        }
    }

    // Mapping

    protected List<Brick> readBricks(PreparedStatement ps) throws SQLException {
        List<Brick> bricks = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                bricks.add(mapResultSetToBrick(rs));
            }
        }
        return bricks;
    }

    protected Brick mapResultSetToBrick(ResultSet rs) throws SQLException {
        Brick brick = new Brick();
        brick.setStoreKey(rs.getLong("pk"));
        brick.setId(rs.getString("brick_id"));
        brick.setName(rs.getString("name"));
        brick.setSlug(rs.getString("slug"));
        brick.setDescription(rs.getString("description"));
        brick.setPeriodicity(rs.getString("periodicity"));
        brick.setEmails(new ArrayList<>(Jsons.toStringList(rs.getString("emails"))));
        brick.setPaused(rs.getBoolean("paused"));
        brick.setLate(rs.getBoolean("late"));
        brick.setNotifyPending(rs.getBoolean("notify_pending"));
        brick.setDeadline(getInstant(rs, "deadline"));
        brick.setResumeAt(getInstant(rs, "resume_at"));
        brick.setNotifyClaimToken(rs.getString("notify_claim_token"));
        brick.setNotifyClaimedAt(getInstant(rs, "notify_claimed_at"));
        boolean claimLate = rs.getBoolean("notify_claim_late");
        brick.setNotifyClaimLate(rs.wasNull() ? null : claimLate);
        brick.setVersion(rs.getLong("version"));
        brick.setCreatedAt(getInstant(rs, "created_at"));
        return brick;
    }

    protected static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        ps.setTimestamp(index, instant != null ? Timestamp.from(instant) : null);
    }

    protected static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts != null ? ts.toInstant() : null;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
