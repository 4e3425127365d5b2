package com.acme.brickwatch.persistence.jdbc;

import com.acme.brickwatch.domain.Brick;
import com.acme.brickwatch.repository.BrickRepository;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * H2-specific implementation of BrickRepository.
 * H2 doesn't support RETURNING, so the store key is read from the generated keys.
 */
@Singleton
@Requires(property = "db.dialect", value = "H2")
public class H2BrickRepository extends JdbcBrickRepository implements BrickRepository {

    public H2BrickRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected long insertBrickRow(Connection conn, Brick brick) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getInsertBrickSql(), Statement.RETURN_GENERATED_KEYS)) {
            bindInsert(ps, brick);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No generated key returned for brick " + brick.getId());
                }
                return keys.getLong(1);
            }
        }
    }

    @Override
    protected String getSearchClause() {
        return "(REGEXP_LIKE(name, ?) OR REGEXP_LIKE(slug, ?) OR REGEXP_LIKE(brick_id, ?) OR REGEXP_LIKE(emails, ?))";
    }
}
