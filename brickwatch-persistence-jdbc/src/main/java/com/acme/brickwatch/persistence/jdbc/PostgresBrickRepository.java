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

/**
 * PostgreSQL-specific implementation of BrickRepository.
 * Uses RETURNING for the store key and the POSIX {@code ~} operator for search.
 */
@Singleton
@Requires(property = "db.dialect", value = "PostgreSQL")
public class PostgresBrickRepository extends JdbcBrickRepository implements BrickRepository {

    public PostgresBrickRepository(DataSource dataSource) {
        super(dataSource);
    }

    @Override
    protected long insertBrickRow(Connection conn, Brick brick) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(getInsertBrickSql().strip() + " RETURNING pk")) {
            bindInsert(ps, brick);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Insert of brick " + brick.getId() + " returned no row");
                }
                return rs.getLong(1);
            }
        }
    }

    @Override
    protected String getSearchClause() {
        return "(name ~ ? OR slug ~ ? OR brick_id ~ ? OR emails ~ ?)";
    }
}
