package com.deliium.drawingboard.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.deliium.drawingboard.protocol.Point;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * JDBC implementation of the user and stroke stores over the schema in {@code schema.sql}.
 *
 * <p>A stroke and its points are written in one transaction. Deleting a stroke cascades to its
 * points through the foreign key.
 */
@Repository
public class JdbcBoardStore implements UserStore, StrokeStore {

    private static final RowMapper<User> USER_ROW = (rs, rowNum) -> new User(
        rs.getLong("id"),
        rs.getString("email"),
        rs.getString("password_hash"),
        toInstant(rs.getTimestamp("created_at"))
    );

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final SimpleJdbcInsert userInsert;
    private final SimpleJdbcInsert strokeInsert;

    public JdbcBoardStore(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.tx = new TransactionTemplate(transactionManager);
        this.userInsert = new SimpleJdbcInsert(jdbc)
            .withTableName("users")
            .usingColumns("email", "password_hash")
            .usingGeneratedKeyColumns("id");
        this.strokeInsert = new SimpleJdbcInsert(jdbc)
            .withTableName("strokes")
            .usingColumns("user_id", "color", "width", "started_at_unix_ms")
            .usingGeneratedKeyColumns("id");
    }

    // ── users ────────────────────────────────────────────────────────────────

    @Override
    public long createUser(String email, String passwordHash) {
        Map<String, Object> row = new HashMap<>();
        row.put("email", email);
        row.put("password_hash", passwordHash);
        return userInsert.executeAndReturnKey(row).longValue();
    }

    @Override
    public Optional<User> findUserByEmail(String email) {
        return jdbc.query(
            "SELECT id, email, password_hash, created_at FROM users WHERE email = ?", USER_ROW, email
        ).stream().findFirst();
    }

    @Override
    public Optional<User> findUserById(long id) {
        return jdbc.query(
            "SELECT id, email, password_hash, created_at FROM users WHERE id = ?", USER_ROW, id
        ).stream().findFirst();
    }

    // ── strokes ──────────────────────────────────────────────────────────────

    @Override
    public long saveStroke(long userId, String color, int width, long startedAtUnixMs, List<Point> points) {
        Long id = tx.execute(status -> {
            Map<String, Object> row = new HashMap<>();
            row.put("user_id", userId);
            row.put("color", color);
            row.put("width", width);
            row.put("started_at_unix_ms", startedAtUnixMs);
            long strokeId = strokeInsert.executeAndReturnKey(row).longValue();
            if (!points.isEmpty()) {
                List<Object[]> batch = new ArrayList<>(points.size());
                for (int i = 0; i < points.size(); i++) {
                    Point p = points.get(i);
                    batch.add(new Object[] {strokeId, i, p.x(), p.y()});
                }
                jdbc.batchUpdate("INSERT INTO stroke_points(stroke_id, seq, x, y) VALUES (?, ?, ?, ?)", batch);
            }
            return strokeId;
        });
        return id;
    }

    @Override
    public List<StoredStroke> listStrokes(long userId) {
        Map<Long, List<Point>> pointsByStroke = new HashMap<>();
        jdbc.query(
            "SELECT p.stroke_id, p.x, p.y FROM stroke_points p JOIN strokes s ON s.id = p.stroke_id "
                + "WHERE s.user_id = ? ORDER BY p.stroke_id, p.seq",
            (RowCallbackHandler) rs -> pointsByStroke
                .computeIfAbsent(rs.getLong("stroke_id"), k -> new ArrayList<>())
                .add(new Point(rs.getDouble("x"), rs.getDouble("y"))),
            userId
        );
        return jdbc.query(
            "SELECT id, user_id, color, width, started_at_unix_ms, created_at FROM strokes "
                + "WHERE user_id = ? ORDER BY id",
            (rs, rowNum) -> mapStroke(rs, pointsByStroke),
            userId
        );
    }

    @Override
    public void deleteStroke(long userId, long strokeId) {
        jdbc.update("DELETE FROM strokes WHERE id = ? AND user_id = ?", strokeId, userId);
    }

    @Override
    public void clearStrokes(long userId) {
        jdbc.update("DELETE FROM strokes WHERE user_id = ?", userId);
    }

    private static StoredStroke mapStroke(ResultSet rs, Map<Long, List<Point>> pointsByStroke) throws SQLException {
        long id = rs.getLong("id");
        return new StoredStroke(
            id,
            rs.getLong("user_id"),
            rs.getString("color"),
            rs.getInt("width"),
            rs.getLong("started_at_unix_ms"),
            pointsByStroke.getOrDefault(id, List.of()),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
