package com.schoolsync.repo;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.schoolsync.model.Staff;

import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class StaffRepository extends PersonRepository<Staff> {

    public StaffRepository() {
        super("staff", List.of("user_id", "name", "type", "updated_at_api"));
    }

    @Override
    protected Staff newRow() {
        return new Staff();
    }

    @Override
    protected void bindExtra(PreparedStatement statement, int index, Staff row) throws SQLException {
        JdbcSupport.setLong(statement, index, row.getUserId());
        JdbcSupport.setString(statement, index + 1, row.getName());
        JdbcSupport.setString(statement, index + 2, row.getType());
        JdbcSupport.setInstant(statement, index + 3, row.getUpdatedAtApi());
    }

    @Override
    protected void readExtra(ResultSet rs, Staff row) throws SQLException {
        row.setUserId(JdbcSupport.getLong(rs, "user_id"));
        row.setName(rs.getString("name"));
        row.setType(rs.getString("type"));
        row.setUpdatedAtApi(JdbcSupport.getInstant(rs, "updated_at_api"));
    }

    /**
     * Local id of an active staff member, used when linking classes.
     */
    public Optional<Long> findActiveIdByPersonId(Connection connection, long personId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT id FROM staff WHERE person_id = ? AND is_active = TRUE")) {
            statement.setLong(1, personId);
            try (ResultSet rs = statement.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getLong(1));
                }
            }
        }
        return Optional.empty();
    }

    public int deactivateWithoutUserId(Connection connection, Instant at) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                UPDATE staff SET is_active = FALSE, deactivated_at = ?, updated_at = ?
                WHERE is_active = TRUE AND user_id IS NULL
                """)) {
            JdbcSupport.setInstant(statement, 1, at);
            JdbcSupport.setInstant(statement, 2, at);
            return statement.executeUpdate();
        }
    }

    public int countWithoutUserId(Connection connection) throws SQLException {
        return count(connection, "SELECT COUNT(*) FROM staff WHERE user_id IS NULL");
    }

    public int countWithoutName(Connection connection) throws SQLException {
        return count(connection, "SELECT COUNT(*) FROM staff WHERE name IS NULL OR name = ''");
    }

    public int countWithoutContacts(Connection connection) throws SQLException {
        return count(connection, "SELECT COUNT(*) FROM staff WHERE phone IS NULL AND email IS NULL");
    }

    public int countActiveWithPhone(Connection connection) throws SQLException {
        return count(connection, "SELECT COUNT(*) FROM staff WHERE is_active = TRUE AND phone IS NOT NULL");
    }

    public int countActiveWithEmail(Connection connection) throws SQLException {
        return count(connection, "SELECT COUNT(*) FROM staff WHERE is_active = TRUE AND email IS NOT NULL");
    }

    public int countActiveWithExternalId(Connection connection) throws SQLException {
        return count(connection, "SELECT COUNT(*) FROM staff WHERE is_active = TRUE AND external_id IS NOT NULL");
    }

    public Map<String, Integer> countActiveByType(Connection connection) throws SQLException {
        Map<String, Integer> counts = new TreeMap<>();
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT type, COUNT(*) AS total FROM staff
                WHERE is_active = TRUE AND type IS NOT NULL
                GROUP BY type
                """);
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                counts.put(rs.getString("type"), rs.getInt("total"));
            }
        }
        return counts;
    }
}
