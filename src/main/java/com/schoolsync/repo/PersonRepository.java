package com.schoolsync.repo;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.schoolsync.model.DirectoryPerson;

/**
 * JDBC access shared by the person tables. Every method works on the
 * caller's connection and never commits; transaction boundaries belong to the
 * unit of work.
 */
public abstract class PersonRepository<T extends DirectoryPerson> {

    private static final List<String> COMMON_COLUMNS = List.of(
            "person_id", "external_id", "external_link", "last_name", "first_name", "middle_name",
            "email", "phone", "is_active", "deactivated_at", "last_seen_at", "created_at", "updated_at");

    private final String table;
    private final List<String> columns;
    private final String selectSql;
    private final String insertSql;
    private final String updateSql;

    protected PersonRepository(String table, List<String> extraColumns) {
        this.table = table;
        List<String> all = new ArrayList<>(COMMON_COLUMNS);
        all.addAll(extraColumns);
        this.columns = List.copyOf(all);
        this.selectSql = "SELECT id, " + String.join(", ", columns) + " FROM " + table;
        this.insertSql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES ("
                + JdbcSupport.placeholders(columns.size()) + ")";
        this.updateSql = "UPDATE " + table + " SET " + String.join(" = ?, ", columns) + " = ? WHERE id = ?";
    }

    protected abstract T newRow();

    /**
     * Binds the table specific columns starting at {@code index}, in the order
     * they were declared.
     */
    protected abstract void bindExtra(PreparedStatement statement, int index, T row) throws SQLException;

    protected abstract void readExtra(ResultSet rs, T row) throws SQLException;

    public String getTable() {
        return table;
    }

    public Optional<T> findByPersonId(Connection connection, long personId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(selectSql + " WHERE person_id = ?")) {
            statement.setLong(1, personId);
            try (ResultSet rs = statement.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Loads the existing rows for a batch of remote ids, keyed by remote id.
     */
    public Map<Long, T> findByPersonIds(Connection connection, Collection<Long> personIds) throws SQLException {
        Map<Long, T> rows = new HashMap<>();
        for (List<Long> chunk : JdbcSupport.chunks(personIds)) {
            String sql = selectSql + " WHERE person_id IN (" + JdbcSupport.placeholders(chunk.size()) + ")";
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                int index = 1;
                for (Long personId : chunk) {
                    statement.setLong(index++, personId);
                }
                try (ResultSet rs = statement.executeQuery()) {
                    while (rs.next()) {
                        T row = mapRow(rs);
                        rows.put(row.getPersonId(), row);
                    }
                }
            }
        }
        return rows;
    }

    public T insert(Connection connection, T row) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(insertSql, new String[]{"id"})) {
            bind(statement, row);
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (keys.next()) {
                    row.setId(keys.getLong(1));
                    return row;
                }
            }
        }
        throw new SQLException("No key generated for " + table + " person_id " + row.getPersonId());
    }

    /**
     * Inserts all rows in one JDBC batch. Generated ids are not read back.
     */
    public int insertAll(Connection connection, List<T> rows) throws SQLException {
        if (rows.isEmpty()) {
            return 0;
        }
        try (PreparedStatement statement = connection.prepareStatement(insertSql)) {
            for (T row : rows) {
                bind(statement, row);
                statement.addBatch();
            }
            statement.executeBatch();
        }
        return rows.size();
    }

    public void update(Connection connection, T row) throws SQLException {
        if (row.getId() == null) {
            throw new IllegalArgumentException("Cannot update a " + table + " row without an id");
        }
        try (PreparedStatement statement = connection.prepareStatement(updateSql)) {
            bind(statement, row);
            statement.setLong(columns.size() + 1, row.getId());
            int affected = statement.executeUpdate();
            if (affected == 0) {
                throw new SQLException("No " + table + " row found for id " + row.getId());
            }
        }
    }

    public Set<Long> findActivePersonIds(Connection connection) throws SQLException {
        return queryPersonIds(connection, "SELECT person_id FROM " + table + " WHERE is_active = TRUE", null);
    }

    /**
     * Marks the given remote ids inactive. Rows already inactive keep their
     * original {@code deactivated_at}.
     */
    public int deactivate(Connection connection, Collection<Long> personIds, Instant at) throws SQLException {
        int affected = 0;
        for (List<Long> chunk : JdbcSupport.chunks(personIds)) {
            String sql = "UPDATE " + table + " SET is_active = FALSE, deactivated_at = ?, updated_at = ?"
                    + " WHERE is_active = TRUE AND person_id IN (" + JdbcSupport.placeholders(chunk.size()) + ")";
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                JdbcSupport.setInstant(statement, 1, at);
                JdbcSupport.setInstant(statement, 2, at);
                int index = 3;
                for (Long personId : chunk) {
                    statement.setLong(index++, personId);
                }
                affected += statement.executeUpdate();
            }
        }
        return affected;
    }

    public int countAll(Connection connection) throws SQLException {
        return count(connection, "SELECT COUNT(*) FROM " + table);
    }

    public int countActive(Connection connection) throws SQLException {
        return count(connection, "SELECT COUNT(*) FROM " + table + " WHERE is_active = TRUE");
    }

    protected int count(Connection connection, String sql) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            return JdbcSupport.count(statement);
        }
    }

    protected Set<Long> queryPersonIds(Connection connection, String sql, Long parameter) throws SQLException {
        Set<Long> ids = new LinkedHashSet<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            if (parameter != null) {
                statement.setLong(1, parameter);
            }
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
        }
        return ids;
    }

    private void bind(PreparedStatement statement, T row) throws SQLException {
        statement.setLong(1, row.getPersonId());
        JdbcSupport.setString(statement, 2, row.getExternalId());
        JdbcSupport.setString(statement, 3, row.getExternalLink());
        JdbcSupport.setString(statement, 4, row.getLastName());
        JdbcSupport.setString(statement, 5, row.getFirstName());
        JdbcSupport.setString(statement, 6, row.getMiddleName());
        JdbcSupport.setString(statement, 7, row.getEmail());
        JdbcSupport.setString(statement, 8, row.getPhone());
        statement.setBoolean(9, row.isActive());
        JdbcSupport.setInstant(statement, 10, row.getDeactivatedAt());
        JdbcSupport.setInstant(statement, 11, row.getLastSeenAt());
        JdbcSupport.setInstant(statement, 12, row.getCreatedAt());
        JdbcSupport.setInstant(statement, 13, row.getUpdatedAt());
        bindExtra(statement, COMMON_COLUMNS.size() + 1, row);
    }

    private T mapRow(ResultSet rs) throws SQLException {
        T row = newRow();
        row.setId(rs.getLong("id"));
        row.setPersonId(rs.getLong("person_id"));
        row.setExternalId(rs.getString("external_id"));
        row.setExternalLink(rs.getString("external_link"));
        row.setLastName(rs.getString("last_name"));
        row.setFirstName(rs.getString("first_name"));
        row.setMiddleName(rs.getString("middle_name"));
        row.setEmail(rs.getString("email"));
        row.setPhone(rs.getString("phone"));
        row.setActive(rs.getBoolean("is_active"));
        row.setDeactivatedAt(JdbcSupport.getInstant(rs, "deactivated_at"));
        row.setLastSeenAt(JdbcSupport.getInstant(rs, "last_seen_at"));
        row.setCreatedAt(JdbcSupport.getInstant(rs, "created_at"));
        row.setUpdatedAt(JdbcSupport.getInstant(rs, "updated_at"));
        readExtra(rs, row);
        return row;
    }
}
