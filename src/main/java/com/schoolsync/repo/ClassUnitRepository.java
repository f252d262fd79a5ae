package com.schoolsync.repo;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import com.schoolsync.model.ClassUnit;

import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class ClassUnitRepository {

    public Optional<ClassUnit> findById(Connection connection, long id) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT id, school_id, class_level_id, name, parallel, literal, created_at, updated_at
                FROM class_units WHERE id = ?
                """)) {
            statement.setLong(1, id);
            try (ResultSet rs = statement.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        }
        return Optional.empty();
    }

    public List<Long> findAllIds(Connection connection) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement("SELECT id FROM class_units ORDER BY id");
             ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getLong(1));
            }
        }
        return ids;
    }

    public void insert(Connection connection, ClassUnit unit) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                INSERT INTO class_units (id, school_id, class_level_id, name, parallel, literal, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """)) {
            statement.setLong(1, unit.getId());
            bindFields(statement, 2, unit);
            JdbcSupport.setInstant(statement, 7, unit.getCreatedAt());
            JdbcSupport.setInstant(statement, 8, unit.getUpdatedAt());
            statement.executeUpdate();
        }
    }

    public void update(Connection connection, ClassUnit unit) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("""
                UPDATE class_units
                SET school_id = ?, class_level_id = ?, name = ?, parallel = ?, literal = ?, updated_at = ?
                WHERE id = ?
                """)) {
            bindFields(statement, 1, unit);
            JdbcSupport.setInstant(statement, 6, unit.getUpdatedAt());
            statement.setLong(7, unit.getId());
            statement.executeUpdate();
        }
    }

    /**
     * Replaces every staff link of a class with the given local staff ids.
     */
    public int replaceStaffLinks(Connection connection, long classUnitId, Collection<Long> staffIds)
            throws SQLException {
        try (PreparedStatement delete = connection.prepareStatement(
                "DELETE FROM class_staff WHERE class_unit_id = ?")) {
            delete.setLong(1, classUnitId);
            delete.executeUpdate();
        }
        if (staffIds.isEmpty()) {
            return 0;
        }
        try (PreparedStatement insert = connection.prepareStatement(
                "INSERT INTO class_staff (class_unit_id, staff_id) VALUES (?, ?)")) {
            for (Long staffId : staffIds) {
                insert.setLong(1, classUnitId);
                insert.setLong(2, staffId);
                insert.addBatch();
            }
            insert.executeBatch();
        }
        return staffIds.size();
    }

    public List<Long> findLinkedStaffIds(Connection connection, long classUnitId) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT staff_id FROM class_staff WHERE class_unit_id = ? ORDER BY staff_id")) {
            statement.setLong(1, classUnitId);
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getLong(1));
                }
            }
        }
        return ids;
    }

    public int countAll(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM class_units")) {
            return JdbcSupport.count(statement);
        }
    }

    private void bindFields(PreparedStatement statement, int index, ClassUnit unit) throws SQLException {
        JdbcSupport.setLong(statement, index, unit.getSchoolId());
        JdbcSupport.setLong(statement, index + 1, unit.getClassLevelId());
        statement.setString(index + 2, unit.getName());
        JdbcSupport.setString(statement, index + 3, unit.getParallel());
        JdbcSupport.setString(statement, index + 4, unit.getLiteral());
    }

    private ClassUnit mapRow(ResultSet rs) throws SQLException {
        ClassUnit unit = new ClassUnit();
        unit.setId(rs.getLong("id"));
        unit.setSchoolId(JdbcSupport.getLong(rs, "school_id"));
        unit.setClassLevelId(JdbcSupport.getLong(rs, "class_level_id"));
        unit.setName(rs.getString("name"));
        unit.setParallel(rs.getString("parallel"));
        unit.setLiteral(rs.getString("literal"));
        unit.setCreatedAt(JdbcSupport.getInstant(rs, "created_at"));
        unit.setUpdatedAt(JdbcSupport.getInstant(rs, "updated_at"));
        return unit;
    }
}
