package com.schoolsync.repo;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import com.schoolsync.model.Parent;

import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class ParentRepository extends PersonRepository<Parent> {

    public ParentRepository() {
        super("parents", List.of("name"));
    }

    @Override
    protected Parent newRow() {
        return new Parent();
    }

    @Override
    protected void bindExtra(PreparedStatement statement, int index, Parent row) throws SQLException {
        JdbcSupport.setString(statement, index, row.getName());
    }

    @Override
    protected void readExtra(ResultSet rs, Parent row) throws SQLException {
        row.setName(rs.getString("name"));
    }

    /**
     * Links a parent to a student. Returns {@code false} when the pair
     * already exists.
     */
    public boolean linkToStudent(Connection connection, long parentId, long studentId) throws SQLException {
        try (PreparedStatement check = connection.prepareStatement(
                "SELECT 1 FROM parent_student WHERE parent_id = ? AND student_id = ?")) {
            check.setLong(1, parentId);
            check.setLong(2, studentId);
            try (ResultSet rs = check.executeQuery()) {
                if (rs.next()) {
                    return false;
                }
            }
        }
        try (PreparedStatement insert = connection.prepareStatement(
                "INSERT INTO parent_student (parent_id, student_id) VALUES (?, ?)")) {
            insert.setLong(1, parentId);
            insert.setLong(2, studentId);
            insert.executeUpdate();
        }
        return true;
    }

    public int countLinks(Connection connection) throws SQLException {
        return count(connection, "SELECT COUNT(*) FROM parent_student");
    }
}
