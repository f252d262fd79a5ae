package com.schoolsync.repo;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Set;

import com.schoolsync.model.Student;

import jakarta.enterprise.context.ApplicationScoped;

@ApplicationScoped
public class StudentRepository extends PersonRepository<Student> {

    public StudentRepository() {
        super("students", List.of("user_name", "class_unit_id"));
    }

    @Override
    protected Student newRow() {
        return new Student();
    }

    @Override
    protected void bindExtra(PreparedStatement statement, int index, Student row) throws SQLException {
        JdbcSupport.setString(statement, index, row.getUserName());
        JdbcSupport.setLong(statement, index + 1, row.getClassUnitId());
    }

    @Override
    protected void readExtra(ResultSet rs, Student row) throws SQLException {
        row.setUserName(rs.getString("user_name"));
        row.setClassUnitId(JdbcSupport.getLong(rs, "class_unit_id"));
    }

    public Set<Long> findActivePersonIdsInClass(Connection connection, long classUnitId) throws SQLException {
        return queryPersonIds(connection,
                "SELECT person_id FROM students WHERE is_active = TRUE AND class_unit_id = ?", classUnitId);
    }
}
