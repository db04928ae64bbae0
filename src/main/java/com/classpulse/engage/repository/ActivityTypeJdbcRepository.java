package com.classpulse.engage.repository;

import com.classpulse.engage.domain.DomainModels.ActivityType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ActivityTypeJdbcRepository {
    private static final String COLUMNS =
            "type_name, description, required_fields, optional_fields, example_content_json, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public ActivityTypeJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    public void insert(ActivityType t) {
        jdbcTemplate.update(
                "INSERT INTO activity_types(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?)",
                t.typeName(), t.description(), json.write(t.requiredFields()), json.write(t.optionalFields()),
                json.write(t.exampleContent()), JsonColumns.ts(t.createdAt()), JsonColumns.ts(t.updatedAt()));
    }

    public Optional<ActivityType> findByName(String typeName) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM activity_types WHERE type_name = ?", mapper(), typeName)
                .stream().findFirst();
    }

    public boolean existsByName(String typeName) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM activity_types WHERE type_name = ?", Long.class, typeName);
        return count != null && count > 0;
    }

    public List<ActivityType> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM activity_types ORDER BY type_name ASC", mapper());
    }

    private RowMapper<ActivityType> mapper() {
        return (rs, n) -> new ActivityType(
                rs.getString(1), rs.getString(2),
                json.readStrings(rs.getString(3)), json.readStrings(rs.getString(4)),
                json.read(rs.getString(5), JsonColumns.OBJECT_MAP),
                JsonColumns.instant(rs, 6), JsonColumns.instant(rs, 7));
    }
}
