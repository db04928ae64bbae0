package com.classpulse.engage.repository;

import com.classpulse.engage.domain.DomainModels.Activity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Repository
public class ActivityJdbcRepository {
    private static final String COLUMNS = "id, name, summary, type, tags, content_json, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public ActivityJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    public void insert(Activity a) {
        jdbcTemplate.update(
                "INSERT INTO activities(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)",
                a.id(), a.name(), a.summary(), a.type(), json.write(a.tags()), json.write(a.content()),
                JsonColumns.ts(a.createdAt()), JsonColumns.ts(a.updatedAt()));
    }

    public void update(Activity a) {
        jdbcTemplate.update(
                "UPDATE activities SET name=?, summary=?, tags=?, content_json=?, updated_at=? WHERE id=?",
                a.name(), a.summary(), json.write(a.tags()), json.write(a.content()), JsonColumns.ts(a.updatedAt()), a.id());
    }

    public Optional<Activity> findById(String id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM activities WHERE id = ?", mapper(), id)
                .stream().findFirst();
    }

    public boolean existsById(String id) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM activities WHERE id = ?", Long.class, id);
        return count != null && count > 0;
    }

    /** Newest first. */
    public List<Activity> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM activities ORDER BY updated_at DESC, id ASC", mapper());
    }

    public List<Activity> findByType(String type) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM activities WHERE type = ? ORDER BY updated_at DESC, id ASC",
                mapper(), type);
    }

    public Map<String, Activity> findByIds(Collection<String> ids) {
        if (ids.isEmpty()) return Map.of();
        String placeholders = String.join(",", Collections.nCopies(ids.size(), "?"));
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM activities WHERE id IN (" + placeholders + ")",
                        mapper(), ids.toArray())
                .stream()
                .collect(Collectors.toMap(Activity::id, a -> a, (a, b) -> a));
    }

    private RowMapper<Activity> mapper() {
        return (rs, n) -> {
            Map<String, Object> content = json.read(rs.getString(6), JsonColumns.OBJECT_MAP);
            return new Activity(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4),
                    json.readStrings(rs.getString(5)), content == null ? Map.of() : content,
                    JsonColumns.instant(rs, 7), JsonColumns.instant(rs, 8));
        };
    }
}
