package com.classpulse.engage.repository;

import com.classpulse.engage.domain.DomainModels.CourseRecommendation;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Course recommendation table. Absent style or mood is stored as an empty string so the unique key
 * (course, style, mood, style_default) also covers defaults.
 */
@Repository
public class RecommendationJdbcRepository {
    private static final String COLUMNS =
            "id, course_id, learning_style, mood, is_style_default, activity_id, is_auto, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public RecommendationJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<CourseRecommendation> findByCourse(String courseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM course_recommendations WHERE course_id = ? ORDER BY learning_style, mood, is_style_default",
                mapper(), courseId);
    }

    public Optional<CourseRecommendation> findEntry(String courseId, String learningStyle, String mood, boolean styleDefault) {
        return jdbcTemplate.query(
                        "SELECT " + COLUMNS + " FROM course_recommendations WHERE course_id = ? AND learning_style = ? AND mood = ? AND is_style_default = ?",
                        mapper(), courseId, blank(learningStyle), blank(mood), styleDefault)
                .stream().findFirst();
    }

    public void insert(CourseRecommendation r) {
        jdbcTemplate.update(
                "INSERT INTO course_recommendations(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?)",
                r.id(), r.courseId(), blank(r.learningStyle()), blank(r.mood()), r.styleDefault(), r.activityId(), r.auto(),
                JsonColumns.ts(r.createdAt()), JsonColumns.ts(r.updatedAt()));
    }

    public void updateActivity(String id, String activityId, boolean auto, Instant at) {
        jdbcTemplate.update(
                "UPDATE course_recommendations SET activity_id = ?, is_auto = ?, updated_at = ? WHERE id = ?",
                activityId, auto, JsonColumns.ts(at), id);
    }

    public List<String> activityPool(String courseId) {
        return jdbcTemplate.query(
                "SELECT DISTINCT activity_id FROM course_recommendations WHERE course_id = ? ORDER BY activity_id",
                (rs, n) -> rs.getString(1), courseId);
    }

    private static String blank(String value) {
        return value == null ? "" : value;
    }

    private static String nullIfBlank(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private RowMapper<CourseRecommendation> mapper() {
        return (rs, n) -> new CourseRecommendation(
                rs.getString(1), rs.getString(2), nullIfBlank(rs.getString(3)), nullIfBlank(rs.getString(4)),
                rs.getBoolean(5), rs.getString(6), rs.getBoolean(7),
                JsonColumns.instant(rs, 8), JsonColumns.instant(rs, 9));
    }
}
