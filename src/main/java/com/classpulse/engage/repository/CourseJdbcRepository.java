package com.classpulse.engage.repository;

import com.classpulse.engage.domain.DomainModels.Course;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class CourseJdbcRepository {
    private static final String COLUMNS =
            "id, title, baseline_survey_id, learning_style_categories, mood_labels, requires_rebaseline, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public CourseJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    public void insert(Course c) {
        jdbcTemplate.update(
                "INSERT INTO courses(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?)",
                c.id(), c.title(), c.baselineSurveyId(), json.write(c.learningStyleCategories()), json.write(c.moodLabels()),
                c.requiresRebaseline(), JsonColumns.ts(c.createdAt()), JsonColumns.ts(c.updatedAt()));
    }

    /**
     * Writes everything except {@code requires_rebaseline}, which only {@link #markRebaseline} and
     * {@link #clearRebaseline} touch.
     */
    public void update(Course c) {
        jdbcTemplate.update(
                "UPDATE courses SET title=?, baseline_survey_id=?, learning_style_categories=?, mood_labels=?, updated_at=? WHERE id=?",
                c.title(), c.baselineSurveyId(), json.write(c.learningStyleCategories()), json.write(c.moodLabels()),
                JsonColumns.ts(c.updatedAt()), c.id());
    }

    public void markRebaseline(String courseId, Instant at) {
        jdbcTemplate.update("UPDATE courses SET requires_rebaseline = TRUE, updated_at = ? WHERE id = ?",
                JsonColumns.ts(at), courseId);
    }

    public Optional<Course> findById(String id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM courses WHERE id = ?", mapper(), id)
                .stream().findFirst();
    }

    public List<Course> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM courses ORDER BY created_at DESC", mapper());
    }

    /**
     * Clears the flag only while {@code baselineSurveyId} is still the course's baseline survey.
     *
     * @return number of rows whose flag actually went from true to false
     */
    public int clearRebaseline(String courseId, String baselineSurveyId, Instant at) {
        return jdbcTemplate.update(
                "UPDATE courses SET requires_rebaseline = FALSE, updated_at = ? WHERE id = ? AND requires_rebaseline = TRUE AND baseline_survey_id = ?",
                JsonColumns.ts(at), courseId, baselineSurveyId);
    }

    private RowMapper<Course> mapper() {
        return (rs, n) -> new Course(
                rs.getString(1), rs.getString(2), rs.getString(3),
                json.readStrings(rs.getString(4)), json.readStrings(rs.getString(5)),
                rs.getBoolean(6), JsonColumns.instant(rs, 7), JsonColumns.instant(rs, 8));
    }
}
