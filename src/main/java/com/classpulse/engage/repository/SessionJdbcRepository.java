package com.classpulse.engage.repository;

import com.classpulse.engage.domain.DomainModels.ClassSession;
import com.classpulse.engage.domain.DomainModels.MoodCheckSchema;
import com.classpulse.engage.domain.DomainModels.SurveySnapshot;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class SessionJdbcRepository {
    private static final String COLUMNS =
            "id, course_id, survey_id, require_survey, mood_prompt, mood_options, survey_snapshot_json, join_token, started_at, closed_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public SessionJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    public void insert(ClassSession s) {
        jdbcTemplate.update(
                "INSERT INTO sessions(" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?)",
                s.id(), s.courseId(), s.surveyId(), s.requireSurvey(),
                s.moodCheck().prompt(), json.write(s.moodCheck().options()), json.write(s.surveySnapshot()),
                s.joinToken(), JsonColumns.ts(s.startedAt()), JsonColumns.ts(s.closedAt()));
    }

    public Optional<ClassSession> findById(String id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM sessions WHERE id = ?", mapper(), id)
                .stream().findFirst();
    }

    /**
     * Reads the session and holds its row lock until the surrounding transaction ends, so a concurrent
     * close cannot interleave with a submission write.
     */
    public Optional<ClassSession> lockById(String id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM sessions WHERE id = ? FOR UPDATE", mapper(), id)
                .stream().findFirst();
    }

    public Optional<ClassSession> findByJoinToken(String joinToken) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM sessions WHERE join_token = ?", mapper(), joinToken)
                .stream().findFirst();
    }

    public boolean existsByJoinToken(String joinToken) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM sessions WHERE join_token = ?", Long.class, joinToken);
        return count != null && count > 0;
    }

    public List<ClassSession> findByCourse(String courseId) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM sessions WHERE course_id = ? ORDER BY started_at DESC",
                mapper(), courseId);
    }

    public int close(String id, Instant closedAt) {
        return jdbcTemplate.update("UPDATE sessions SET closed_at = ? WHERE id = ? AND closed_at IS NULL",
                JsonColumns.ts(closedAt), id);
    }

    private RowMapper<ClassSession> mapper() {
        return (rs, n) -> new ClassSession(
                rs.getString(1), rs.getString(2), rs.getString(3), rs.getBoolean(4),
                new MoodCheckSchema(rs.getString(5), json.readStrings(rs.getString(6))),
                json.read(rs.getString(7), SurveySnapshot.class),
                rs.getString(8), JsonColumns.instant(rs, 9), JsonColumns.instant(rs, 10));
    }
}
