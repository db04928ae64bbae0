package com.classpulse.engage.repository;

import com.classpulse.engage.domain.DomainModels.CourseStudentProfile;
import com.classpulse.engage.domain.ParticipantIdentity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

/**
 * Append-only profile rows. {@code current_key} mirrors {@code participant_key} while a row is current
 * and is null afterwards; the unique index on (course_id, current_key) allows one current row per participant.
 */
@Repository
public class ProfileJdbcRepository {
    private static final String COLUMNS =
            "id, course_id, student_id, guest_id, learning_style, scores_json, source_submission_id, is_current, captured_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public ProfileJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    public int retireCurrent(String courseId, ParticipantIdentity participant) {
        return jdbcTemplate.update(
                "UPDATE course_student_profiles SET is_current = FALSE, current_key = NULL WHERE course_id = ? AND participant_key = ? AND is_current = TRUE",
                courseId, participant.key());
    }

    public void insert(CourseStudentProfile p) {
        String key = p.participant().key();
        jdbcTemplate.update(
                "INSERT INTO course_student_profiles(" + COLUMNS + ", participant_key, current_key) VALUES (?,?,?,?,?,?,?,?,?,?,?)",
                p.id(), p.courseId(), p.participant().studentId(), p.participant().guestId(), p.learningStyle(),
                json.write(p.scores()), p.sourceSubmissionId(), p.current(), JsonColumns.ts(p.capturedAt()),
                key, p.current() ? key : null);
    }

    public List<CourseStudentProfile> findCurrent(String courseId, ParticipantIdentity participant) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM course_student_profiles WHERE course_id = ? AND participant_key = ? AND is_current = TRUE",
                mapper(), courseId, participant.key());
    }

    public List<CourseStudentProfile> findCurrentForCourse(String courseId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM course_student_profiles WHERE course_id = ? AND is_current = TRUE",
                mapper(), courseId);
    }

    public List<CourseStudentProfile> findHistory(String courseId, ParticipantIdentity participant) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM course_student_profiles WHERE course_id = ? AND participant_key = ? ORDER BY is_current DESC, captured_at DESC",
                mapper(), courseId, participant.key());
    }

    private RowMapper<CourseStudentProfile> mapper() {
        return (rs, n) -> {
            Map<String, Integer> scores = json.readScores(rs.getString(6));
            return new CourseStudentProfile(
                    rs.getString(1), rs.getString(2), new ParticipantIdentity(rs.getString(3), rs.getString(4)),
                    rs.getString(5), scores == null ? Map.of() : scores, rs.getString(7), rs.getBoolean(8),
                    JsonColumns.instant(rs, 9));
        };
    }
}
