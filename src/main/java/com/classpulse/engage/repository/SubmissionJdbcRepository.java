package com.classpulse.engage.repository;

import com.classpulse.engage.domain.DomainModels.AnswersPayload;
import com.classpulse.engage.domain.DomainModels.Submission;
import com.classpulse.engage.domain.ParticipantIdentity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class SubmissionJdbcRepository {
    private static final String COLUMNS =
            "id, session_id, course_id, student_id, guest_id, guest_name, mood, answers_json, total_scores, is_baseline_update, status, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public SubmissionJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    public Optional<Submission> findBySessionAndParticipant(String sessionId, ParticipantIdentity participant) {
        return jdbcTemplate.query(
                        "SELECT " + COLUMNS + " FROM submissions WHERE session_id = ? AND participant_key = ?",
                        mapper(), sessionId, participant.key())
                .stream().findFirst();
    }

    public void insert(Submission s) {
        jdbcTemplate.update(
                "INSERT INTO submissions(" + COLUMNS + ", participant_key) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                s.id(), s.sessionId(), s.courseId(), s.participant().studentId(), s.participant().guestId(), s.guestName(),
                s.mood(), json.write(s.answers()), json.write(s.totalScores()), s.baselineUpdate(), s.status(),
                JsonColumns.ts(s.createdAt()), JsonColumns.ts(s.updatedAt()), s.participant().key());
    }

    public void update(Submission s) {
        jdbcTemplate.update(
                "UPDATE submissions SET course_id=?, guest_name=?, mood=?, answers_json=?, total_scores=?, is_baseline_update=?, status=?, updated_at=? WHERE id=?",
                s.courseId(), s.guestName(), s.mood(), json.write(s.answers()), json.write(s.totalScores()),
                s.baselineUpdate(), s.status(), JsonColumns.ts(s.updatedAt()), s.id());
    }

    public List<Submission> findBySession(String sessionId) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM submissions WHERE session_id = ? ORDER BY created_at ASC, id ASC",
                mapper(), sessionId);
    }

    private RowMapper<Submission> mapper() {
        return (rs, n) -> new Submission(
                rs.getString(1), rs.getString(2), rs.getString(3),
                new ParticipantIdentity(rs.getString(4), rs.getString(5)), rs.getString(6), rs.getString(7),
                json.read(rs.getString(8), AnswersPayload.class), json.readScores(rs.getString(9)),
                rs.getBoolean(10), rs.getString(11), JsonColumns.instant(rs, 12), JsonColumns.instant(rs, 13));
    }
}
