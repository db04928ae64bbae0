package com.classpulse.engage.repository;

import com.classpulse.engage.domain.DomainModels.Survey;
import com.classpulse.engage.domain.DomainModels.SurveyQuestion;
import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class SurveyJdbcRepository {
    private static final TypeReference<List<SurveyQuestion>> QUESTIONS = new TypeReference<>() {};
    private static final String COLUMNS = "id, title, creator_name, questions_json, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;

    public SurveyJdbcRepository(JdbcTemplate jdbcTemplate, JsonColumns json) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = json;
    }

    public void insert(Survey survey) {
        jdbcTemplate.update(
                "INSERT INTO surveys(" + COLUMNS + ") VALUES (?,?,?,?,?)",
                survey.id(), survey.title(), survey.creatorName(), json.write(survey.questions()),
                JsonColumns.ts(survey.createdAt()));
    }

    public Optional<Survey> findById(String id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM surveys WHERE id = ?", mapper(), id)
                .stream().findFirst();
    }

    public boolean existsByTitle(String title) {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM surveys WHERE title = ?", Long.class, title);
        return count != null && count > 0;
    }

    public List<Survey> findAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM surveys ORDER BY created_at DESC", mapper());
    }

    private RowMapper<Survey> mapper() {
        return (rs, n) -> {
            List<SurveyQuestion> questions = json.read(rs.getString(4), QUESTIONS);
            return new Survey(rs.getString(1), rs.getString(2), rs.getString(3),
                    questions == null ? List.of() : questions, JsonColumns.instant(rs, 5));
        };
    }
}
