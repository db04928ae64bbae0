package com.classpulse.engage.survey;

import com.classpulse.engage.domain.DomainModels.Survey;
import com.classpulse.engage.domain.DomainModels.SurveyQuestion;
import com.classpulse.engage.domain.DomainModels.SurveySnapshot;
import com.classpulse.engage.error.ConflictException;
import com.classpulse.engage.error.NotFoundException;
import com.classpulse.engage.error.ValidationException;
import com.classpulse.engage.error.ValidationIssue;
import com.classpulse.engage.repository.SurveyJdbcRepository;
import com.classpulse.engage.survey.SurveyModels.CreateSurveyCommand;
import com.classpulse.engage.survey.SurveyModels.PublicQuestion;
import com.classpulse.engage.survey.SurveyModels.PublicSurvey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Service
public class SurveyService {
    private static final Logger log = LoggerFactory.getLogger(SurveyService.class);

    private final SurveyJdbcRepository repository;
    private final SurveyDefinitionValidator validator;
    private final SurveyScorer scorer;

    public SurveyService(SurveyJdbcRepository repository, SurveyDefinitionValidator validator, SurveyScorer scorer) {
        this.repository = repository;
        this.validator = validator;
        this.scorer = scorer;
    }

    @Transactional
    public Survey create(CreateSurveyCommand command) {
        List<ValidationIssue> issues = validator.validate(command.title(), command.creatorName(), command.questions());
        if (!issues.isEmpty()) {
            throw new ValidationException(issues);
        }
        String title = command.title().trim();
        if (repository.existsByTitle(title)) {
            throw new ConflictException("SURVEY_TITLE_TAKEN", "A survey with this title already exists: " + title);
        }

        Survey survey = new Survey(UUID.randomUUID().toString(), title, command.creatorName().trim(),
                List.copyOf(command.questions()), Instant.now());
        repository.insert(survey);
        log.info("Created survey {} '{}' with {} questions and categories {}",
                survey.id(), title, survey.questions().size(), scorer.categories(survey.questions()));
        return survey;
    }

    public Survey get(String surveyId) {
        return repository.findById(surveyId)
                .orElseThrow(() -> new NotFoundException("SURVEY_NOT_FOUND", "Survey not found: " + surveyId));
    }

    public List<Survey> list() {
        return repository.findAll();
    }

    public SurveySnapshot snapshot(Survey survey) {
        return new SurveySnapshot(survey.id(), survey.title(), List.copyOf(survey.questions()));
    }

    public PublicSurvey publicView(SurveySnapshot snapshot) {
        if (snapshot == null) return null;
        List<PublicQuestion> questions = snapshot.questions().stream()
                .filter(q -> q.id() != null)
                .map(q -> new PublicQuestion(q.id(), SurveyScorer.textOf(q), scorer.optionDetails(q)))
                .toList();
        return new PublicSurvey(snapshot.surveyId(), snapshot.title(), questions);
    }

    public List<String> categories(List<SurveyQuestion> questions) {
        return scorer.categories(questions);
    }
}
