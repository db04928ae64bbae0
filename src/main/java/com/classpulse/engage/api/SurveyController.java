package com.classpulse.engage.api;

import com.classpulse.engage.domain.DomainModels.Survey;
import com.classpulse.engage.domain.DomainModels.SurveyQuestion;
import com.classpulse.engage.survey.SurveyModels.CreateSurveyCommand;
import com.classpulse.engage.survey.SurveyService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/surveys")
public class SurveyController {
    private final SurveyService surveyService;

    public SurveyController(SurveyService surveyService) {
        this.surveyService = surveyService;
    }

    @PostMapping
    public ResponseEntity<Survey> create(@Valid @RequestBody CreateSurveyRequest request) {
        Survey survey = surveyService.create(new CreateSurveyCommand(request.title(), request.creatorName(), request.questions()));
        return ResponseEntity.status(HttpStatus.CREATED).body(survey);
    }

    @GetMapping
    public ResponseEntity<List<Survey>> list() {
        return ResponseEntity.ok(surveyService.list());
    }

    @GetMapping("/{surveyId}")
    public ResponseEntity<Survey> get(@PathVariable String surveyId) {
        return ResponseEntity.ok(surveyService.get(surveyId));
    }

    public record CreateSurveyRequest(@NotBlank String title,
                                      @NotBlank String creatorName,
                                      @NotEmpty List<SurveyQuestion> questions) {}
}
