package com.classpulse.engage.course;

import com.classpulse.engage.domain.DomainModels.Course;
import com.classpulse.engage.domain.DomainModels.Survey;
import com.classpulse.engage.error.NotFoundException;
import com.classpulse.engage.error.ValidationException;
import com.classpulse.engage.error.ValidationIssue;
import com.classpulse.engage.repository.CourseJdbcRepository;
import com.classpulse.engage.survey.SurveyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

@Service
public class CourseService {
    private static final Logger log = LoggerFactory.getLogger(CourseService.class);

    private final CourseJdbcRepository repository;
    private final SurveyService surveyService;

    public CourseService(CourseJdbcRepository repository, SurveyService surveyService) {
        this.repository = repository;
        this.surveyService = surveyService;
    }

    @Transactional
    public Course create(String title, String baselineSurveyId, List<String> moodLabels) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (title == null || title.isBlank()) {
            issues.add(new ValidationIssue("MISSING_TITLE", "Course title is required", "title"));
        }
        List<String> labels = normalizeMoodLabels(moodLabels, issues);
        if (!issues.isEmpty()) {
            throw new ValidationException(issues);
        }

        List<String> categories = baselineSurveyId == null ? List.of() : categoriesOf(surveyService.get(baselineSurveyId));
        Instant now = Instant.now();
        Course course = new Course(UUID.randomUUID().toString(), title.trim(), baselineSurveyId, categories, labels,
                true, now, now);
        repository.insert(course);
        log.info("Created course {} '{}' with moods {} and categories {}", course.id(), course.title(), labels, categories);
        return course;
    }

    public Course get(String courseId) {
        return repository.findById(courseId)
                .orElseThrow(() -> new NotFoundException("COURSE_NOT_FOUND", "Course not found: " + courseId));
    }

    public List<Course> list() {
        return repository.findAll();
    }

    /**
     * Null arguments leave the field unchanged.
     */
    @Transactional
    public Course update(String courseId, String title, String baselineSurveyId) {
        Course course = get(courseId);
        if (title != null && title.isBlank()) {
            throw new ValidationException("MISSING_TITLE", "Course title cannot be blank");
        }

        String newTitle = title == null ? course.title() : title.trim();
        boolean baselineChanged = baselineSurveyId != null && !baselineSurveyId.equals(course.baselineSurveyId());
        List<String> categories = baselineChanged
                ? categoriesOf(surveyService.get(baselineSurveyId))
                : course.learningStyleCategories();

        Instant now = Instant.now();
        repository.update(new Course(course.id(), newTitle,
                baselineChanged ? baselineSurveyId : course.baselineSurveyId(),
                categories, course.moodLabels(), course.requiresRebaseline(), course.createdAt(), now));
        if (baselineChanged) {
            repository.markRebaseline(courseId, now);
            log.info("Course {} baseline survey changed {} -> {}, rebaseline required",
                    courseId, course.baselineSurveyId(), baselineSurveyId);
        }
        return get(courseId);
    }

    @Transactional
    public Course replaceMoodLabels(String courseId, List<String> moodLabels) {
        Course course = get(courseId);
        List<ValidationIssue> issues = new ArrayList<>();
        List<String> labels = normalizeMoodLabels(moodLabels, issues);
        if (!issues.isEmpty()) {
            throw new ValidationException(issues);
        }

        repository.update(new Course(course.id(), course.title(), course.baselineSurveyId(), course.learningStyleCategories(),
                labels, course.requiresRebaseline(), course.createdAt(), Instant.now()));
        log.info("Course {} mood labels set to {}", courseId, labels);
        return get(courseId);
    }

    private List<String> categoriesOf(Survey survey) {
        return surveyService.categories(survey.questions());
    }

    private List<String> normalizeMoodLabels(List<String> moodLabels, List<ValidationIssue> issues) {
        if (moodLabels == null || moodLabels.isEmpty()) {
            issues.add(new ValidationIssue("NO_MOOD_LABELS", "At least one mood label is required", "moodLabels"));
            return List.of();
        }
        Set<String> labels = new LinkedHashSet<>();
        for (String label : moodLabels) {
            if (label == null || label.isBlank()) {
                issues.add(new ValidationIssue("BLANK_MOOD_LABEL", "Mood labels cannot be blank", "moodLabels"));
            } else if (!labels.add(label.trim())) {
                issues.add(new ValidationIssue("DUPLICATE_MOOD_LABEL", "Duplicate mood label: " + label.trim(), label.trim()));
            }
        }
        return List.copyOf(labels);
    }
}
