package com.classpulse.engage.baseline;

import com.classpulse.engage.domain.DomainModels.Course;
import com.classpulse.engage.repository.CourseJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Component
public class BaselineTracker {
    private static final Logger log = LoggerFactory.getLogger(BaselineTracker.class);

    private final CourseJdbcRepository courseRepository;

    public BaselineTracker(CourseJdbcRepository courseRepository) {
        this.courseRepository = courseRepository;
    }

    public boolean shouldForceBaseline(Course course) {
        return course.requiresRebaseline() && course.baselineSurveyId() != null;
    }

    public boolean collectsCurrentBaseline(Course course, String surveyId) {
        return surveyId != null && surveyId.equals(course.baselineSurveyId());
    }

    /**
     * @param answeredSurveyId survey the submission's answers belong to, null for a mood-only submission
     * @return the course flag after this submission
     */
    @Transactional
    public boolean afterSubmission(Course course, String answeredSurveyId) {
        if (!collectsCurrentBaseline(course, answeredSurveyId)) {
            return course.requiresRebaseline();
        }
        if (courseRepository.clearRebaseline(course.id(), answeredSurveyId, Instant.now()) > 0) {
            log.info("Baseline collected for course {}, rebaseline flag cleared", course.id());
            return false;
        }
        return courseRepository.findById(course.id()).map(Course::requiresRebaseline).orElse(false);
    }
}
