package com.classpulse.engage.recommendation;

import com.classpulse.engage.config.EngageProperties;
import com.classpulse.engage.domain.DomainModels.Activity;
import com.classpulse.engage.domain.DomainModels.Course;
import com.classpulse.engage.domain.DomainModels.CourseRecommendation;
import com.classpulse.engage.error.NotFoundException;
import com.classpulse.engage.error.ValidationException;
import com.classpulse.engage.error.ValidationIssue;
import com.classpulse.engage.recommendation.RecommendationModels.*;
import com.classpulse.engage.repository.ActivityJdbcRepository;
import com.classpulse.engage.repository.CourseJdbcRepository;
import com.classpulse.engage.repository.RecommendationJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);
    private static final Set<String> DEFAULT_TOKENS = Set.of("*", "ANY", "any", "default");
    static final String SYSTEM_DEFAULT_TAG = "__system_default__";

    private final RecommendationJdbcRepository repository;
    private final ActivityJdbcRepository activityRepository;
    private final CourseJdbcRepository courseRepository;
    private final EngageProperties properties;
    private final RecommendationChain chain = RecommendationChain.standard();

    public RecommendationService(RecommendationJdbcRepository repository,
                                 ActivityJdbcRepository activityRepository,
                                 CourseJdbcRepository courseRepository,
                                 EngageProperties properties) {
        this.repository = repository;
        this.activityRepository = activityRepository;
        this.courseRepository = courseRepository;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public Resolution resolve(RecommendationQuery query) {
        return chain.resolve(query, loadTable(query.courseId()));
    }

    @Transactional(readOnly = true)
    public RecommendedActivity recommend(RecommendationQuery query) {
        Resolution resolution = resolve(query);
        ActivityDetails details = resolution.activityId() == null ? null
                : activityRepository.findById(resolution.activityId()).map(RecommendationService::details).orElse(null);
        return new RecommendedActivity(resolution.matchType(), query.learningStyle(), query.mood(), details);
    }

    @Transactional(readOnly = true)
    public CourseMappingsView listMappings(String courseId) {
        Course course = course(courseId);
        List<CourseRecommendation> rows = repository.findByCourse(courseId);
        Map<String, Activity> activities = activityRepository.findByIds(
                rows.stream().map(CourseRecommendation::activityId).distinct().toList());

        List<MappingView> mappings = rows.stream()
                .map(r -> new MappingView(r.learningStyle(), r.mood(), r.styleDefault(), r.auto(),
                        Optional.ofNullable(activities.get(r.activityId())).map(RecommendationService::details).orElse(null)))
                .toList();
        return new CourseMappingsView(courseId, course.learningStyleCategories(), course.moodLabels(), mappings);
    }

    @Transactional
    public CourseMappingsView patchMappings(String courseId, List<MappingInput> mappings) {
        Course course = course(courseId);
        List<ValidationIssue> issues = new ArrayList<>();
        List<Mapping> accepted = new ArrayList<>();

        for (int i = 0; i < mappings.size(); i++) {
            MappingInput input = mappings.get(i);
            String ref = "mappings[" + i + "]";
            String style = normalize(input.learningStyle());
            String mood = normalize(input.mood());

            if (style == null && mood == null) {
                issues.add(new ValidationIssue("EMPTY_MAPPING", "Mapping needs a learning style, a mood or both", ref));
            }
            if (input.styleDefault() && (style == null || mood != null)) {
                issues.add(new ValidationIssue("INVALID_STYLE_DEFAULT", "A style default needs a learning style and no mood", ref));
            }
            if (style != null && !course.learningStyleCategories().contains(style)) {
                issues.add(new ValidationIssue("UNKNOWN_LEARNING_STYLE", "Not a learning style of this course: " + style, ref));
            }
            if (mood != null && !course.moodLabels().contains(mood)) {
                issues.add(new ValidationIssue("UNKNOWN_MOOD", "Not a mood label of this course: " + mood, ref));
            }
            if (input.activityId() == null || !activityRepository.existsById(input.activityId())) {
                issues.add(new ValidationIssue("ACTIVITY_NOT_FOUND", "Unknown activity: " + input.activityId(), ref));
            }
            accepted.add(new Mapping(style, mood, style != null && mood == null, input.activityId()));
        }
        if (!issues.isEmpty()) {
            throw new ValidationException(issues);
        }

        Instant now = Instant.now();
        accepted.forEach(m -> upsertManual(courseId, m, now));
        ensureCourseDefault(courseId, now);
        ensureMoodDefaults(courseId, accepted, now);
        ensureStyleDefaults(courseId, accepted, now);
        log.info("Patched {} recommendation mappings for course {}", accepted.size(), courseId);
        return listMappings(courseId);
    }

    RecommendationTable loadTable(String courseId) {
        String systemDefault = null;
        if (properties.recommendation().hasSystemDefault()) {
            String configured = properties.recommendation().systemDefaultActivityId();
            if (activityRepository.existsById(configured)) {
                systemDefault = configured;
            } else {
                log.warn("Configured system default activity {} does not exist", configured);
            }
        }
        return new RecommendationTable(courseId, repository.findByCourse(courseId), repository.activityPool(courseId), systemDefault);
    }

    private void upsertManual(String courseId, Mapping m, Instant now) {
        Optional<CourseRecommendation> existing = repository.findEntry(courseId, m.style(), m.mood(), m.styleDefault());
        if (existing.isPresent()) {
            repository.updateActivity(existing.get().id(), m.activityId(), false, now);
        } else {
            repository.insert(new CourseRecommendation(UUID.randomUUID().toString(), courseId, m.style(), m.mood(),
                    m.styleDefault(), m.activityId(), false, now, now));
        }
    }

    // (null, null) row tracking the platform default activity; its activity joins the course pool
    private void ensureCourseDefault(String courseId, Instant now) {
        pickSystemDefaultActivity().ifPresent(activityId -> ensureAuto(courseId, null, null, false, activityId, now));
    }

    /**
     * Configured activity if it exists, else the newest activity tagged {@value #SYSTEM_DEFAULT_TAG},
     * else the newest activity.
     */
    Optional<String> pickSystemDefaultActivity() {
        if (properties.recommendation().hasSystemDefault()) {
            String configured = properties.recommendation().systemDefaultActivityId();
            if (activityRepository.existsById(configured)) {
                return Optional.of(configured);
            }
        }
        List<Activity> newestFirst = activityRepository.findAll();
        return newestFirst.stream()
                .filter(a -> a.tags().contains(SYSTEM_DEFAULT_TAG))
                .findFirst()
                .or(() -> newestFirst.stream().findFirst())
                .map(Activity::id);
    }

    private void ensureMoodDefaults(String courseId, List<Mapping> patched, Instant now) {
        Map<String, String> latestForMood = new LinkedHashMap<>();
        patched.stream().filter(m -> m.mood() != null).forEach(m -> latestForMood.put(m.mood(), m.activityId()));
        latestForMood.forEach((mood, activityId) -> ensureAuto(courseId, null, mood, false, activityId, now));
    }

    private void ensureStyleDefaults(String courseId, List<Mapping> patched, Instant now) {
        Map<String, String> latestForStyle = new LinkedHashMap<>();
        patched.stream().filter(m -> m.style() != null).forEach(m -> latestForStyle.put(m.style(), m.activityId()));
        latestForStyle.forEach((style, activityId) -> ensureAuto(courseId, style, null, true, activityId, now));
    }

    private void ensureAuto(String courseId, String style, String mood, boolean styleDefault, String activityId, Instant now) {
        Optional<CourseRecommendation> existing = repository.findEntry(courseId, style, mood, styleDefault);
        if (existing.isEmpty()) {
            repository.insert(new CourseRecommendation(UUID.randomUUID().toString(), courseId, style, mood,
                    styleDefault, activityId, true, now, now));
        } else if (existing.get().auto() && !existing.get().activityId().equals(activityId)) {
            repository.updateActivity(existing.get().id(), activityId, true, now);
        }
    }

    private Course course(String courseId) {
        return courseRepository.findById(courseId)
                .orElseThrow(() -> new NotFoundException("COURSE_NOT_FOUND", "Course not found: " + courseId));
    }

    static String normalize(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.isEmpty() || DEFAULT_TOKENS.contains(trimmed)) return null;
        return trimmed;
    }

    static ActivityDetails details(Activity a) {
        return new ActivityDetails(a.id(), a.name(), a.summary(), a.type(), a.content());
    }

    private record Mapping(String style, String mood, boolean styleDefault, String activityId) {}
}
