package com.classpulse.engage.api;

import com.classpulse.engage.course.CourseService;
import com.classpulse.engage.domain.DomainModels.ClassSession;
import com.classpulse.engage.domain.DomainModels.Course;
import com.classpulse.engage.domain.DomainModels.CourseStudentProfile;
import com.classpulse.engage.domain.ParticipantIdentity;
import com.classpulse.engage.profile.ProfileStore;
import com.classpulse.engage.recommendation.RecommendationModels.CourseMappingsView;
import com.classpulse.engage.recommendation.RecommendationModels.MappingInput;
import com.classpulse.engage.recommendation.RecommendationService;
import com.classpulse.engage.session.SessionModels.SessionView;
import com.classpulse.engage.session.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/courses")
public class CourseController {
    private final CourseService courseService;
    private final RecommendationService recommendationService;
    private final SessionService sessionService;
    private final ProfileStore profileStore;

    public CourseController(CourseService courseService,
                            RecommendationService recommendationService,
                            SessionService sessionService,
                            ProfileStore profileStore) {
        this.courseService = courseService;
        this.recommendationService = recommendationService;
        this.sessionService = sessionService;
        this.profileStore = profileStore;
    }

    @PostMapping
    public ResponseEntity<Course> create(@Valid @RequestBody CreateCourseRequest request) {
        Course course = courseService.create(request.title(), request.baselineSurveyId(), request.moodLabels());
        return ResponseEntity.status(HttpStatus.CREATED).body(course);
    }

    @GetMapping
    public ResponseEntity<List<Course>> list() {
        return ResponseEntity.ok(courseService.list());
    }

    @GetMapping("/{courseId}")
    public ResponseEntity<Course> get(@PathVariable String courseId) {
        return ResponseEntity.ok(courseService.get(courseId));
    }

    @PatchMapping("/{courseId}")
    public ResponseEntity<Course> update(@PathVariable String courseId, @RequestBody UpdateCourseRequest request) {
        return ResponseEntity.ok(courseService.update(courseId, request.title(), request.baselineSurveyId()));
    }

    @PutMapping("/{courseId}/mood-labels")
    public ResponseEntity<Course> moodLabels(@PathVariable String courseId, @Valid @RequestBody MoodLabelsRequest request) {
        return ResponseEntity.ok(courseService.replaceMoodLabels(courseId, request.moodLabels()));
    }

    @GetMapping("/{courseId}/recommendations")
    public ResponseEntity<CourseMappingsView> mappings(@PathVariable String courseId) {
        return ResponseEntity.ok(recommendationService.listMappings(courseId));
    }

    @PatchMapping("/{courseId}/recommendations")
    public ResponseEntity<CourseMappingsView> patchMappings(@PathVariable String courseId,
                                                            @Valid @RequestBody PatchMappingsRequest request) {
        return ResponseEntity.ok(recommendationService.patchMappings(courseId, request.mappings()));
    }

    @PostMapping("/{courseId}/sessions")
    public ResponseEntity<SessionView> createSession(@PathVariable String courseId,
                                                     @RequestBody(required = false) CreateSessionRequest request) {
        boolean surveyRequested = request != null && Boolean.TRUE.equals(request.requireSurvey());
        String prompt = request == null ? null : request.moodPrompt();
        ClassSession session = sessionService.createSession(courseId, surveyRequested, prompt);
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.view(session));
    }

    @GetMapping("/{courseId}/sessions")
    public ResponseEntity<List<SessionView>> sessions(@PathVariable String courseId) {
        return ResponseEntity.ok(sessionService.listForCourse(courseId).stream().map(sessionService::view).toList());
    }

    @GetMapping("/{courseId}/profiles")
    public ResponseEntity<List<CourseStudentProfile>> currentProfiles(@PathVariable String courseId) {
        courseService.get(courseId);
        return ResponseEntity.ok(profileStore.currentForCourse(courseId));
    }

    @GetMapping("/{courseId}/profiles/history")
    public ResponseEntity<List<CourseStudentProfile>> profileHistory(@PathVariable String courseId,
                                                                     @RequestParam(required = false) String studentId,
                                                                     @RequestParam(required = false) String guestId) {
        courseService.get(courseId);
        return ResponseEntity.ok(profileStore.history(courseId, new ParticipantIdentity(studentId, guestId)));
    }

    public record CreateCourseRequest(@NotBlank String title, String baselineSurveyId, @NotEmpty List<String> moodLabels) {}

    public record UpdateCourseRequest(String title, String baselineSurveyId) {}

    public record MoodLabelsRequest(@NotEmpty List<String> moodLabels) {}

    public record PatchMappingsRequest(@NotNull List<MappingInput> mappings) {}

    public record CreateSessionRequest(Boolean requireSurvey, String moodPrompt) {}
}
