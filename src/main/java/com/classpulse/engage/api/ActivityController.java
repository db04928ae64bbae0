package com.classpulse.engage.api;

import com.classpulse.engage.activity.ActivityService;
import com.classpulse.engage.domain.DomainModels.Activity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/activities")
public class ActivityController {
    private final ActivityService activityService;

    public ActivityController(ActivityService activityService) {
        this.activityService = activityService;
    }

    @PostMapping
    public ResponseEntity<Activity> create(@Valid @RequestBody CreateActivityRequest request) {
        Activity activity = activityService.create(request.name(), request.summary(), request.type(),
                request.tags(), request.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(activity);
    }

    @GetMapping
    public ResponseEntity<List<Activity>> list(@RequestParam(required = false) String tag,
                                               @RequestParam(required = false) String type) {
        return ResponseEntity.ok(activityService.list(tag, type));
    }

    @GetMapping("/{activityId}")
    public ResponseEntity<Activity> get(@PathVariable String activityId) {
        return ResponseEntity.ok(activityService.get(activityId));
    }

    @PatchMapping("/{activityId}")
    public ResponseEntity<Activity> update(@PathVariable String activityId, @RequestBody UpdateActivityRequest request) {
        return ResponseEntity.ok(activityService.update(activityId, request.name(), request.summary(),
                request.tags(), request.content()));
    }

    public record CreateActivityRequest(@NotBlank String name,
                                        @NotBlank String summary,
                                        @NotBlank String type,
                                        List<String> tags,
                                        Map<String, Object> content) {}

    public record UpdateActivityRequest(String name, String summary, List<String> tags, Map<String, Object> content) {}
}
