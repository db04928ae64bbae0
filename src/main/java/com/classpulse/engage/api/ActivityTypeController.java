package com.classpulse.engage.api;

import com.classpulse.engage.activity.ActivityService;
import com.classpulse.engage.domain.DomainModels.ActivityType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/activity-types")
public class ActivityTypeController {
    private final ActivityService activityService;

    public ActivityTypeController(ActivityService activityService) {
        this.activityService = activityService;
    }

    @GetMapping
    public ResponseEntity<List<ActivityType>> list() {
        return ResponseEntity.ok(activityService.listTypes());
    }

    @PostMapping
    public ResponseEntity<ActivityType> create(@Valid @RequestBody CreateActivityTypeRequest request) {
        ActivityType type = activityService.createType(request.typeName(), request.description(),
                request.requiredFields(), request.optionalFields(), request.exampleContent());
        return ResponseEntity.status(HttpStatus.CREATED).body(type);
    }

    public record CreateActivityTypeRequest(@NotBlank String typeName,
                                            @NotBlank String description,
                                            List<String> requiredFields,
                                            List<String> optionalFields,
                                            Map<String, Object> exampleContent) {}
}
