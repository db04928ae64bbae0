package com.classpulse.engage.activity;

import com.classpulse.engage.domain.DomainModels.Activity;
import com.classpulse.engage.domain.DomainModels.ActivityType;
import com.classpulse.engage.error.ConflictException;
import com.classpulse.engage.error.DataIntegrityException;
import com.classpulse.engage.error.NotFoundException;
import com.classpulse.engage.error.ValidationException;
import com.classpulse.engage.error.ValidationIssue;
import com.classpulse.engage.repository.ActivityJdbcRepository;
import com.classpulse.engage.repository.ActivityTypeJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;

@Service
public class ActivityService {
    private static final Logger log = LoggerFactory.getLogger(ActivityService.class);

    private final ActivityJdbcRepository repository;
    private final ActivityTypeJdbcRepository typeRepository;

    public ActivityService(ActivityJdbcRepository repository, ActivityTypeJdbcRepository typeRepository) {
        this.repository = repository;
        this.typeRepository = typeRepository;
    }

    @Transactional
    public ActivityType createType(String typeName, String description, List<String> requiredFields,
                                   List<String> optionalFields, Map<String, Object> exampleContent) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (typeName == null || typeName.isBlank()) issues.add(new ValidationIssue("MISSING_TYPE_NAME", "Type name is required", "typeName"));
        if (description == null || description.isBlank()) issues.add(new ValidationIssue("MISSING_DESCRIPTION", "Type description is required", "description"));
        List<String> required = fieldNames(requiredFields, "requiredFields", issues);
        List<String> optional = fieldNames(optionalFields, "optionalFields", issues);
        if (!issues.isEmpty()) {
            throw new ValidationException(issues);
        }

        String name = typeName.trim();
        if (typeRepository.existsByName(name)) {
            throw new ConflictException("ACTIVITY_TYPE_EXISTS", "Activity type already exists: " + name);
        }
        Instant now = Instant.now();
        ActivityType type = new ActivityType(name, description.trim(), required, optional,
                exampleContent == null ? Map.of() : exampleContent, now, now);
        typeRepository.insert(type);
        log.info("Created activity type '{}' requiring {}", name, required);
        return type;
    }

    public List<ActivityType> listTypes() {
        return typeRepository.findAll();
    }

    @Transactional
    public Activity create(String name, String summary, String type, List<String> tags, Map<String, Object> content) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (name == null || name.isBlank()) issues.add(new ValidationIssue("MISSING_NAME", "Activity name is required", "name"));
        if (summary == null || summary.isBlank()) issues.add(new ValidationIssue("MISSING_SUMMARY", "Activity summary is required", "summary"));
        Map<String, Object> body = content == null ? Map.of() : content;
        if (type == null || type.isBlank()) {
            issues.add(new ValidationIssue("MISSING_TYPE", "Activity type is required", "type"));
        } else {
            Optional<ActivityType> activityType = typeRepository.findByName(type.trim());
            if (activityType.isEmpty()) {
                issues.add(new ValidationIssue("ACTIVITY_TYPE_NOT_FOUND", "Unknown activity type: " + type.trim(), "type"));
            } else {
                issues.addAll(missingFields(activityType.get(), body));
            }
        }
        if (!issues.isEmpty()) {
            throw new ValidationException(issues);
        }

        Instant now = Instant.now();
        Activity activity = new Activity(UUID.randomUUID().toString(), name.trim(), summary.trim(), type.trim(),
                tags == null ? List.of() : List.copyOf(tags), body, now, now);
        repository.insert(activity);
        log.info("Created activity {} '{}' of type {}", activity.id(), activity.name(), activity.type());
        return activity;
    }

    @Transactional
    public Activity update(String activityId, String name, String summary, List<String> tags, Map<String, Object> content) {
        Activity activity = get(activityId);
        List<ValidationIssue> issues = new ArrayList<>();
        if (name != null && name.isBlank()) issues.add(new ValidationIssue("MISSING_NAME", "Activity name cannot be blank", "name"));
        if (summary != null && summary.isBlank()) issues.add(new ValidationIssue("MISSING_SUMMARY", "Activity summary cannot be blank", "summary"));
        if (content != null) {
            ActivityType type = typeRepository.findByName(activity.type())
                    .orElseThrow(() -> new DataIntegrityException("ACTIVITY_TYPE_MISSING",
                            "Activity " + activityId + " refers to missing type " + activity.type()));
            issues.addAll(missingFields(type, content));
        }
        if (!issues.isEmpty()) {
            throw new ValidationException(issues);
        }

        Activity updated = new Activity(activity.id(),
                name == null ? activity.name() : name.trim(),
                summary == null ? activity.summary() : summary.trim(),
                activity.type(),
                tags == null ? activity.tags() : List.copyOf(tags),
                content == null ? activity.content() : content,
                activity.createdAt(), Instant.now());
        repository.update(updated);
        log.info("Updated activity {}", activityId);
        return updated;
    }

    public Activity get(String activityId) {
        return repository.findById(activityId)
                .orElseThrow(() -> new NotFoundException("ACTIVITY_NOT_FOUND", "Activity not found: " + activityId));
    }

    public List<Activity> list(String tag, String type) {
        List<Activity> activities = type == null || type.isBlank() ? repository.findAll() : repository.findByType(type.trim());
        if (tag == null || tag.isBlank()) {
            return activities;
        }
        return activities.stream().filter(a -> a.tags().contains(tag.trim())).toList();
    }

    private static List<ValidationIssue> missingFields(ActivityType type, Map<String, Object> content) {
        return type.requiredFields().stream()
                .filter(field -> !content.containsKey(field))
                .map(field -> new ValidationIssue("MISSING_REQUIRED_FIELDS",
                        "Content for type " + type.typeName() + " is missing field: " + field, field))
                .toList();
    }

    private static List<String> fieldNames(List<String> fields, String ref, List<ValidationIssue> issues) {
        if (fields == null) return List.of();
        Set<String> names = new LinkedHashSet<>();
        for (String field : fields) {
            if (field == null || field.isBlank()) {
                issues.add(new ValidationIssue("BLANK_FIELD_NAME", "Field names cannot be blank", ref));
            } else {
                names.add(field.trim());
            }
        }
        return List.copyOf(names);
    }
}
