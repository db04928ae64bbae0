package com.classpulse.engage;

import com.classpulse.engage.activity.ActivityService;
import com.classpulse.engage.domain.DomainModels.Activity;
import com.classpulse.engage.domain.DomainModels.ActivityType;
import com.classpulse.engage.error.ConflictException;
import com.classpulse.engage.error.NotFoundException;
import com.classpulse.engage.error.ValidationException;
import com.classpulse.engage.error.ValidationIssue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ActivityServiceTest {
    @Autowired
    private ActivityService activityService;

    private ActivityType type(String... requiredFields) {
        return activityService.createType(TestFixtures.unique("discussion"), "Talk it through",
                List.of(requiredFields), List.of("notes"), Map.of("prompt", "What surprised you?"));
    }

    @Test
    void typeNamesAreUnique() {
        ActivityType type = type("prompt");

        ConflictException ex = assertThrows(ConflictException.class,
                () -> activityService.createType(type.typeName(), "Again", List.of(), List.of(), null));

        assertEquals("ACTIVITY_TYPE_EXISTS", ex.getCode());
        assertTrue(activityService.listTypes().stream().anyMatch(t -> t.typeName().equals(type.typeName())));
        assertEquals(List.of("prompt"), type.requiredFields());
    }

    @Test
    void contentMustCarryEveryRequiredField() {
        ActivityType type = type("prompt", "minutes");

        ValidationException ex = assertThrows(ValidationException.class,
                () -> activityService.create("Pair share", "Share with a partner", type.typeName(), null, Map.of("minutes", 5)));
        ValidationException none = assertThrows(ValidationException.class,
                () -> activityService.create("Pair share", "Share with a partner", type.typeName(), null, null));

        assertEquals("MISSING_REQUIRED_FIELDS", ex.getCode());
        assertEquals(List.of("prompt"), ex.getIssues().stream().map(ValidationIssue::ref).toList());
        assertEquals(2, none.getIssues().size());
    }

    @Test
    void unknownTypeIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> activityService.create("Pair share", "Share", TestFixtures.unique("missing"), null, Map.of()));

        assertEquals("ACTIVITY_TYPE_NOT_FOUND", ex.getCode());
        assertEquals("type", ex.getIssues().get(0).ref());
    }

    @Test
    void patchKeepsUntouchedFieldsAndChecksNewContent() {
        ActivityType type = type("prompt");
        Activity activity = activityService.create("Think pair share", "Think then share", type.typeName(),
                List.of("pairs"), Map.of("prompt", "Why?"));

        Activity renamed = activityService.update(activity.id(), "Think, pair, share", null, List.of("pairs", "warmup"), null);
        ValidationException ex = assertThrows(ValidationException.class,
                () -> activityService.update(activity.id(), null, null, null, Map.of("notes", "none")));

        assertEquals("Think, pair, share", renamed.name());
        assertEquals("Think then share", renamed.summary());
        assertEquals(Map.of("prompt", "Why?"), activityService.get(activity.id()).content());
        assertEquals(List.of("pairs", "warmup"), activityService.get(activity.id()).tags());
        assertEquals("MISSING_REQUIRED_FIELDS", ex.getCode());
        assertThrows(NotFoundException.class, () -> activityService.update("missing", "x", null, null, null));
    }

    @Test
    void listFiltersByTypeAndTag() {
        ActivityType type = type("prompt");
        String tag = TestFixtures.unique("tag");
        Activity tagged = activityService.create("Tagged", "Has the tag", type.typeName(), List.of(tag), Map.of("prompt", "a"));
        Activity plain = activityService.create("Plain", "No tag", type.typeName(), List.of(), Map.of("prompt", "b"));

        List<Activity> ofType = activityService.list(null, type.typeName());
        assertEquals(List.of(plain.id(), tagged.id()), ofType.stream().map(Activity::id).toList());
        assertEquals(List.of(tagged.id()), activityService.list(tag, null).stream().map(Activity::id).toList());
        assertTrue(activityService.list(tag, TestFixtures.unique("other")).isEmpty());
    }
}
