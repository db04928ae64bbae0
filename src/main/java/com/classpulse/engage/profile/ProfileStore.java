package com.classpulse.engage.profile;

import com.classpulse.engage.domain.DomainModels.CourseStudentProfile;
import com.classpulse.engage.domain.ParticipantIdentity;
import com.classpulse.engage.error.ConflictException;
import com.classpulse.engage.error.DataIntegrityException;
import com.classpulse.engage.repository.ProfileJdbcRepository;
import com.classpulse.engage.survey.SurveyModels.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class ProfileStore {
    private static final Logger log = LoggerFactory.getLogger(ProfileStore.class);

    private final ProfileJdbcRepository repository;

    public ProfileStore(ProfileJdbcRepository repository) {
        this.repository = repository;
    }

    @Transactional
    public CourseStudentProfile upsertProfile(String courseId, ParticipantIdentity participant,
                                              ScoreResult scoreResult, String submissionId) {
        int retired = repository.retireCurrent(courseId, participant);
        if (retired > 1) {
            log.error("Found {} current profiles for {} in course {}", retired, participant.key(), courseId);
            throw new DataIntegrityException("MULTIPLE_CURRENT_PROFILES",
                    "More than one current profile for " + participant.key() + " in course " + courseId);
        }

        CourseStudentProfile profile = new CourseStudentProfile(UUID.randomUUID().toString(), courseId, participant,
                scoreResult.dominantCategory(), scoreResult.totals(), submissionId, true, Instant.now());
        try {
            repository.insert(profile);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("CONCURRENT_PROFILE_UPDATE",
                    "Another baseline for " + participant.key() + " was stored concurrently", e);
        }

        log.info("Profile for {} in course {} is now '{}'{}", participant.key(), courseId,
                scoreResult.dominantLabel(), retired == 1 ? " (previous profile retired)" : "");
        return profile;
    }

    @Transactional(readOnly = true)
    public Optional<CourseStudentProfile> getCurrent(String courseId, ParticipantIdentity participant) {
        List<CourseStudentProfile> rows = repository.findCurrent(courseId, participant);
        if (rows.size() > 1) {
            log.error("Found {} current profiles for {} in course {}", rows.size(), participant.key(), courseId);
            throw new DataIntegrityException("MULTIPLE_CURRENT_PROFILES",
                    "More than one current profile for " + participant.key() + " in course " + courseId);
        }
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<CourseStudentProfile> currentForCourse(String courseId) {
        return repository.findCurrentForCourse(courseId);
    }

    /** All rows, current first, then newest first. */
    @Transactional(readOnly = true)
    public List<CourseStudentProfile> history(String courseId, ParticipantIdentity participant) {
        return repository.findHistory(courseId, participant);
    }
}
