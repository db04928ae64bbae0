package com.classpulse.engage.domain;

import com.classpulse.engage.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Who submitted: an authenticated student or a guest, never both.
 */
public record ParticipantIdentity(String studentId, String guestId) {

    public ParticipantIdentity {
        boolean hasStudent = studentId != null && !studentId.isBlank();
        boolean hasGuest = guestId != null && !guestId.isBlank();
        if (hasStudent == hasGuest) {
            throw new ValidationException("INVALID_PARTICIPANT", "Exactly one of studentId or guestId must be provided");
        }
        studentId = hasStudent ? studentId.trim() : null;
        guestId = hasGuest ? guestId.trim() : null;
    }

    public static ParticipantIdentity student(String studentId) {
        return new ParticipantIdentity(studentId, null);
    }

    public static ParticipantIdentity guest(String guestId) {
        return new ParticipantIdentity(null, guestId);
    }

    @JsonIgnore
    public boolean isGuest() {
        return guestId != null;
    }

    /** Single-column form used for uniqueness constraints. */
    @JsonIgnore
    public String key() {
        return isGuest() ? "guest:" + guestId : "student:" + studentId;
    }
}
