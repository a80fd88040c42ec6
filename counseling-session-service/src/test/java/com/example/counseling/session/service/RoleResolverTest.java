package com.example.counseling.session.service;

import com.example.counseling.shared.model.LiveSession;
import com.example.counseling.shared.util.Constants.ParticipantRole;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RoleResolverTest {

    private final LiveSession session = LiveSession.builder()
            .studentId("student-1")
            .counselorId("counselor-1")
            .build();

    @Test
    void resolvesStudentAndCounselor() {
        assertEquals(ParticipantRole.STUDENT, RoleResolver.resolveRole(session, "student-1"));
        assertEquals(ParticipantRole.COUNSELOR, RoleResolver.resolveRole(session, "counselor-1"));
    }

    @Test
    void strangersAndMissingIdentityGetNone() {
        assertEquals(ParticipantRole.NONE, RoleResolver.resolveRole(session, "someone-else"));
        assertEquals(ParticipantRole.NONE, RoleResolver.resolveRole(session, null));
    }
}
