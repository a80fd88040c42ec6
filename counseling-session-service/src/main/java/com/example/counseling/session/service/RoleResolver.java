package com.example.counseling.session.service;

import com.example.counseling.session.dto.AppointmentDetails;
import com.example.counseling.shared.model.LiveSession;
import com.example.counseling.shared.util.Constants.ParticipantRole;

/**
 * Maps a caller to their role in an appointment. Anyone who is neither party gets NONE.
 */
public final class RoleResolver {

    private RoleResolver() {}

    public static ParticipantRole resolveRole(LiveSession session, String userId) {
        return resolveRole(session.getStudentId(), session.getCounselorId(), userId);
    }

    public static ParticipantRole resolveRole(AppointmentDetails appointment, String userId) {
        return resolveRole(appointment.getStudentId(), appointment.getCounselorId(), userId);
    }

    static ParticipantRole resolveRole(String studentId, String counselorId, String userId) {
        if (userId == null) {
            return ParticipantRole.NONE;
        }
        if (userId.equals(studentId)) {
            return ParticipantRole.STUDENT;
        }
        if (userId.equals(counselorId)) {
            return ParticipantRole.COUNSELOR;
        }
        return ParticipantRole.NONE;
    }
}
