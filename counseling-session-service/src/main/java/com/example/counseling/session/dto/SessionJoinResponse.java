package com.example.counseling.session.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to a join pre-check. Connecting to the room socket is what actually joins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionJoinResponse {
    private String roomId;
    private String sessionType;
    private String status;
    private String participantRole;
}
