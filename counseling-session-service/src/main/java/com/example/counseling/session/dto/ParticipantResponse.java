package com.example.counseling.session.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantResponse {
    private String userId;
    private String username;
    private String role;
    private OffsetDateTime joinedAt;
    private OffsetDateTime leftAt;
    private boolean connected;
}
