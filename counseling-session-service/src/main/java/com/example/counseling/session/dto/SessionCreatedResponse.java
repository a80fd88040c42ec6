package com.example.counseling.session.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCreatedResponse {
    private String roomId;
    private Long sessionId;
    private String status;
    private String meetingUrl;
    private boolean created;
}
