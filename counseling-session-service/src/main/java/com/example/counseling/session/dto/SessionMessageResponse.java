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
public class SessionMessageResponse {
    private Long id;
    private String senderId;
    private String sender;
    private String message;
    private OffsetDateTime timestamp;
    private String messageType;
}
