package com.example.counseling.session.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionNotesResponse {
    private String roomId;
    private String notes;
}
