package com.example.counseling.session.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionNotesRequest {
    @NotNull(message = "Notes are required")
    @Size(max = 4000, message = "Notes must be at most 4000 characters")
    private String notes;
}
