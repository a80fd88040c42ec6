package com.example.counseling.session.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BulkUpdateResponse {
    private int updated;
    private long unreadCount;
}
