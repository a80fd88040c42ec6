package com.example.counseling.shared.exception;

/**
 * A room, session or notification does not exist (or is not visible to the caller).
 */
public class ResourceNotFoundException extends CounselingClientException {
    public ResourceNotFoundException(String message) {
        super(message);
    }
}
