package com.example.counseling.shared.exception;

/**
 * The requested lifecycle action is not allowed from the session's current status.
 */
public class InvalidSessionStateException extends CounselingClientException {
    public InvalidSessionStateException(String message) {
        super(message);
    }
}
