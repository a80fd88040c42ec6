package com.example.counseling.shared.exception;

public class SessionAccessDeniedException extends CounselingClientException {
    public SessionAccessDeniedException(String message) {
        super(message);
    }
}
