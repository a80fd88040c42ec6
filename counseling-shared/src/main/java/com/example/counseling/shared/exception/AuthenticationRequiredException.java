package com.example.counseling.shared.exception;

public class AuthenticationRequiredException extends CounselingClientException {
    public AuthenticationRequiredException(String message) {
        super(message);
    }
}
