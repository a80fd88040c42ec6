package com.example.counseling.shared.exception;

public class FrameValidationException extends CounselingClientException {
    public FrameValidationException(String message) {
        super(message);
    }
}
