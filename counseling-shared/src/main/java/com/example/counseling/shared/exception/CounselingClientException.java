package com.example.counseling.shared.exception;

/**
 * Base type for failures caused by the caller rather than the service.
 * They are reported back to the client and never close a connection on their own.
 */
public abstract class CounselingClientException extends RuntimeException {

    protected CounselingClientException(String message) {
        super(message);
    }
}
