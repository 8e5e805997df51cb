package com.di.adbatch.exception;

/**
 * A checkpoint could not be written or removed. Without a durable checkpoint the
 * run can no longer be resumed safely, so this aborts the run.
 */
public class CheckpointException extends RuntimeException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
