package com.di.adbatch.model;

/**
 * Lifecycle of a {@link VariantTask}.
 *
 * <pre>Status flow: PENDING → IN_PROGRESS → SUCCEEDED | FAILED
 *              PENDING → SKIPPED</pre>
 *
 * Terminal states never transition again except through an explicit operator
 * override ({@link VariantTask#resetForRetry()}).
 */
public enum TaskStatus {

    PENDING,
    IN_PROGRESS,
    SUCCEEDED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return switch (this) {
            case SUCCEEDED, FAILED, SKIPPED -> true;
            case PENDING, IN_PROGRESS -> false;
        };
    }

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == IN_PROGRESS || next == SKIPPED;
            case IN_PROGRESS -> next == SUCCEEDED || next == FAILED;
            case SUCCEEDED, FAILED, SKIPPED -> false;
        };
    }
}
