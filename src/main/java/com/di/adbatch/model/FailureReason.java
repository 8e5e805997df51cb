package com.di.adbatch.model;

/**
 * Why a variant task ended {@link TaskStatus#FAILED}.
 */
public enum FailureReason {

    /** Remote rejected creatives that are not part of the current creative source. */
    VALIDATION_FAILURE,
    /** Remote still rejected creatives after every cleaning pass was used. */
    VALIDATION_RETRY_EXHAUSTED,
    /** Remote reported a validation error but no identifiers could be extracted. */
    UNRECOGNISED_VALIDATION_ERROR,
    /** Nothing left to upload once rejected creatives were stripped, or the remote created zero ads. */
    NO_ARTIFACTS_REMAINING,
    /** The predecessor variant did not succeed; no remote call was made. */
    PREDECESSOR_FAILED,
    /** Transport, timeout, authentication or any unexpected remote error. Not retried. */
    FATAL_FAILURE
}
