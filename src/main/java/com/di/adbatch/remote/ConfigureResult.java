package com.di.adbatch.remote;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of one {@link RemoteCampaignService#configure(ConfigureRequest)} call.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConfigureResult {

    public enum Outcome {
        SUCCESS,
        /** The platform rejected the request; the text may name the offending creatives. */
        VALIDATION_FAILURE,
        /** Anything else: session lost, timeout, unexpected page. Not retried. */
        FATAL_FAILURE
    }

    Outcome outcome;
    String  entityId;
    int     artifactsCount;
    String  errorText;

    public static ConfigureResult success(String entityId, int artifactsCount) {
        return new ConfigureResult(Outcome.SUCCESS, entityId, artifactsCount, null);
    }

    public static ConfigureResult validationFailure(String errorText) {
        return new ConfigureResult(Outcome.VALIDATION_FAILURE, null, 0, errorText);
    }

    public static ConfigureResult fatalFailure(String errorText) {
        return new ConfigureResult(Outcome.FATAL_FAILURE, null, 0, errorText);
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }
}
