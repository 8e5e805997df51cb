package com.di.adbatch.remote;

/**
 * The external platform that creates and configures one campaign variant.
 *
 * <p>Calls are slow (minutes), stateful and unreliable. Expected outcomes, including
 * validation rejections, are returned as {@link ConfigureResult}; implementations
 * should only throw for conditions they cannot describe.
 */
public interface RemoteCampaignService {

    ConfigureResult configure(ConfigureRequest request);
}
