package com.di.adbatch.remote;

/**
 * A {@link RemoteCampaignService} bound to one logged-in session (one browser, one
 * API login). Each worker owns exactly one session and closes it when done.
 */
public interface RemoteCampaignSession extends RemoteCampaignService, AutoCloseable {

    @Override
    void close();
}
