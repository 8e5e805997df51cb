package com.di.adbatch.remote;

/**
 * Opens one {@link RemoteCampaignSession} per worker.
 */
public interface RemoteCampaignSessionFactory {

    /** Short name shown in logs and reports, e.g. {@code dry-run}. */
    String mode();

    RemoteCampaignSession openSession(int workerId);
}
