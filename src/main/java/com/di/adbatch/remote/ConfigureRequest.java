package com.di.adbatch.remote;

import com.di.adbatch.model.CampaignSettings;
import com.di.adbatch.model.CreativeSource;
import com.di.adbatch.model.VariantKind;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the remote platform needs to create one variant.
 *
 * <p>{@code predecessorEntityId} is the campaign to clone from (the iOS campaign for
 * Android); {@code null} means clone from the variant's fixed template.
 */
@Value
@Builder
public class ConfigureRequest {

    String           campaignSetName;
    VariantKind      variant;
    String           predecessorEntityId;
    CampaignSettings settings;
    CreativeSource   creativeSource;
    String           testNumber;

    /** 1-based call number for this task in the current run. */
    int              attempt;
}
