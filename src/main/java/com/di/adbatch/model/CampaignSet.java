package com.di.adbatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One logical advertising concept (a "group"): keywords, targeting and budget
 * settings, a creative source, and the device variants to create for it.
 *
 * <p>Variant names are kept as written in the input table; they are parsed and
 * checked by {@link com.di.adbatch.expand.WorkItemExpander}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignSet {

    private String           name;

    @Builder.Default
    private List<String>     variants = new ArrayList<>();

    @Builder.Default
    private CampaignSettings settings = new CampaignSettings();

    private CreativeSource   creativeSource;

    @Builder.Default
    private boolean          enabled  = true;

    /** Optional test number used by campaign naming (e.g. {@code 12} → {@code _T-12}). */
    private String           testNumber;
}
