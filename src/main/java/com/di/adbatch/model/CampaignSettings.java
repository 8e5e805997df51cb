package com.di.adbatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Targeting, budget and bidding settings shared by every variant of a campaign set.
 * Defaults match the platform's standard campaign template.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignSettings {

    // ---- bidding / budget --------------------------------------------------
    @Builder.Default private double        targetCpa          = 50.0;
    @Builder.Default private double        perSourceTestBudget = 200.0;
    @Builder.Default private double        maxBid             = 10.0;
    @Builder.Default private int           frequencyCap       = 2;
    @Builder.Default private double        maxDailyBudget     = 250.0;
    @Builder.Default private String        bidType            = "CPA";

    // ---- targeting ---------------------------------------------------------
    @Builder.Default private String        gender             = "male";
    @Builder.Default private List<String>  geo                = new ArrayList<>();
    @Builder.Default private List<Keyword> keywords           = new ArrayList<>();

    // ---- format ------------------------------------------------------------
    @Builder.Default private String        adFormat           = "NATIVE";
    @Builder.Default private String        campaignType       = "Standard";
}
