package com.di.adbatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Keyword {

    public enum MatchType {
        @JsonProperty("broad") BROAD,
        @JsonProperty("exact") EXACT
    }

    private String    name;

    @Builder.Default
    private MatchType matchType = MatchType.BROAD;
}
