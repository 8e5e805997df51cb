package com.di.adbatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ad row of a creative source: the creative to upload and the ad it becomes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Creative {

    private String creativeId;
    private String adName;
    private String targetUrl;
}
