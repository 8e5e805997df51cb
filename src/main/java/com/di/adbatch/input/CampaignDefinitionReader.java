package com.di.adbatch.input;

import com.di.adbatch.exception.InvalidDefinitionException;
import com.di.adbatch.model.CampaignSet;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the campaign table: a JSON array of campaign sets.
 *
 * <pre>
 * [ { "name": "Milfs", "variants": ["desktop", "ios", "android"],
 *     "settings": { "targetCpa": 50, "geo": ["US"], "keywords": [{"name": "milf", "matchType": "broad"}] },
 *     "creativeSource": { "reference": "milfs.csv",
 *                         "creatives": [{"creativeId": "77", "adName": "A1", "targetUrl": "https://..."}] } } ]
 * </pre>
 *
 * Only shape is checked here; content rules live in
 * {@link com.di.adbatch.expand.CampaignSetValidator}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CampaignDefinitionReader {

    private static final TypeReference<List<CampaignSet>> CAMPAIGN_SETS = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public List<CampaignSet> read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidDefinitionException(List.of("Input file not found: " + file));
        }
        try {
            List<CampaignSet> sets = objectMapper.readValue(file.toFile(), CAMPAIGN_SETS);
            if (sets == null) {
                throw new InvalidDefinitionException(List.of("Input file " + file + " holds no campaign sets"));
            }
            List<String> problems = new ArrayList<>();
            for (int i = 0; i < sets.size(); i++) {
                if (sets.get(i) == null) {
                    problems.add("Campaign " + (i + 1) + ": empty entry");
                }
            }
            if (!problems.isEmpty()) {
                throw new InvalidDefinitionException(problems);
            }
            log.info("[INPUT] {} campaign set(s) read from {}", sets.size(), file);
            return sets;
        } catch (JsonProcessingException e) {
            throw new InvalidDefinitionException("Input file " + file + " is not a valid campaign table: "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidDefinitionException("Input file " + file + " could not be read: " + e.getMessage(), e);
        }
    }
}
