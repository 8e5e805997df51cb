package com.di.adbatch.validation;

import com.di.adbatch.config.AdBatchProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls rejected creative ids out of the free-text validation errors the remote
 * platform shows, e.g.
 * <pre>Creative IDs 77, 88 are not valid for this campaign type</pre>
 *
 * <p>Best effort: the text is not a contract. When no recognised sentence is found
 * the result is empty and the caller must treat the failure as unrecognised.
 * Never throws.
 */
@Slf4j
@Component
public class ValidationErrorExtractor {

    /** "creative(s) / id(s) ... not valid | invalid | incompatible | rejected | not allowed" */
    private static final Pattern RECOGNISED = Pattern.compile(
            "\\b(?:creatives?|ids?)\\b.*?\\b(?:not\\s+valid|invalid|incompatible|rejected|not\\s+allowed)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final Pattern numericToken;

    @Autowired
    public ValidationErrorExtractor(AdBatchProperties properties) {
        this(properties.getMinIdDigits());
    }

    public ValidationErrorExtractor(int minIdDigits) {
        if (minIdDigits < 1) {
            throw new IllegalArgumentException("minIdDigits must be >= 1, got " + minIdDigits);
        }
        this.numericToken = Pattern.compile("(?<!\\d)\\d{" + minIdDigits + ",}(?!\\d)");
    }

    /**
     * Returns the numeric ids mentioned from the first recognised error sentence onward,
     * in the order they appear.
     *
     * @param errorText remote error text, may be {@code null}
     * @return ids, possibly empty; never {@code null}
     */
    public Set<String> extractInvalidEntityIds(String errorText) {
        if (errorText == null || errorText.isBlank()) {
            return Collections.emptySet();
        }
        try {
            Matcher sentence = RECOGNISED.matcher(errorText);
            if (!sentence.find()) {
                log.debug("[RETRY] no recognised validation sentence in: {}", errorText);
                return Collections.emptySet();
            }
            Set<String> ids = new LinkedHashSet<>();
            Matcher token = numericToken.matcher(errorText);
            token.region(sentence.start(), errorText.length());
            while (token.find()) {
                ids.add(token.group());
            }
            return ids;
        } catch (RuntimeException e) {
            log.warn("[RETRY] could not parse validation error text: {}", e.getMessage());
            return Collections.emptySet();
        }
    }
}
