package com.di.adbatch.expand;

import com.di.adbatch.model.CampaignSet;
import com.di.adbatch.model.CampaignSettings;
import com.di.adbatch.model.Creative;
import com.di.adbatch.model.Keyword;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks the content of one enabled campaign set: name, budget and bidding
 * settings, and creative source. Variant structure is checked by
 * {@link WorkItemExpander}.
 *
 * <p>Errors make the whole input unusable. Warnings are logged and do not stop the run.
 */
@Slf4j
@Component
public class CampaignSetValidator {

    static final int MAX_NAME_LENGTH    = 64;
    static final int MAX_KEYWORD_LENGTH = 50;

    private static final Set<String> GENDERS = Set.of("male", "female", "all");

    /**
     * @return error messages, prefixed with the set's position and name; empty when valid
     */
    public List<String> validate(CampaignSet set, int position) {
        String prefix = "Campaign " + position + " ('" + set.getName() + "')";
        List<String> errors   = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String name = set.getName();
        if (name == null || name.isBlank() || name.length() > MAX_NAME_LENGTH) {
            errors.add(prefix + ": group name must be 1-" + MAX_NAME_LENGTH + " characters");
        }

        validateSettings(set.getSettings(), prefix, errors, warnings);
        validateCreatives(set, prefix, errors);

        warnings.forEach(w -> log.warn("[DEFINITION] {}", w));
        return errors;
    }

    private void validateSettings(CampaignSettings s, String prefix, List<String> errors, List<String> warnings) {
        if (s == null) {
            errors.add(prefix + ": settings are missing");
            return;
        }
        if (s.getTargetCpa() <= 0) {
            errors.add(prefix + ": target CPA must be positive (got " + s.getTargetCpa() + ")");
        }
        if (s.getPerSourceTestBudget() <= 0) {
            errors.add(prefix + ": per-source test budget must be positive");
        }
        if (s.getMaxBid() <= 0) {
            errors.add(prefix + ": max bid must be positive");
        } else if (s.getTargetCpa() > 0 && s.getMaxBid() > s.getTargetCpa()) {
            warnings.add(prefix + ": max bid (" + s.getMaxBid() + ") is higher than target CPA ("
                    + s.getTargetCpa() + ")");
        }
        if (s.getFrequencyCap() < 1 || s.getFrequencyCap() > 99) {
            errors.add(prefix + ": frequency cap must be between 1 and 99");
        }
        if (s.getMaxDailyBudget() <= 0) {
            errors.add(prefix + ": max daily budget must be positive");
        } else if (s.getMaxDailyBudget() < s.getPerSourceTestBudget()) {
            warnings.add(prefix + ": max daily budget (" + s.getMaxDailyBudget()
                    + ") is less than per-source test budget (" + s.getPerSourceTestBudget() + ")");
        }
        if (s.getGender() == null || !GENDERS.contains(s.getGender().toLowerCase())) {
            errors.add(prefix + ": invalid gender '" + s.getGender() + "', must be male, female or all");
        }
        if (s.getGeo() == null || s.getGeo().isEmpty()) {
            warnings.add(prefix + ": no geo given, the template default applies");
        }
        if (s.getKeywords() == null || s.getKeywords().isEmpty()) {
            warnings.add(prefix + ": no keywords given");
        } else {
            for (Keyword kw : s.getKeywords()) {
                if (kw.getName() == null || kw.getName().isBlank()) {
                    errors.add(prefix + ": empty keyword found");
                } else if (kw.getName().length() > MAX_KEYWORD_LENGTH) {
                    warnings.add(prefix + ": keyword '" + kw.getName() + "' is very long (>"
                            + MAX_KEYWORD_LENGTH + " chars)");
                }
            }
        }
    }

    private void validateCreatives(CampaignSet set, String prefix, List<String> errors) {
        if (set.getCreativeSource() == null || !set.getCreativeSource().hasCreatives()) {
            errors.add(prefix + ": creative source is empty");
            return;
        }
        for (Creative c : set.getCreativeSource().getCreatives()) {
            if (c.getCreativeId() == null || c.getCreativeId().isBlank()) {
                errors.add(prefix + ": creative row '" + c.getAdName() + "' has no creative id");
            }
        }
    }
}
