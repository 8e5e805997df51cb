package com.di.adbatch.expand;

import com.di.adbatch.exception.InvalidDefinitionException;
import com.di.adbatch.model.CampaignSet;
import com.di.adbatch.model.VariantKind;
import com.di.adbatch.model.VariantTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Expands campaign sets into the ordered list of variant tasks the orchestrator runs.
 *
 * <p>Rules:
 * <ul>
 *   <li>disabled sets produce no tasks;</li>
 *   <li>one task per requested variant, in input order;</li>
 *   <li>{@code android} always has an {@code ios} task of the same set listed before it,
 *       added when the input omitted it;</li>
 *   <li>{@code desktop} and {@code ios} keep their input order.</li>
 * </ul>
 *
 * <p>No I/O and no randomness: the same input always yields the same task list, which is
 * what lets a resumed run line its tasks up with a checkpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkItemExpander {

    private final CampaignSetValidator validator;

    /**
     * @throws InvalidDefinitionException listing every problem found, before any task is built
     */
    public List<VariantTask> expand(List<CampaignSet> campaignSets) {
        List<String> problems = new ArrayList<>();
        List<List<VariantKind>> ordered = new ArrayList<>();
        Set<String> seenNames = new HashSet<>();

        int position = 0;
        for (CampaignSet set : campaignSets) {
            position++;
            if (!set.isEnabled()) {
                ordered.add(List.of());
                continue;
            }
            problems.addAll(validator.validate(set, position));
            if (set.getName() != null && !seenNames.add(set.getName())) {
                problems.add("Campaign " + position + " ('" + set.getName() + "'): duplicate campaign set name");
            }
            ordered.add(orderVariants(set, position, problems));
        }

        if (!problems.isEmpty()) {
            throw new InvalidDefinitionException(problems);
        }

        List<VariantTask> tasks = new ArrayList<>();
        for (int i = 0; i < campaignSets.size(); i++) {
            CampaignSet set = campaignSets.get(i);
            for (VariantKind variant : ordered.get(i)) {
                tasks.add(new VariantTask(set, variant));
            }
        }
        log.info("[EXPAND] {} campaign sets ({} enabled) → {} variant tasks",
                 campaignSets.size(),
                 campaignSets.stream().filter(CampaignSet::isEnabled).count(),
                 tasks.size());
        return tasks;
    }

    private List<VariantKind> orderVariants(CampaignSet set, int position, List<String> problems) {
        String prefix = "Campaign " + position + " ('" + set.getName() + "')";
        List<String> raw = set.getVariants() == null ? List.of() : set.getVariants();
        if (raw.isEmpty()) {
            problems.add(prefix + ": no variants specified");
            return List.of();
        }

        List<VariantKind> requested = new ArrayList<>();
        for (String name : raw) {
            Optional<VariantKind> kind = VariantKind.fromName(name);
            if (kind.isEmpty()) {
                problems.add(prefix + ": invalid variant '" + name + "', must be desktop, ios, android or all_mobile");
            } else if (requested.contains(kind.get())) {
                problems.add(prefix + ": duplicate variant '" + kind.get().wireName() + "'");
            } else {
                requested.add(kind.get());
            }
        }

        List<VariantKind> out = new ArrayList<>(requested.size() + 1);
        Set<VariantKind> emitted = EnumSet.noneOf(VariantKind.class);
        for (VariantKind kind : requested) {
            if (emitted.contains(kind)) {
                continue;
            }
            Optional<VariantKind> predecessor = kind.predecessor();
            if (predecessor.isPresent() && emitted.add(predecessor.get())) {
                if (!requested.contains(predecessor.get())) {
                    log.info("[EXPAND] '{}': adding {} task required by {}",
                             set.getName(), predecessor.get(), kind);
                }
                out.add(predecessor.get());
            }
            emitted.add(kind);
            out.add(kind);
        }
        return out;
    }
}
