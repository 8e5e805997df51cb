package com.di.adbatch.expand;

import com.di.adbatch.TestCampaigns;
import com.di.adbatch.exception.InvalidDefinitionException;
import com.di.adbatch.model.CampaignSet;
import com.di.adbatch.model.TaskKey;
import com.di.adbatch.model.TaskStatus;
import com.di.adbatch.model.VariantKind;
import com.di.adbatch.model.VariantTask;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WorkItemExpander Tests")
class WorkItemExpanderTest {

    private final WorkItemExpander expander = new WorkItemExpander(new CampaignSetValidator());

    private static List<String> keys(List<VariantTask> tasks) {
        return tasks.stream().map(t -> t.getKey().asString()).toList();
    }

    // ============================================================================
    // Ordering
    // ============================================================================

    @Test
    @DisplayName("One PENDING task per variant, in input order")
    void testExpand_InputOrder() {
        List<VariantTask> tasks = expander.expand(List.of(
                TestCampaigns.set("A", "desktop", "ios", "android"),
                TestCampaigns.set("B", "all_mobile", "desktop")));

        assertEquals(List.of("A|desktop", "A|ios", "A|android", "B|all_mobile", "B|desktop"), keys(tasks));
        assertTrue(tasks.stream().allMatch(t -> t.getStatus() == TaskStatus.PENDING));
    }

    @Test
    @DisplayName("android without ios gets an ios task inserted before it")
    void testExpand_InsertsIos() {
        List<VariantTask> tasks = expander.expand(List.of(TestCampaigns.set("A", "android", "desktop")));
        assertEquals(List.of("A|ios", "A|android", "A|desktop"), keys(tasks));
    }

    @Test
    @DisplayName("android listed before ios is moved after it")
    void testExpand_ReordersIos() {
        List<VariantTask> tasks = expander.expand(List.of(TestCampaigns.set("A", "desktop", "android", "ios")));
        assertEquals(List.of("A|desktop", "A|ios", "A|android"), keys(tasks));
    }

    @Test
    @DisplayName("Disabled sets produce nothing and are not validated")
    void testExpand_DisabledSet() {
        CampaignSet disabled = TestCampaigns.set("Off", "tablet");
        disabled.setEnabled(false);
        List<VariantTask> tasks = expander.expand(List.of(disabled, TestCampaigns.set("On", "ios")));
        assertEquals(List.of("On|ios"), keys(tasks));
    }

    @Test
    @DisplayName("Expanding the same input twice yields the same keys")
    void testExpand_Idempotent() {
        List<CampaignSet> input = List.of(
                TestCampaigns.set("A", "android", "desktop"),
                TestCampaigns.set("B", "mobile"));
        assertEquals(keys(expander.expand(input)), keys(expander.expand(input)));
    }

    @Test
    @DisplayName("Tasks reference their campaign set")
    void testExpand_TaskFields() {
        CampaignSet set = TestCampaigns.set("A", "ios");
        VariantTask task = expander.expand(List.of(set)).get(0);
        assertSame(set, task.getCampaignSet());
        assertEquals(TaskKey.of("A", VariantKind.IOS), task.getKey());
    }

    // ============================================================================
    // Invalid definitions
    // ============================================================================

    @Test
    @DisplayName("Should collect every problem before failing")
    void testExpand_CollectsProblems() {
        CampaignSet noVariants = TestCampaigns.set("A");
        CampaignSet badVariant = TestCampaigns.set("B", "desktop", "tablet");
        CampaignSet duplicate  = TestCampaigns.set("C", "ios", "iOS");
        CampaignSet sameName   = TestCampaigns.set("A", "desktop");

        InvalidDefinitionException ex = assertThrows(InvalidDefinitionException.class,
                () -> expander.expand(List.of(noVariants, badVariant, duplicate, sameName)));

        assertEquals(4, ex.getProblems().size(), ex.getMessage());
        assertTrue(ex.getMessage().contains("no variants"));
        assertTrue(ex.getMessage().contains("invalid variant 'tablet'"));
        assertTrue(ex.getMessage().contains("duplicate variant 'ios'"));
        assertTrue(ex.getMessage().contains("duplicate campaign set name"));
    }

    @Test
    @DisplayName("Should reject a blank set name")
    void testExpand_BlankName() {
        CampaignSet blank = TestCampaigns.set("X", "desktop");
        blank.setName(" ");
        InvalidDefinitionException ex = assertThrows(InvalidDefinitionException.class,
                () -> expander.expand(List.of(blank)));
        assertTrue(ex.getMessage().contains("group name"));
    }
}
