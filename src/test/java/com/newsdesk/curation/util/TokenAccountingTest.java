package com.newsdesk.curation.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cost estimation defaults use per-1K token prices converted from per-1M provider pricing.
 */
class TokenAccountingTest {

    @Test
    void gpt4oMini_pricing_is_per_1k_converted_from_per_1m() {
        // Given: a day of enrichment traffic
        long prompt = 3_277_125L;
        long completion = 1_981_907L;
        TokenAccounting acct = new TokenAccounting();
        acct.recordChatCompletionUsage("gpt-4o-mini-2024-07-18", prompt, completion, prompt + completion);

        TokenAccounting.UsageWithCost usage = acct.snapshotWithCosts().get("gpt-4o-mini-2024-07-18");
        assertNotNull(usage);
        double expected = (prompt / 1000.0) * 0.00015 + (completion / 1000.0) * 0.00060;
        assertEquals(expected, usage.costUsd(), 0.0001);
        assertEquals(1.68, usage.costUsd(), 0.01, "Should be about $1.68 for the given usage");
    }

    @Test
    void embeddings_are_priced_on_input_only() {
        TokenAccounting acct = new TokenAccounting();
        acct.recordEmbeddingUsage("text-embedding-3-small", 1_000_000L);

        TokenAccounting.UsageWithCost usage = acct.snapshotWithCosts().get("text-embedding-3-small");
        assertEquals(1, usage.calls());
        assertEquals(0.02, usage.costUsd(), 0.0001);
    }

    @Test
    void report_and_merge_keep_per_model_totals() {
        TokenAccounting batch = new TokenAccounting();
        batch.recordChatCompletionUsage("gpt-4o-mini", 100, 50, 150);
        batch.recordChatCompletionUsage("gpt-4o-mini", 200, 25, 0);
        batch.recordEmbeddingUsage("text-embedding-3-small", 10);

        TokenAccounting run = new TokenAccounting();
        run.addAll(batch);
        run.addAll(batch);

        Map<String, Map<String, Object>> report = run.toReport();
        assertEquals(4L, report.get("gpt-4o-mini").get("calls"));
        assertEquals(750L, report.get("gpt-4o-mini").get("total_tokens"));
        assertEquals(20L, report.get("text-embedding-3-small").get("prompt_tokens"));
        assertEquals(770L, run.totalTokens());
    }

    @Test
    void unknown_models_cost_nothing() {
        TokenAccounting acct = new TokenAccounting();
        acct.recordChatCompletionUsage("local-llama", 1000, 1000, 2000);
        assertEquals(0.0, TokenAccounting.totalCostUsd(acct.snapshotWithCosts()));
    }
}
