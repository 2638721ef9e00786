package com.newsdesk.curation.util;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe token usage ledger for one pipeline run (one processing batch, one full update).
 *
 * <p>Create one instance per run and pass it down to whatever records usage; there is no process-wide
 * state, so concurrent runs for different users never mix their numbers.
 *
 * <p>Costs are approximate: built-in per-1K prices for known models, overridable with
 *   OPENAI_COST_&lt;MODEL&gt;_INPUT_PER_1K / _OUTPUT_PER_1K (chat) and _EMBED_PER_1K (embeddings),
 * where &lt;MODEL&gt; is the uppercased model name with non-alphanumerics replaced by '_'.
 */
public final class TokenAccounting {

    public static final class ModelUsage {
        final AtomicLong promptTokens = new AtomicLong();
        final AtomicLong completionTokens = new AtomicLong();
        final AtomicLong totalTokens = new AtomicLong();
        final AtomicLong calls = new AtomicLong();
        volatile boolean embedding;
    }

    public record UsageWithCost(String model, long calls, long promptTokens, long completionTokens,
                                long totalTokens, double costUsd) {
    }

    /** Per-1K prices. Providers publish per-1M prices; divide by 1000. */
    private record Price(double inputPer1k, double outputPer1k) {}

    private static final Map<String, Price> DEFAULT_PRICES = new LinkedHashMap<>();
    static {
        // Longest prefixes first: gpt-4o-mini must match before gpt-4o.
        DEFAULT_PRICES.put("gpt-4o-mini", new Price(0.00015, 0.00060));
        DEFAULT_PRICES.put("gpt-4o", new Price(0.0025, 0.010));
        DEFAULT_PRICES.put("gpt-4.1-mini", new Price(0.0004, 0.0016));
        DEFAULT_PRICES.put("text-embedding-3-large", new Price(0.00013, 0.0));
        DEFAULT_PRICES.put("text-embedding-3-small", new Price(0.00002, 0.0));
    }

    private final ConcurrentHashMap<String, ModelUsage> usage = new ConcurrentHashMap<>();

    public void recordChatCompletionUsage(String model, long prompt, long completion, long total) {
        ModelUsage mu = usage.computeIfAbsent(normalize(model), m -> new ModelUsage());
        mu.calls.incrementAndGet();
        if (prompt > 0) mu.promptTokens.addAndGet(prompt);
        if (completion > 0) mu.completionTokens.addAndGet(completion);
        mu.totalTokens.addAndGet(total > 0 ? total : Math.max(0, prompt) + Math.max(0, completion));
    }

    public void recordEmbeddingUsage(String model, long promptTokens) {
        ModelUsage mu = usage.computeIfAbsent(normalize(model), m -> new ModelUsage());
        mu.embedding = true;
        mu.calls.incrementAndGet();
        if (promptTokens > 0) {
            mu.promptTokens.addAndGet(promptTokens);
            mu.totalTokens.addAndGet(promptTokens);
        }
    }

    /** Folds another run's usage into this one (a full update absorbs its processing batch). */
    public void addAll(TokenAccounting other) {
        if (other == null || other == this) return;
        other.usage.forEach((model, src) -> {
            ModelUsage dst = usage.computeIfAbsent(model, m -> new ModelUsage());
            dst.embedding = dst.embedding || src.embedding;
            dst.calls.addAndGet(src.calls.get());
            dst.promptTokens.addAndGet(src.promptTokens.get());
            dst.completionTokens.addAndGet(src.completionTokens.get());
            dst.totalTokens.addAndGet(src.totalTokens.get());
        });
    }

    public long totalTokens() {
        long sum = 0L;
        for (ModelUsage mu : usage.values()) sum += mu.totalTokens.get();
        return sum;
    }

    /** Model name to usage, sorted by model for stable reports. */
    public Map<String, UsageWithCost> snapshotWithCosts() {
        Map<String, UsageWithCost> out = new TreeMap<>();
        usage.forEach((model, mu) -> {
            long p = mu.promptTokens.get();
            long c = mu.completionTokens.get();
            double cost = estimateCostUsd(model, mu.embedding, p, c);
            out.put(model, new UsageWithCost(model, mu.calls.get(), p, c, mu.totalTokens.get(), roundMoney(cost)));
        });
        return out;
    }

    public static double totalCostUsd(Map<String, UsageWithCost> snapshot) {
        if (snapshot == null || snapshot.isEmpty()) return 0.0;
        double sum = 0.0;
        for (UsageWithCost u : snapshot.values()) sum += u.costUsd();
        return roundMoney(sum);
    }

    /** Report shape: model -> { calls, prompt_tokens, completion_tokens, total_tokens, cost_usd }. */
    public Map<String, Map<String, Object>> toReport() {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        snapshotWithCosts().forEach((model, u) -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("calls", u.calls());
            m.put("prompt_tokens", u.promptTokens());
            m.put("completion_tokens", u.completionTokens());
            m.put("total_tokens", u.totalTokens());
            m.put("cost_usd", u.costUsd());
            out.put(model, m);
        });
        return out;
    }

    static double estimateCostUsd(String model, boolean embedding, long promptTokens, long completionTokens) {
        String key = toEnvKey(model);
        Double inPer1k = getEnvDouble("OPENAI_COST_" + key + (embedding ? "_EMBED_PER_1K" : "_INPUT_PER_1K"));
        Double outPer1k = embedding ? Double.valueOf(0.0) : getEnvDouble("OPENAI_COST_" + key + "_OUTPUT_PER_1K");
        if (inPer1k == null || outPer1k == null) {
            Price price = defaultPrice(model);
            if (inPer1k == null) inPer1k = price.inputPer1k();
            if (outPer1k == null) outPer1k = price.outputPer1k();
        }
        return (promptTokens / 1000.0) * inPer1k + (completionTokens / 1000.0) * outPer1k;
    }

    private static Price defaultPrice(String model) {
        String m = model.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Price> e : DEFAULT_PRICES.entrySet()) {
            if (m.startsWith(e.getKey())) return e.getValue();
        }
        // Unknown model: free unless overridden by env
        return new Price(0.0, 0.0);
    }

    private static String normalize(String model) {
        return model == null || model.isBlank() ? "unknown" : model;
    }

    private static String toEnvKey(String model) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < model.length(); i++) {
            char ch = model.charAt(i);
            sb.append(Character.isLetterOrDigit(ch) ? Character.toUpperCase(ch) : '_');
        }
        return sb.toString();
    }

    private static Double getEnvDouble(String name) {
        String v = System.getenv(name);
        if (v == null || v.isBlank()) return null;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static double roundMoney(double v) {
        return Math.round(v * 10000.0) / 10000.0;
    }
}
