package com.newsdesk.curation.service.feedback;

import com.newsdesk.curation.config.CurationProperties;
import com.newsdesk.curation.model.Article;
import com.newsdesk.curation.util.VectorMath;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;

/**
 * Pure read-time computation of adjusted relevance from downvote feedback. Nothing here writes;
 * removing a downvote simply drops it from the input and the original score comes back unchanged.
 */
@Component
public class ScoreAdjustmentEngine {
    static final int REASON_TITLE_CHARS = 60;

    private final CurationProperties props;

    public ScoreAdjustmentEngine(CurationProperties props) {
        this.props = props;
    }

    /**
     * @param downvoted downvoted articles within the feedback window; the target itself is ignored if present
     */
    public ScoreAdjustment adjust(Article target, Collection<Article> downvoted) {
        CurationProperties.Feedback cfg = props.getFeedback();
        return adjust(target, downvoted, cfg.getThreshold(), cfg.getDecayCurve(), cfg.getDecayStrength());
    }

    public static ScoreAdjustment adjust(Article target, Collection<Article> downvoted,
                                         double threshold, DecayCurve curve, double strength) {
        Double original = target.getRelevance_score();
        if (original == null || !target.hasEmbedding() || downvoted == null || downvoted.isEmpty()) {
            return ScoreAdjustment.unchanged(original, null, null, null);
        }

        Article trigger = null;
        double best = -1.0;
        for (Article d : downvoted) {
            if (d.getId() != null && d.getId().equals(target.getId())) continue;
            if (!d.hasEmbedding()) continue;
            double s = VectorMath.cosine(target.getTitle_embedding(), d.getTitle_embedding());
            if (s > best || (s == best && trigger != null && d.getId() != null && d.getId() < trigger.getId())) {
                best = s;
                trigger = d;
            }
        }
        if (trigger == null) {
            return ScoreAdjustment.unchanged(original, null, null, null);
        }
        if (best <= threshold) {
            return ScoreAdjustment.unchanged(original, best, trigger.getId(), trigger.displayTitle());
        }

        double adjusted = original * curve.factor(best, threshold, strength);
        return new ScoreAdjustment(original, adjusted, true, best, trigger.getId(), trigger.displayTitle(),
                reason(trigger.displayTitle(), best));
    }

    /** e.g. {@code Similar to downvoted: 'Central bank raises rates...' (similarity: 90%)}. */
    static String reason(String title, double similarity) {
        String t = title != null ? title : "";
        if (t.length() > REASON_TITLE_CHARS) t = t.substring(0, REASON_TITLE_CHARS) + "...";
        return String.format(Locale.ROOT, "Similar to downvoted: '%s' (similarity: %d%%)", t, Math.round(similarity * 100));
    }
}
