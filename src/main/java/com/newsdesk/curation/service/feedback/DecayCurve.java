package com.newsdesk.curation.service.feedback;

/**
 * Suppression factor f(similarity) applied to relevance when an article resembles a downvoted one.
 * Every curve is monotonically non-increasing in similarity and stays within [0, 1].
 */
public enum DecayCurve {
    /** f(s) = 1 - s. At s = 0.9 an article keeps a tenth of its score. */
    COMPLEMENT {
        @Override
        double raw(double similarity, double threshold, double strength) {
            return 1.0 - similarity;
        }
    },
    /** f(s) = (1 - s)^2, harsher for close matches. */
    SQUARED_COMPLEMENT {
        @Override
        double raw(double similarity, double threshold, double strength) {
            double c = 1.0 - similarity;
            return c * c;
        }
    },
    /**
     * Linear from 1 at the threshold to {@code 1 - strength} at s = 1, so scores do not jump at the threshold.
     */
    RAMP {
        @Override
        double raw(double similarity, double threshold, double strength) {
            if (threshold >= 1.0) return 1.0;
            double position = (similarity - threshold) / (1.0 - threshold);
            return 1.0 - strength * Math.max(0.0, position);
        }
    };

    abstract double raw(double similarity, double threshold, double strength);

    public double factor(double similarity, double threshold, double strength) {
        double f = raw(Math.min(1.0, Math.max(0.0, similarity)), threshold, strength);
        return Math.min(1.0, Math.max(0.0, f));
    }
}
