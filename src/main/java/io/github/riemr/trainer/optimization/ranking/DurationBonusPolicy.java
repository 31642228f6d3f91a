package io.github.riemr.trainer.optimization.ranking;

/**
 * How the trainer's "prioritize high-value sessions" flag affects the duration bonus.
 */
public enum DurationBonusPolicy {
    /** Bonus applies when the flag is on, or when the trainer never set it. */
    PREFERENCE_GATED,
    /** Bonus always applies. */
    ALWAYS
}
