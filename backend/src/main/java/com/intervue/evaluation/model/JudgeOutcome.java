package com.intervue.evaluation.model;

/**
 * How a judging attempt ended. Everything except {@link #JUDGED} is a degraded result.
 */
public enum JudgeOutcome {
    JUDGED,
    NO_CREDENTIAL,
    NETWORK_ERROR,
    UNPARSABLE_RESPONSE;

    public boolean isDegraded() {
        return this != JUDGED;
    }
}
