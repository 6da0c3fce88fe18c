package com.smarttest.core.model;

import java.util.Map;

/**
 * Optional inputs to a transition.
 *
 * @param reason    free text recorded in the decision log
 * @param metadata  structured context recorded in the decision log
 * @param shardId   distinguishes otherwise identical events from parallel shards
 * @param errorType error classification used to pick the reason code of an ERROR transition
 */
public record TransitionOptions(
    String reason,
    Map<String, Object> metadata,
    String shardId,
    String errorType
) {

    public static TransitionOptions none() {
        return new TransitionOptions(null, null, null, null);
    }

    public static TransitionOptions withReason(String reason) {
        return new TransitionOptions(reason, null, null, null);
    }

    public static TransitionOptions error(String errorType, String reason) {
        return new TransitionOptions(reason, Map.of("errorType", errorType), null, errorType);
    }
}
