package com.grantradar.eventbus.dto;

/**
 * Result of running one entry through the retry / dead-letter flow.
 */
public enum ProcessingOutcome {

    SUCCEEDED,
    /** Failed, appended again with an incremented retry count. */
    REQUEUED,
    /** Failed past the retry ceiling, moved to the dead-letter stream. */
    DEAD_LETTERED;

    public boolean isSuccess() {
        return this == SUCCEEDED;
    }
}
