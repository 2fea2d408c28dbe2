package com.grantradar.eventbus.stream;

import java.util.Map;

/**
 * Contract for a stage consuming one stream.
 * Implementations are Spring beans discovered by StageWorkerOrchestrator.
 */
public interface StageProcessor {

    String streamKey();

    String consumerGroup();

    /**
     * Handles one record. Any exception other than a serialization error
     * sends the entry through the requeue / dead-letter flow.
     */
    void process(Map<String, String> fields) throws Exception;
}
