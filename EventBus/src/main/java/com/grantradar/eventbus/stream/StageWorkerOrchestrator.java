package com.grantradar.eventbus.stream;

import com.grantradar.eventbus.config.EventBusProperties;
import com.grantradar.eventbus.dto.ConsumeResult;
import com.grantradar.eventbus.dto.ProcessingOutcome;
import com.grantradar.eventbus.dto.StreamEntry;
import com.grantradar.eventbus.exception.EventSerializationException;
import com.grantradar.eventbus.service.ConsumerGroupCoordinator;
import com.grantradar.eventbus.service.RetryOrchestrator;
import com.grantradar.eventbus.topology.StreamNames;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.DependsOn;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Auto-discovers StageProcessor beans and runs consumer loops for each one.
 *
 * Each poll first claims entries abandoned by crashed consumers, then reads
 * new entries, and runs every entry through the retry / dead-letter flow.
 * Entries that keep failing outside that flow (malformed records, dead-letter
 * handler errors) are claimed until they reach the delivery ceiling and then
 * stay pending for inspection.
 *
 * Starts after the bus lifecycle, so the connection is set up before the
 * loops run and closed only after they stop.
 */
@Component
@DependsOn("eventBusLifecycle")
@Slf4j
public class StageWorkerOrchestrator {

    private final List<StageProcessor> processors;
    private final ConsumerGroupCoordinator coordinator;
    private final RetryOrchestrator retryOrchestrator;
    private final EventBusProperties properties;

    private final List<ExecutorService> executors = new ArrayList<>();
    private volatile boolean running;

    public StageWorkerOrchestrator(ObjectProvider<StageProcessor> processors,
                                   ConsumerGroupCoordinator coordinator,
                                   RetryOrchestrator retryOrchestrator,
                                   EventBusProperties properties) {
        this.processors = processors.orderedStream().toList();
        this.coordinator = coordinator;
        this.retryOrchestrator = retryOrchestrator;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        if (!properties.getWorker().isEnabled()) {
            log.info("Stage workers disabled");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (running) {
            log.warn("Stage workers already running");
            return;
        }
        log.info("Discovered {} stage processor(s)", processors.size());
        running = true;

        int consumers = properties.getWorker().getConsumersPerStage();
        String hostName = getConsumerName();

        for (StageProcessor processor : processors) {
            AtomicInteger threadIndex = new AtomicInteger();
            ExecutorService executor = Executors.newFixedThreadPool(consumers, runnable -> {
                Thread thread = new Thread(runnable,
                        "stage-" + processor.streamKey() + "-" + threadIndex.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            executors.add(executor);

            for (int i = 1; i <= consumers; i++) {
                String consumerName = consumers == 1 ? hostName : hostName + "-" + i;
                executor.submit(() -> runLoop(processor, consumerName));
            }
            log.info("Stage worker started: stream={}, group={}, consumers={}",
                    processor.streamKey(), processor.consumerGroup(), consumers);
        }
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Shutting down StageWorkerOrchestrator");
        running = false;

        long waitMs = properties.getWorker().getBlock().toMillis() + 1000;
        for (ExecutorService executor : executors) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
        executors.clear();
        log.info("StageWorkerOrchestrator shut down");
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop(StageProcessor processor, String consumerName) {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                pollOnce(processor, consumerName);
            } catch (DataAccessException e) {
                log.error("Broker error in worker: stream={}, consumer={}, error={}",
                        processor.streamKey(), consumerName, e.getMessage());
                sleep(properties.getWorker().getErrorBackoff().toMillis());
            } catch (RuntimeException e) {
                log.error("Unexpected error in worker: stream={}, consumer={}, error={}",
                        processor.streamKey(), consumerName, e.getMessage(), e);
                sleep(properties.getWorker().getErrorBackoff().toMillis());
            }
        }
    }

    /**
     * One claim-then-read cycle.
     *
     * @return number of entries handled
     */
    int pollOnce(StageProcessor processor, String consumerName) {
        EventBusProperties.WorkerProps worker = properties.getWorker();
        String stream = processor.streamKey();
        String group = processor.consumerGroup();

        List<StreamEntry> claimed = coordinator.consumePending(stream, group, consumerName,
                worker.getClaimMinIdle().toMillis(), worker.getClaimBatchSize(), worker.getClaimMaxDeliveries());
        for (StreamEntry entry : claimed) {
            handle(processor, entry);
        }

        ConsumeResult result = coordinator.consume(
                stream, group, consumerName, worker.getBatchSize(), worker.getBlock().toMillis());
        for (StreamEntry entry : result.getEntries()) {
            handle(processor, entry);
        }
        return claimed.size() + result.getEntries().size();
    }

    private void handle(StageProcessor processor, StreamEntry entry) {
        String stream = processor.streamKey();
        String group = processor.consumerGroup();

        if (StreamNames.isDeadLetterStream(stream)) {
            handleDeadLetter(processor, entry);
            return;
        }

        try {
            ProcessingOutcome outcome = retryOrchestrator.processWithRetry(
                    stream, group, entry.getMessageId(), entry.getFields(), processor::process);
            log.debug("Processed message: stream={}, messageId={}, outcome={}",
                    stream, entry.getMessageId(), outcome);
        } catch (EventSerializationException e) {
            // Stays pending; claimed again only below the delivery ceiling
            log.error("Unreadable message: stream={}, messageId={}, error={}",
                    stream, entry.getMessageId(), e.getMessage());
        }
    }

    /**
     * Dead letters are never requeued: success acknowledges, failure leaves the entry pending.
     */
    private void handleDeadLetter(StageProcessor processor, StreamEntry entry) {
        try {
            processor.process(entry.getFields());
            coordinator.acknowledge(processor.streamKey(), processor.consumerGroup(), entry.getMessageId());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Error handling dead letter: stream={}, messageId={}, error={}",
                    processor.streamKey(), entry.getMessageId(), e.getMessage());
        }
    }

    private String getConsumerName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.warn("Could not get hostname, using default consumer name");
            return "event-bus-consumer-" + System.currentTimeMillis();
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Worker backoff interrupted");
        }
    }
}
