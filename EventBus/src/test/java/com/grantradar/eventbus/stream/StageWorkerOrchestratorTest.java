package com.grantradar.eventbus.stream;

import com.grantradar.eventbus.config.EventBusProperties;
import com.grantradar.eventbus.dto.ConsumeResult;
import com.grantradar.eventbus.dto.ProcessingOutcome;
import com.grantradar.eventbus.dto.StreamEntry;
import com.grantradar.eventbus.exception.EventSerializationException;
import com.grantradar.eventbus.service.ConsumerGroupCoordinator;
import com.grantradar.eventbus.service.EntryProcessor;
import com.grantradar.eventbus.service.RetryOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StageWorkerOrchestratorTest {

    private static final String STREAM = "grants:discovered";
    private static final String GROUP = "discovery-validators";

    @Mock private ConsumerGroupCoordinator coordinator;
    @Mock private RetryOrchestrator retryOrchestrator;
    @Mock private ObjectProvider<StageProcessor> processorProvider;
    @Mock private StageProcessor processor;

    private EventBusProperties properties;
    private StageWorkerOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new EventBusProperties();
        when(processorProvider.orderedStream()).thenReturn(Stream.of(processor));
        orchestrator = new StageWorkerOrchestrator(processorProvider, coordinator, retryOrchestrator, properties);
    }

    private static StreamEntry entry(String id) {
        return new StreamEntry(id, Map.of("payload", "{}"));
    }

    @Test
    @DisplayName("A poll claims stale entries before reading new ones")
    void pollClaimsThenConsumes() {
        when(processor.streamKey()).thenReturn(STREAM);
        when(processor.consumerGroup()).thenReturn(GROUP);
        when(coordinator.consumePending(STREAM, GROUP, "w1", 60_000, 10, 3)).thenReturn(List.of(entry("1-0")));
        when(coordinator.consume(STREAM, GROUP, "w1", 10, 5000))
                .thenReturn(ConsumeResult.delivered(List.of(entry("2-0"), entry("3-0"))));
        when(retryOrchestrator.processWithRetry(eq(STREAM), eq(GROUP), anyString(), anyMap(), any(EntryProcessor.class)))
                .thenReturn(ProcessingOutcome.SUCCEEDED);

        int handled = orchestrator.pollOnce(processor, "w1");

        assertEquals(3, handled);
        InOrder order = inOrder(coordinator, retryOrchestrator);
        order.verify(coordinator).consumePending(STREAM, GROUP, "w1", 60_000, 10, 3);
        order.verify(retryOrchestrator).processWithRetry(eq(STREAM), eq(GROUP), eq("1-0"), anyMap(), any(EntryProcessor.class));
        order.verify(coordinator).consume(STREAM, GROUP, "w1", 10, 5000);
        order.verify(retryOrchestrator).processWithRetry(eq(STREAM), eq(GROUP), eq("2-0"), anyMap(), any(EntryProcessor.class));
        order.verify(retryOrchestrator).processWithRetry(eq(STREAM), eq(GROUP), eq("3-0"), anyMap(), any(EntryProcessor.class));
    }

    @Test
    @DisplayName("A recreated group yields an empty poll")
    void recreatedGroupYieldsNothing() {
        when(processor.streamKey()).thenReturn(STREAM);
        when(processor.consumerGroup()).thenReturn(GROUP);
        when(coordinator.consumePending(anyString(), anyString(), anyString(), anyLong(), anyInt(), anyInt())).thenReturn(List.of());
        when(coordinator.consume(anyString(), anyString(), anyString(), anyInt(), anyLong()))
                .thenReturn(ConsumeResult.groupRecreated());

        assertEquals(0, orchestrator.pollOnce(processor, "w1"));
        verify(retryOrchestrator, never()).processWithRetry(anyString(), anyString(), anyString(), anyMap(), any());
    }

    @Test
    @DisplayName("Serialization errors are logged and do not stop the poll")
    void serializationErrorsDoNotStopPoll() {
        when(processor.streamKey()).thenReturn(STREAM);
        when(processor.consumerGroup()).thenReturn(GROUP);
        when(coordinator.consumePending(anyString(), anyString(), anyString(), anyLong(), anyInt(), anyInt())).thenReturn(List.of());
        when(coordinator.consume(anyString(), anyString(), anyString(), anyInt(), anyLong()))
                .thenReturn(ConsumeResult.delivered(List.of(entry("1-0"), entry("2-0"))));
        when(retryOrchestrator.processWithRetry(eq(STREAM), eq(GROUP), eq("1-0"), anyMap(), any(EntryProcessor.class)))
                .thenThrow(new EventSerializationException("corrupt"));
        when(retryOrchestrator.processWithRetry(eq(STREAM), eq(GROUP), eq("2-0"), anyMap(), any(EntryProcessor.class)))
                .thenReturn(ProcessingOutcome.SUCCEEDED);

        assertEquals(2, orchestrator.pollOnce(processor, "w1"));
        verify(retryOrchestrator).processWithRetry(eq(STREAM), eq(GROUP), eq("2-0"), anyMap(), any(EntryProcessor.class));
    }

    @Test
    @DisplayName("Dead-letter entries are acknowledged on success and never requeued")
    void deadLettersBypassRetry() throws Exception {
        when(processor.streamKey()).thenReturn("dlq:grants:discovered");
        when(processor.consumerGroup()).thenReturn("dlq-handlers");
        when(coordinator.consumePending(anyString(), anyString(), anyString(), anyLong(), anyInt(), anyInt())).thenReturn(List.of());
        when(coordinator.consume(anyString(), anyString(), anyString(), anyInt(), anyLong()))
                .thenReturn(ConsumeResult.delivered(List.of(
                        entry("1-0"),
                        new StreamEntry("2-0", Map.of("payload", "{\"ok\":true}")))));
        lenient().doThrow(new IllegalStateException("log sink down")).when(processor).process(Map.of("payload", "{}"));

        orchestrator.pollOnce(processor, "w1");

        verify(coordinator).acknowledge("dlq:grants:discovered", "dlq-handlers", "2-0");
        verify(coordinator, never()).acknowledge("dlq:grants:discovered", "dlq-handlers", "1-0");
        verify(retryOrchestrator, never()).processWithRetry(anyString(), anyString(), anyString(), anyMap(), any());
    }

    @Test
    @DisplayName("Workers do not start when disabled")
    void disabledWorkersDoNotStart() {
        properties.getWorker().setEnabled(false);

        orchestrator.init();

        assertFalse(orchestrator.isRunning());
    }
}
