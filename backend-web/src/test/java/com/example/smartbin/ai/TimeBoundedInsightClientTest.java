package com.example.smartbin.ai;

import com.example.smartbin.exception.UpstreamUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class TimeBoundedInsightClientTest {

    @Mock
    private DelegatedInsightClient delegate;

    private TimeBoundedInsightClient client;

    @BeforeEach
    public void setUp() {
        client = new TimeBoundedInsightClient(delegate, Duration.ofMillis(200));
    }

    @AfterEach
    public void tearDown() {
        client.close();
    }

    @Test
    public void testPassesResultThrough() {
        DelegatedAnalysis analysis = new DelegatedAnalysis(List.of(), List.of(), "quiet");
        when(delegate.analyze(anyList())).thenReturn(analysis);

        assertSame(analysis, client.analyze(List.of()));
    }

    @Test
    public void testSlowCallTimesOut() {
        when(delegate.provider()).thenReturn("ollama");
        when(delegate.analyze(anyList())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return DelegatedAnalysis.empty();
        });

        UpstreamUnavailableException e = assertThrows(UpstreamUnavailableException.class, () -> client.analyze(List.of()));
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    public void testFailureIsWrapped() {
        when(delegate.provider()).thenReturn("openxai");
        when(delegate.analyze(anyList())).thenThrow(new IllegalStateException("bad payload"));

        UpstreamUnavailableException e = assertThrows(UpstreamUnavailableException.class, () -> client.analyze(List.of()));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    public void testUpstreamFailureIsRethrownAsIs() {
        UpstreamUnavailableException failure = new UpstreamUnavailableException("connection refused");
        when(delegate.analyze(anyList())).thenThrow(failure);

        assertSame(failure, assertThrows(UpstreamUnavailableException.class, () -> client.analyze(List.of())));
    }

    @Test
    public void testRefusesCallsWhileAbandonedWorkersAreBusy() {
        AtomicBoolean released = new AtomicBoolean();
        when(delegate.provider()).thenReturn("openxai");
        when(delegate.analyze(anyList())).thenAnswer(invocation -> {
            // a blocking HTTP read that does not react to interrupts
            while (!released.get()) {
                try {
                    Thread.sleep(20);
                } catch (InterruptedException ignored) {
                }
            }
            return DelegatedAnalysis.empty();
        });

        try {
            for (int i = 0; i < TimeBoundedInsightClient.MAX_CONCURRENT_CALLS; i++) {
                UpstreamUnavailableException e = assertThrows(UpstreamUnavailableException.class, () -> client.analyze(List.of()));
                assertTrue(e.getMessage().contains("timed out"));
            }
            UpstreamUnavailableException refused = assertThrows(UpstreamUnavailableException.class, () -> client.analyze(List.of()));
            assertEquals("openxai analyze refused, 4 calls still running", refused.getMessage());
        } finally {
            released.set(true);
        }
    }
}
