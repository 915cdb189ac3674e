package in.papersim.service.execution;

import in.papersim.service.trade.LifecycleReconciler;
import in.papersim.service.trade.ReconcilePassSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconcilerSchedulerTest {

    @Mock
    private LifecycleReconciler reconciler;

    private ReconcilerScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ReconcilerScheduler(reconciler, Duration.ofSeconds(60), Duration.ofHours(1));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void tick_countsCompletedPass() {
        when(reconciler.tryRunPass()).thenReturn(Optional.of(ReconcilePassSummary.of(List.of(), 5)));

        scheduler.tick();

        assertEquals(1, scheduler.getTotalPasses());
        assertEquals(0, scheduler.getSkippedPasses());
    }

    @Test
    void tick_skipsWhilePassRunning() {
        when(reconciler.tryRunPass()).thenReturn(Optional.empty());

        scheduler.tick();

        assertEquals(0, scheduler.getTotalPasses());
        assertEquals(1, scheduler.getSkippedPasses(), "Busy reconciler should count as a skipped tick");
    }

    @Test
    void tick_swallowsFailureSoLaterTicksRun() {
        when(reconciler.tryRunPass())
            .thenThrow(new RuntimeException("Failed to load open trades"))
            .thenReturn(Optional.of(ReconcilePassSummary.of(List.of(), 5)));

        assertDoesNotThrow(scheduler::tick);
        scheduler.tick();

        assertEquals(1, scheduler.getFailedPasses());
        assertEquals(1, scheduler.getTotalPasses());
    }

    @Test
    void start_zeroIntervalNeverRuns() throws Exception {
        ReconcilerScheduler disabled = new ReconcilerScheduler(reconciler, Duration.ZERO, Duration.ZERO);
        try {
            disabled.start();
            Thread.sleep(100);
            verifyNoInteractions(reconciler);
        } finally {
            disabled.stop();
        }
    }
}
