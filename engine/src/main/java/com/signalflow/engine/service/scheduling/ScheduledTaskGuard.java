package com.signalflow.engine.service.scheduling;

import com.signalflow.engine.service.metrics.EngineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps a failing run from killing the scheduler thread; the next tick retries.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final EngineMetrics engineMetrics;

    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
            engineMetrics.recordTaskFailure(taskName);
        }
    }
}
