package com.signalflow.engine.service.scheduling;

import com.signalflow.engine.service.execution.ExecutionCoordinator;
import com.signalflow.engine.service.exit.ExitMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "engine.scheduler.enabled", havingValue = "true")
public class EngineScheduler {

    private final ExecutionCoordinator executionCoordinator;
    private final ExitMonitor exitMonitor;
    private final SignalExpirySweeper signalExpirySweeper;
    private final ScheduledTaskGuard taskGuard;

    @Scheduled(fixedDelayString = "${engine.scheduler.execution-interval:PT2M}", initialDelayString = "PT10S")
    public void runExecution() {
        taskGuard.run("execution", executionCoordinator::runExecutionCycle);
    }

    @Scheduled(fixedDelayString = "${engine.scheduler.exit-interval:PT15M}", initialDelayString = "PT30S")
    public void runExits() {
        taskGuard.run("exit", exitMonitor::runExitCycle);
    }

    @Scheduled(fixedDelayString = "${engine.scheduler.expiry-interval:PT1H}", initialDelayString = "PT1M")
    public void runExpiry() {
        taskGuard.run("expiry", signalExpirySweeper::sweep);
    }
}
