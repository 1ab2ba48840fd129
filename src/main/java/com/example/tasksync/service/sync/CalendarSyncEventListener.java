package com.example.tasksync.service.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Runs queued sync work on the sync executor after the publishing transaction commits.
 * Without a surrounding transaction the event is handled right away.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CalendarSyncEventListener {

    private final CalendarSyncService calendarSyncService;
    private final ReconciliationService reconciliationService;

    @Async("syncExecutor")
    @TransactionalEventListener(fallbackExecution = true)
    public void onUnitSyncRequested(UnitSyncRequestedEvent event) {
        for (var ref : event.getUnits()) {
            calendarSyncService.syncUnit(event.getUserId(), ref);
        }
    }

    @Async("syncExecutor")
    @TransactionalEventListener(fallbackExecution = true)
    public void onSweepRequested(SweepRequestedEvent event) {
        try {
            var stats = reconciliationService.reconcile(event.getUserId());
            log.info("Requested sweep for user {} finished: {}", event.getUserId(), stats);
        } catch (Exception e) {
            log.error("Requested sweep for user {} failed: {}", event.getUserId(), e.getMessage(), e);
        }
    }
}
