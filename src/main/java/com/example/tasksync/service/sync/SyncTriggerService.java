package com.example.tasksync.service.sync;

import com.example.tasksync.domain.UnitRef;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Fire-and-forget entry point used by every local mutation.
 * <p>
 * Publishing never touches the calendar API. The work runs on the
 * sync executor once the caller's transaction has committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncTriggerService {

    private final ApplicationEventPublisher eventPublisher;

    public void unitChanged(long userId, UnitRef ref) {
        unitsChanged(userId, List.of(ref));
    }

    public void unitsChanged(long userId, Collection<UnitRef> refs) {
        if (refs.isEmpty()) {
            return;
        }
        log.debug("Queueing calendar sync of {} units for user {}", refs.size(), userId);
        eventPublisher.publishEvent(new UnitSyncRequestedEvent(userId, List.copyOf(refs)));
    }

    public void sweepRequested(long userId) {
        log.debug("Queueing reconciliation sweep for user {}", userId);
        eventPublisher.publishEvent(new SweepRequestedEvent(userId));
    }
}
