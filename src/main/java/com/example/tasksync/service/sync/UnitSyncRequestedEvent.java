package com.example.tasksync.service.sync;

import com.example.tasksync.domain.UnitRef;
import lombok.Value;

import java.util.List;

/**
 * Published when local units changed and their events need a push.
 */
@Value
public class UnitSyncRequestedEvent {
    long userId;
    List<UnitRef> units;
}
