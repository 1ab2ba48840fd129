package com.example.tasksync.service.sync;

import lombok.Value;

/**
 * Published when a full reconciliation of one user should run in the background.
 */
@Value
public class SweepRequestedEvent {
    long userId;
}
