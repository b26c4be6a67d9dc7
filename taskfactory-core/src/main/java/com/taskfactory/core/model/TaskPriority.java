package com.taskfactory.core.model;

/**
 * Human-facing priority. Scheduling does not look at it; the queue is FIFO
 * by ready order.
 */
public enum TaskPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
