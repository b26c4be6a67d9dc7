package com.taskfactory.core.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class SessionStatusTest {

    @Test
    void isLive_shouldIdentifyStatusesHoldingTheTaskSlot() {
        assertTrue(SessionStatus.RUNNING.isLive());
        assertTrue(SessionStatus.IDLE.isLive());

        assertFalse(SessionStatus.PAUSED.isLive());
        assertFalse(SessionStatus.COMPLETED.isLive());
        assertFalse(SessionStatus.ERROR.isLive());
    }

    @Test
    void isInterrupted_shouldRequireRunningWithoutPlan() {
        TaskPlan plan = new TaskPlan("goal", null, null, null, null);

        assertTrue(PlanningStatus.RUNNING.isInterrupted(null));
        assertFalse(PlanningStatus.RUNNING.isInterrupted(plan));
        assertFalse(PlanningStatus.NONE.isInterrupted(null));
        assertFalse(PlanningStatus.ERROR.isInterrupted(null));
    }
}
