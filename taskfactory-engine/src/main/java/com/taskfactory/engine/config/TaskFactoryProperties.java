package com.taskfactory.engine.config;

import com.taskfactory.core.model.Phase;
import com.taskfactory.core.model.WorkflowSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "taskfactory")
public class TaskFactoryProperties {

    private Workflow workflow = new Workflow();
    private Queue queue = new Queue();
    private Breaker breaker = new Breaker();
    private Session session = new Session();
    private Agent agent = new Agent();
    private Planning planning = new Planning();
    private Recovery recovery = new Recovery();

    public Workflow getWorkflow() { return workflow; }
    public void setWorkflow(Workflow workflow) { this.workflow = workflow; }
    public Queue getQueue() { return queue; }
    public void setQueue(Queue queue) { this.queue = queue; }
    public Breaker getBreaker() { return breaker; }
    public void setBreaker(Breaker breaker) { this.breaker = breaker; }
    public Session getSession() { return session; }
    public void setSession(Session session) { this.session = session; }
    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Planning getPlanning() { return planning; }
    public void setPlanning(Planning planning) { this.planning = planning; }
    public Recovery getRecovery() { return recovery; }
    public void setRecovery(Recovery recovery) { this.recovery = recovery; }

    /**
     * Global WIP limits and automation defaults. Unset limits are unlimited.
     */
    public static class Workflow {
        private Integer backlogLimit;
        private Integer readyLimit = WorkflowSettings.DEFAULT_READY_LIMIT;
        private Integer executingLimit = WorkflowSettings.DEFAULT_EXECUTING_LIMIT;
        private Integer completeLimit;
        private Integer archivedLimit;
        private boolean promoteOnPlanReady = false;
        private boolean autoExecute = true;

        public Integer getBacklogLimit() { return backlogLimit; }
        public void setBacklogLimit(Integer backlogLimit) { this.backlogLimit = backlogLimit; }
        public Integer getReadyLimit() { return readyLimit; }
        public void setReadyLimit(Integer readyLimit) { this.readyLimit = readyLimit; }
        public Integer getExecutingLimit() { return executingLimit; }
        public void setExecutingLimit(Integer executingLimit) { this.executingLimit = executingLimit; }
        public Integer getCompleteLimit() { return completeLimit; }
        public void setCompleteLimit(Integer completeLimit) { this.completeLimit = completeLimit; }
        public Integer getArchivedLimit() { return archivedLimit; }
        public void setArchivedLimit(Integer archivedLimit) { this.archivedLimit = archivedLimit; }
        public boolean isPromoteOnPlanReady() { return promoteOnPlanReady; }
        public void setPromoteOnPlanReady(boolean promoteOnPlanReady) { this.promoteOnPlanReady = promoteOnPlanReady; }
        public boolean isAutoExecute() { return autoExecute; }
        public void setAutoExecute(boolean autoExecute) { this.autoExecute = autoExecute; }

        public Map<Phase, Integer> limits() {
            Map<Phase, Integer> limits = new EnumMap<>(Phase.class);
            limits.put(Phase.BACKLOG, backlogLimit);
            limits.put(Phase.READY, readyLimit);
            limits.put(Phase.EXECUTING, executingLimit);
            limits.put(Phase.COMPLETE, completeLimit);
            limits.put(Phase.ARCHIVED, archivedLimit);
            return limits;
        }

        public void setLimit(Phase phase, Integer limit) {
            switch (phase) {
                case BACKLOG -> backlogLimit = limit;
                case READY -> readyLimit = limit;
                case EXECUTING -> executingLimit = limit;
                case COMPLETE -> completeLimit = limit;
                case ARCHIVED -> archivedLimit = limit;
            }
        }

        public WorkflowSettings toSettings() {
            return new WorkflowSettings(limits(), promoteOnPlanReady, autoExecute);
        }
    }

    public static class Queue {
        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration startRetryDelay = Duration.ofSeconds(5);

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }
        public Duration getStartRetryDelay() { return startRetryDelay; }
        public void setStartRetryDelay(Duration startRetryDelay) { this.startRetryDelay = startRetryDelay; }
    }

    /**
     * Execution breaker: pauses dispatch after a burst of auth, quota or
     * rate-limit failures.
     */
    public static class Breaker {
        private boolean enabled = true;
        private int threshold = 3;
        private Duration burstWindow = Duration.ofMinutes(2);
        private Duration cooldown = Duration.ofMinutes(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getThreshold() { return threshold; }
        public void setThreshold(int threshold) { this.threshold = threshold; }
        public Duration getBurstWindow() { return burstWindow; }
        public void setBurstWindow(Duration burstWindow) { this.burstWindow = burstWindow; }
        public Duration getCooldown() { return cooldown; }
        public void setCooldown(Duration cooldown) { this.cooldown = cooldown; }
    }

    public static class Session {
        private Duration stopTimeout = Duration.ofSeconds(30);

        public Duration getStopTimeout() { return stopTimeout; }
        public void setStopTimeout(Duration stopTimeout) { this.stopTimeout = stopTimeout; }
    }

    public static class Agent {
        private String baseUrl = "http://localhost:7070";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
    }

    /**
     * Guardrails handed to the planning collaborator, which enforces them.
     */
    public static class Planning {
        private Duration maxWallClock = Duration.ofMinutes(30);
        private int maxToolCalls = 100;

        public Duration getMaxWallClock() { return maxWallClock; }
        public void setMaxWallClock(Duration maxWallClock) { this.maxWallClock = maxWallClock; }
        public int getMaxToolCalls() { return maxToolCalls; }
        public void setMaxToolCalls(int maxToolCalls) { this.maxToolCalls = maxToolCalls; }
    }

    public static class Recovery {
        private boolean requeueStaleExecuting = true;

        public boolean isRequeueStaleExecuting() { return requeueStaleExecuting; }
        public void setRequeueStaleExecuting(boolean requeueStaleExecuting) { this.requeueStaleExecuting = requeueStaleExecuting; }
    }
}
