package com.taskfactory.engine.broadcast;

import com.taskfactory.core.model.EventType;
import com.taskfactory.core.model.WorkspaceEvent;
import com.taskfactory.engine.metrics.TaskFactoryMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Fan-out of workspace events to subscribed observers.
 *
 * Each workspace has its own sequence counter and dispatch monitor: events of
 * one workspace reach every observer in the order they were broadcast, and
 * workspaces never block each other. Events are not buffered or replayed.
 */
public class BroadcastHub {

    private static final Logger log = LoggerFactory.getLogger(BroadcastHub.class);

    private final Clock clock;
    private final TaskFactoryMetrics metrics;
    private final Map<String, EventObserver> observers = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> subscriptionsByObserver = new ConcurrentHashMap<>();
    private final Map<String, Set<EventObserver>> subscribersByWorkspace = new ConcurrentHashMap<>();
    private final Map<String, Channel> channels = new ConcurrentHashMap<>();

    public BroadcastHub(Clock clock, TaskFactoryMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    public void connect(EventObserver observer) {
        observers.put(observer.id(), observer);
        subscriptionsByObserver.putIfAbsent(observer.id(), ConcurrentHashMap.newKeySet());
        metrics.syncConnectedObservers(observers.size());
        log.debug("Observer {} connected", observer.id());
    }

    /**
     * @return false if the observer is not connected
     */
    public boolean subscribe(String observerId, String workspaceId) {
        EventObserver observer = observers.get(observerId);
        Set<String> subscriptions = subscriptionsByObserver.get(observerId);
        if (observer == null || subscriptions == null) {
            return false;
        }
        subscriptions.add(workspaceId);
        subscribersByWorkspace.computeIfAbsent(workspaceId, ws -> new CopyOnWriteArraySet<>()).add(observer);
        log.debug("Observer {} subscribed to workspace {}", observerId, workspaceId);
        return true;
    }

    public boolean unsubscribe(String observerId, String workspaceId) {
        Set<String> subscriptions = subscriptionsByObserver.get(observerId);
        if (subscriptions == null || !subscriptions.remove(workspaceId)) {
            return false;
        }
        Set<EventObserver> subscribers = subscribersByWorkspace.get(workspaceId);
        if (subscribers != null) {
            subscribers.removeIf(o -> o.id().equals(observerId));
        }
        return true;
    }

    /**
     * Remove the observer and every subscription it holds.
     */
    public void disconnect(String observerId) {
        EventObserver removed = observers.remove(observerId);
        Set<String> subscriptions = subscriptionsByObserver.remove(observerId);
        if (subscriptions != null) {
            for (String workspaceId : subscriptions) {
                Set<EventObserver> subscribers = subscribersByWorkspace.get(workspaceId);
                if (subscribers != null) {
                    subscribers.removeIf(o -> o.id().equals(observerId));
                }
            }
        }
        if (removed != null) {
            metrics.syncConnectedObservers(observers.size());
            log.debug("Observer {} disconnected", observerId);
        }
    }

    public void disconnectAll() {
        Set.copyOf(observers.keySet()).forEach(this::disconnect);
    }

    /**
     * Stamp and deliver an event to the workspace's subscribers.
     *
     * @return the event as delivered, with its sequence number
     */
    public WorkspaceEvent broadcast(String workspaceId, EventType type, String taskId, Map<String, Object> payload) {
        Channel channel = channels.computeIfAbsent(workspaceId, ws -> new Channel());
        synchronized (channel) {
            WorkspaceEvent event = new WorkspaceEvent(
                workspaceId, ++channel.sequence, type, taskId, payload, clock.instant());
            Set<EventObserver> subscribers = subscribersByWorkspace.get(workspaceId);
            if (subscribers != null) {
                for (EventObserver observer : subscribers) {
                    deliverSafely(observer, event);
                }
            }
            return event;
        }
    }

    /**
     * Forget a deleted workspace. Subscriptions held by observers are dropped too.
     */
    public void dropWorkspace(String workspaceId) {
        Set<EventObserver> subscribers = subscribersByWorkspace.remove(workspaceId);
        if (subscribers != null) {
            subscribers.forEach(o -> {
                Set<String> subscriptions = subscriptionsByObserver.get(o.id());
                if (subscriptions != null) {
                    subscriptions.remove(workspaceId);
                }
            });
        }
        channels.remove(workspaceId);
    }

    public Set<String> subscriptionsOf(String observerId) {
        Set<String> subscriptions = subscriptionsByObserver.get(observerId);
        return subscriptions == null ? Set.of() : Set.copyOf(subscriptions);
    }

    public int subscriberCount(String workspaceId) {
        Set<EventObserver> subscribers = subscribersByWorkspace.get(workspaceId);
        return subscribers == null ? 0 : subscribers.size();
    }

    public int connectedObservers() {
        return observers.size();
    }

    // ========== Internal Methods ==========

    private void deliverSafely(EventObserver observer, WorkspaceEvent event) {
        if (!observer.isOpen()) {
            log.debug("Dropping closed observer {}", observer.id());
            disconnect(observer.id());
            return;
        }
        try {
            observer.deliver(event);
        } catch (Exception e) {
            log.warn("Observer {} failed to receive {} for workspace {}: {}",
                observer.id(), event.type().wireName(), event.workspaceId(), e.getMessage());
        }
    }

    private static final class Channel {
        private long sequence;
    }
}
