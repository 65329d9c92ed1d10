package com.skillbench.core.events;

import com.skillbench.core.model.RunProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Project-keyed delivery channel for run and iteration events.
 * <p>
 * Every consumer of progress goes through here: SSE emitters subscribe to raw events,
 * run listeners subscribe to the typed {@link RunProgress} carried by run events.
 * Publishing runs the subscribers on the caller's thread, in subscription order.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Consumer<SkillbenchEvent>>> subscribers = new ConcurrentHashMap<>();

    public void publish(SkillbenchEvent event) {
        List<Consumer<SkillbenchEvent>> projectSubscribers = subscribers.get(event.projectId());
        if (projectSubscribers == null) {
            return;
        }
        log.debug("Delivering {} of project {} to {} subscriber(s)",
                event.eventType(), event.projectId(), projectSubscribers.size());
        for (Consumer<SkillbenchEvent> subscriber : projectSubscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber of project {} failed on {}: {}",
                        event.projectId(), event.eventType(), e.getMessage(), e);
            }
        }
    }

    public Subscription subscribe(String projectId, Consumer<SkillbenchEvent> consumer) {
        subscribers.computeIfAbsent(projectId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> subscribers.computeIfPresent(projectId, (k, list) -> {
            list.remove(consumer);
            return list.isEmpty() ? null : list;
        });
    }

    /**
     * Subscribe to the run snapshots of a project.
     *
     * @param filter   which run events to accept; events without a snapshot are never delivered
     * @param listener receives the snapshot of each accepted event
     */
    public Subscription subscribeRunProgress(String projectId, Predicate<SkillbenchEvent> filter,
                                             Consumer<RunProgress> listener) {
        return subscribe(projectId, event -> {
            if (event.isRunEvent() && filter.test(event)) {
                listener.accept(event.progress());
            }
        });
    }

    public int subscriberCount(String projectId) {
        List<Consumer<SkillbenchEvent>> projectSubscribers = subscribers.get(projectId);
        return projectSubscribers == null ? 0 : projectSubscribers.size();
    }

    @FunctionalInterface
    public interface Subscription {

        Subscription NONE = () -> { };

        void unsubscribe();
    }
}
