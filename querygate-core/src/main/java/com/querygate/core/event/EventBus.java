package com.querygate.core.event;

import com.querygate.api.event.QueryGateEvent;
import com.querygate.api.event.QueryGateEventListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
public class EventBus {

    private final Map<Class<? extends QueryGateEvent>, List<QueryGateEventListener<? extends QueryGateEvent>>> listeners =
            new ConcurrentHashMap<>();

    public <E extends QueryGateEvent> void subscribe(Class<E> eventType, QueryGateEventListener<E> listener) {
        listeners.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>())
                .add(listener);
    }

    public <E extends QueryGateEvent> void unsubscribe(Class<E> eventType, QueryGateEventListener<E> listener) {
        List<QueryGateEventListener<? extends QueryGateEvent>> eventListeners = listeners.get(eventType);
        if (eventListeners != null) {
            eventListeners.remove(listener);
        }
    }

    public <E extends QueryGateEvent> void publish(E event) {
        List<QueryGateEventListener<? extends QueryGateEvent>> eventListeners = listeners.get(event.getClass());
        if (eventListeners == null) {
            return;
        }
        for (QueryGateEventListener<? extends QueryGateEvent> listener : eventListeners) {
            // 订阅时已按事件类型分组
            @SuppressWarnings("unchecked")
            QueryGateEventListener<E> castListener = (QueryGateEventListener<E>) listener;
            try {
                castListener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event listener threw exception, propagating: {}", e.getMessage());
                throw e;
            }
        }
    }
}
