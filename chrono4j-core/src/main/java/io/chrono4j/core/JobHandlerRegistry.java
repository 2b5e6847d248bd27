package io.chrono4j.core;

import io.chrono4j.JobHandler;
import io.chrono4j.NamedJobHandler;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to handler mapping owned by one scheduler instance.
 *
 * <p>Registering an existing name replaces the previous handler.
 */
public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlersByName = new ConcurrentHashMap<>();

    public JobHandlerRegistry() {
    }

    public JobHandlerRegistry(List<? extends NamedJobHandler> handlers) {
        for (NamedJobHandler handler : handlers) {
            if (handlersByName.putIfAbsent(handler.name(), handler) != null) {
                throw new IllegalStateException("Duplicate JobHandler name: " + handler.name());
            }
        }
    }

    public void register(String name, JobHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("handler name must not be blank");
        }
        Objects.requireNonNull(handler, "handler must not be null");
        handlersByName.put(name, handler);
    }

    public void register(NamedJobHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        register(handler.name(), handler);
    }

    public JobHandler find(String name) {
        return name == null ? null : handlersByName.get(name);
    }

    public JobHandler getRequired(String name) {
        JobHandler handler = find(name);
        if (handler == null) {
            throw SchedulerException.handlerNotFound(name);
        }
        return handler;
    }

    public boolean contains(String name) {
        return find(name) != null;
    }

    public Set<String> names() {
        return Set.copyOf(handlersByName.keySet());
    }
}
