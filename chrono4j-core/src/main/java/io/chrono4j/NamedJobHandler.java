package io.chrono4j;

/**
 * A handler that carries its own registration name, so containers can discover and register it.
 */
public interface NamedJobHandler extends JobHandler {
    String name();
}
