package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.AdminEvent;
import com.github.adamzv.kafkaadmin.domain.InstrumentationEvent;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Synchronous event fan-out for admin lifecycle events. A failing listener is logged and
 * does not affect the emitter or the other listeners.
 */
@Component
public class InstrumentationEmitter {

  private static final Logger log = LoggerFactory.getLogger(InstrumentationEmitter.class);

  private final Time time;
  private final AtomicLong ids = new AtomicLong();
  private final Map<AdminEvent, List<Consumer<InstrumentationEvent>>> listeners = new EnumMap<>(AdminEvent.class);

  public InstrumentationEmitter(Time time) {
    this.time = time;
    for (AdminEvent event : AdminEvent.values()) {
      listeners.put(event, new CopyOnWriteArrayList<>());
    }
  }

  /**
   * @return a handle that removes the listener again
   */
  public Runnable addListener(AdminEvent event, Consumer<InstrumentationEvent> listener) {
    List<Consumer<InstrumentationEvent>> registered = listeners.get(event);
    registered.add(listener);
    return () -> registered.remove(listener);
  }

  public void emit(AdminEvent event, Map<String, Object> payload) {
    InstrumentationEvent instrumentationEvent = new InstrumentationEvent(
        String.valueOf(ids.incrementAndGet()),
        event.eventName(),
        time.milliseconds(),
        payload == null ? Map.of() : Map.copyOf(payload)
    );
    for (Consumer<InstrumentationEvent> listener : listeners.get(event)) {
      try {
        listener.accept(instrumentationEvent);
      } catch (RuntimeException ex) {
        log.error("Failed to execute listener: {} eventName={}", ex.getMessage(), event.eventName(), ex);
      }
    }
  }
}
