package com.cabinet.api.notification;

import com.cabinet.application.ports.RealtimePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process registry of open SSE streams, keyed by user id. A user may have several tabs open.
 *
 * Pushes are fire-and-forget: a stream that fails to accept an event is dropped.
 */
@Component
public class SseRealtimeHub implements RealtimePort {

  private static final Logger log = LoggerFactory.getLogger(SseRealtimeHub.class);

  private final Map<Long, List<SseEmitter>> streams = new ConcurrentHashMap<>();

  public SseEmitter open(Long userId) {
    SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
    streams.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>()).add(emitter);

    emitter.onCompletion(() -> remove(userId, emitter));
    emitter.onTimeout(() -> remove(userId, emitter));
    emitter.onError(e -> remove(userId, emitter));
    return emitter;
  }

  @Override
  public void push(Long userId, Map<String, Object> event) {
    List<SseEmitter> targets = streams.get(userId);
    if (targets == null || targets.isEmpty()) return;

    String name = String.valueOf(event.getOrDefault("type", "message"));
    for (SseEmitter emitter : targets) {
      try {
        emitter.send(SseEmitter.event().name(name).data(event));
      } catch (IOException | IllegalStateException e) {
        log.debug("Dropping realtime stream of user {}: {}", userId, e.toString());
        remove(userId, emitter);
      }
    }
  }

  public int openStreams(Long userId) {
    List<SseEmitter> targets = streams.get(userId);
    return targets == null ? 0 : targets.size();
  }

  private void remove(Long userId, SseEmitter emitter) {
    streams.computeIfPresent(userId, (k, list) -> {
      list.remove(emitter);
      return list.isEmpty() ? null : list;
    });
  }
}
