package com.cabinet.application.ports;

import java.util.Map;

/**
 * Push channel to a user's open sessions. Event must carry a "type" entry.
 */
public interface RealtimePort {

  void push(Long userId, Map<String, Object> event);
}
