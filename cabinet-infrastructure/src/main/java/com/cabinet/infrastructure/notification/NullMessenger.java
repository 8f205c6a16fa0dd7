package com.cabinet.infrastructure.notification;

import com.cabinet.application.ports.MessengerPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Used when no bot token is configured. Messages are only logged.
 */
public class NullMessenger implements MessengerPort {

  private static final Logger log = LoggerFactory.getLogger(NullMessenger.class);

  @Override
  public void send(long chatId, String text, List<Action> actions) {
    log.info("[TG-OFF] chat={} text={} actions={}", chatId, text, actions.size());
  }

  @Override
  public void answerCallback(String callbackQueryId, String text, boolean alert) {
    log.info("[TG-OFF] answerCallback {} {}", callbackQueryId, text);
  }

  @Override
  public void editMessage(long chatId, long messageId, String text) {
    log.info("[TG-OFF] editMessage chat={} message={} text={}", chatId, messageId, text);
  }
}
