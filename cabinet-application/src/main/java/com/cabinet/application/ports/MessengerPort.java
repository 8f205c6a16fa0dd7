package com.cabinet.application.ports;

import java.util.List;

/**
 * Outbound chat messages (Telegram in production).
 *
 * Delivery is best-effort: implementations log failures and never throw.
 */
public interface MessengerPort {

  void send(long chatId, String text, List<Action> actions);

  default void send(long chatId, String text) {
    send(chatId, text, List.of());
  }

  void answerCallback(String callbackQueryId, String text, boolean alert);

  void editMessage(long chatId, long messageId, String text);

  /** Inline button; callbackData is echoed back by the messenger when pressed. */
  record Action(String text, String callbackData) {}
}
