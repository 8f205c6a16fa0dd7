package com.cabinet.infrastructure.notification;

import com.cabinet.application.ports.MessengerPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Bot API sender. Messages are HTML-formatted; inline actions are rendered as one keyboard row.
 */
public class TelegramMessenger implements MessengerPort {

  private static final Logger log = LoggerFactory.getLogger(TelegramMessenger.class);
  private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

  private final String apiBase;
  private final ObjectMapper mapper;

  private final OkHttpClient client = new OkHttpClient.Builder()
      .connectTimeout(30, TimeUnit.SECONDS)
      .readTimeout(30, TimeUnit.SECONDS)
      .writeTimeout(30, TimeUnit.SECONDS)
      .build();

  public TelegramMessenger(String apiBaseUrl, String botToken, ObjectMapper mapper) {
    this.apiBase = apiBaseUrl + "/bot" + botToken;
    this.mapper = mapper;
  }

  @Override
  public void send(long chatId, String text, List<Action> actions) {
    ObjectNode body = mapper.createObjectNode();
    body.put("chat_id", chatId);
    body.put("text", text);
    body.put("parse_mode", "HTML");
    if (actions != null && !actions.isEmpty()) {
      ArrayNode row = body.putObject("reply_markup").putArray("inline_keyboard").addArray();
      for (Action a : actions) {
        row.addObject().put("text", a.text()).put("callback_data", a.callbackData());
      }
    }
    post("sendMessage", body);
  }

  @Override
  public void answerCallback(String callbackQueryId, String text, boolean alert) {
    ObjectNode body = mapper.createObjectNode();
    body.put("callback_query_id", callbackQueryId);
    body.put("text", text);
    body.put("show_alert", alert);
    post("answerCallbackQuery", body);
  }

  @Override
  public void editMessage(long chatId, long messageId, String text) {
    ObjectNode body = mapper.createObjectNode();
    body.put("chat_id", chatId);
    body.put("message_id", messageId);
    body.put("text", text);
    post("editMessageText", body);
  }

  private void post(String method, ObjectNode body) {
    try {
      Request request = new Request.Builder()
          .url(apiBase + "/" + method)
          .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
          .build();

      try (Response resp = client.newCall(request).execute()) {
        if (!resp.isSuccessful()) {
          log.warn("Telegram {} non-2xx: {}", method, resp.code());
        }
      }
    } catch (IOException e) {
      log.warn("Telegram {} error: {}", method, e.toString());
    }
  }
}
