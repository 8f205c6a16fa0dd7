package com.cabinet.api.telegram;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-polling reader of {@code callback_query} updates.
 *
 * Must not run together with another poller on the same token (Telegram answers 409).
 * Enable with cabinet.telegram.bot.enabled=true.
 */
@Component
@ConditionalOnProperty(
    prefix = "cabinet.telegram.bot",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = false
)
public class TelegramFamilyBot implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(TelegramFamilyBot.class);

  // Telegram holds the connection up to `timeout` seconds; the client read timeout must exceed it.
  private static final int TG_LONG_POLL_SECONDS = 25;

  private final TelegramBotProperties props;
  private final FamilyInviteCallbackHandler handler;
  private final ObjectMapper objectMapper;
  private final OkHttpClient http = new OkHttpClient.Builder()
      .connectTimeout(10, TimeUnit.SECONDS)
      .readTimeout(75, TimeUnit.SECONDS)
      .build();

  private final AtomicBoolean running = new AtomicBoolean(false);
  private Thread pollThread;

  public TelegramFamilyBot(TelegramBotProperties props, FamilyInviteCallbackHandler handler, ObjectMapper objectMapper) {
    this.props = props;
    this.handler = handler;
    this.objectMapper = objectMapper;
  }

  @Override
  public void start() {
    if (running.get()) return;

    if (!props.hasToken()) {
      log.warn("Telegram family bot enabled, but token is empty. Set CABINET_TELEGRAM_BOT_TOKEN.");
      return;
    }

    running.set(true);
    pollThread = new Thread(this::pollLoop, "cabinet-telegram-poll");
    pollThread.setDaemon(true);
    pollThread.start();
    log.info("Telegram family bot started");
  }

  @Override
  public void stop() {
    running.set(false);
    if (pollThread != null) pollThread.interrupt();
    log.info("Telegram family bot stopped");
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  @Override
  public void stop(Runnable callback) {
    stop();
    callback.run();
  }

  private void pollLoop() {
    long offset = 0;

    while (running.get() && !Thread.currentThread().isInterrupted()) {
      try {
        JsonNode resp = getUpdates(offset);
        if (resp == null || !resp.path("ok").asBoolean(false)) {
          continue;
        }

        for (JsonNode upd : resp.path("result")) {
          offset = Math.max(offset, upd.path("update_id").asLong() + 1);
          dispatch(upd.path("callback_query"));
        }
      } catch (InterruptedIOException e) {
        // long poll timed out or the thread is stopping
      } catch (Exception e) {
        log.warn("Telegram poll error: {}", e.toString());
        sleepSilently(1500);
      }
    }
  }

  void dispatch(JsonNode query) {
    if (query.isMissingNode() || query.isNull()) return;

    String data = query.path("data").asText(null);
    if (!handler.supports(data)) return;

    JsonNode message = query.path("message");
    Long chatId = message.path("chat").hasNonNull("id") ? message.path("chat").path("id").asLong() : null;
    Long messageId = message.hasNonNull("message_id") ? message.path("message_id").asLong() : null;

    try {
      handler.handle(new FamilyInviteCallbackHandler.Callback(
          query.path("id").asText(),
          query.path("from").path("id").asLong(),
          chatId,
          messageId,
          data
      ));
    } catch (RuntimeException e) {
      log.warn("Family invite callback failed: data={} error={}", data, e.toString());
    }
  }

  private JsonNode getUpdates(long offset) throws IOException {
    String url = props.apiBaseUrlOrDefault() + "/bot" + props.token()
        + "/getUpdates?timeout=" + TG_LONG_POLL_SECONDS
        + "&offset=" + offset
        + "&allowed_updates=%5B%22callback_query%22%5D";

    Request request = new Request.Builder().url(url).get().build();
    try (Response resp = http.newCall(request).execute()) {
      int code = resp.code();
      if (code != 200) {
        if (code == 409) {
          log.warn("Telegram getUpdates 409: another poller is active for this bot token.");
          sleepSilently(5000);
          return null;
        }
        log.warn("Telegram getUpdates non-200: {}", code);
        sleepSilently(1200);
        return null;
      }
      ResponseBody body = resp.body();
      return body == null ? null : objectMapper.readTree(body.string());
    }
  }

  private void sleepSilently(long ms) {
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
