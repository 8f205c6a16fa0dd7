package com.cabinet.infrastructure.panel;

import com.cabinet.application.ports.PanelApiException;
import com.cabinet.application.ports.PanelPort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * VPN panel adapter over its REST API. Responses wrap the payload in a top-level "response" field.
 */
public class OkHttpPanelClient implements PanelPort {

  private static final Logger log = LoggerFactory.getLogger(OkHttpPanelClient.class);
  private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
  private static final TypeReference<Map<String, Object>> RAW_DEVICE = new TypeReference<>() {};

  private final String baseUrl;
  private final String apiToken;
  private final ObjectMapper mapper;
  private final OkHttpClient client;

  public OkHttpPanelClient(String baseUrl, String apiToken, Duration timeout, ObjectMapper mapper) {
    this.baseUrl = trimSlash(baseUrl);
    this.apiToken = apiToken == null ? "" : apiToken.trim();
    this.mapper = mapper;
    this.client = new OkHttpClient.Builder()
        .connectTimeout(timeout)
        .readTimeout(timeout)
        .writeTimeout(timeout)
        .build();
  }

  @Override
  public boolean isConfigured() {
    return !baseUrl.isEmpty() && !apiToken.isEmpty();
  }

  @Override
  public PanelDevices getUserDevices(String userUuid) throws PanelApiException {
    JsonNode resp = call("GET", "/api/hwid/devices/" + userUuid, null).orElse(null);
    if (resp == null) return PanelDevices.empty();

    List<PanelDevice> devices = new ArrayList<>();
    JsonNode arr = resp.path("devices");
    if (arr.isArray()) {
      for (JsonNode n : arr) {
        Map<String, Object> raw = mapper.convertValue(n, RAW_DEVICE);
        PanelDevice d = PanelDevice.fromRaw(raw);
        if (d != null) devices.add(d);
      }
    }
    int total = resp.path("total").asInt(devices.size());
    return new PanelDevices(List.copyOf(devices), total);
  }

  @Override
  public void deleteDevice(String userUuid, String hwid) throws PanelApiException {
    ObjectNode body = mapper.createObjectNode();
    body.put("userUuid", userUuid);
    body.put("hwid", hwid);
    call("POST", "/api/hwid/devices/delete", body);
  }

  @Override
  public RemoteUser createUser(NewRemoteUser request) throws PanelApiException {
    ObjectNode body = mapper.createObjectNode();
    body.put("username", request.username());
    body.put("status", "ACTIVE");
    body.put("expireAt", request.expireAt().toString());
    body.put("trafficLimitBytes", request.trafficLimitBytes());
    body.put("trafficLimitStrategy", "NO_RESET");
    body.put("hwidDeviceLimit", request.hwidDeviceLimit());
    body.put("description", request.description());
    ArrayNode squads = body.putArray("activeInternalSquads");
    request.activeInternalSquads().forEach(squads::add);

    JsonNode resp = call("POST", "/api/users", body)
        .orElseThrow(() -> new PanelApiException("Panel returned empty body for user creation"));
    return toRemoteUser(resp);
  }

  @Override
  public Optional<RemoteUser> getUser(String userUuid) throws PanelApiException {
    return call("GET", "/api/users/" + userUuid, null).map(OkHttpPanelClient::toRemoteUser);
  }

  @Override
  public boolean deleteUser(String userUuid) throws PanelApiException {
    return call("DELETE", "/api/users/" + userUuid, null)
        .map(n -> n.path("isDeleted").asBoolean(false))
        .orElse(false);
  }

  @Override
  public Optional<NodeInfo> getNode(String nodeUuid) throws PanelApiException {
    return call("GET", "/api/nodes/" + nodeUuid, null).map(OkHttpPanelClient::toNode);
  }

  @Override
  public List<NodeInfo> listNodes() throws PanelApiException {
    JsonNode resp = call("GET", "/api/nodes", null).orElse(null);
    List<NodeInfo> out = new ArrayList<>();
    if (resp != null && resp.isArray()) {
      for (JsonNode n : resp) out.add(toNode(n));
    }
    return out;
  }

  @Override
  public Optional<SquadInfo> getSquad(String squadUuid) throws PanelApiException {
    return call("GET", "/api/internal-squads/" + squadUuid, null).map(OkHttpPanelClient::toSquad);
  }

  @Override
  public List<SquadInfo> listSquads() throws PanelApiException {
    JsonNode resp = call("GET", "/api/internal-squads", null).orElse(null);
    List<SquadInfo> out = new ArrayList<>();
    if (resp != null) {
      for (JsonNode n : resp.path("internalSquads")) out.add(toSquad(n));
    }
    return out;
  }

  @Override
  public boolean restartNode(String nodeUuid) throws PanelApiException {
    return call("POST", "/api/nodes/" + nodeUuid + "/actions/restart", mapper.createObjectNode())
        .map(n -> n.path("eventSent").asBoolean(false))
        .orElse(false);
  }

  /**
   * Executes one request and unwraps "response".
   * A 404 is reported as empty; any other non-2xx is a {@link PanelApiException}.
   */
  private Optional<JsonNode> call(String method, String path, JsonNode body) throws PanelApiException {
    if (!isConfigured()) {
      throw new PanelApiException("Panel client is not configured");
    }

    HttpUrl url = HttpUrl.parse(baseUrl + path);
    if (url == null) {
      throw new PanelApiException("Invalid panel url: " + baseUrl + path);
    }

    RequestBody rb = null;
    if (body != null) {
      try {
        rb = RequestBody.create(mapper.writeValueAsString(body), JSON);
      } catch (IOException e) {
        throw new PanelApiException("Cannot serialize panel request", -1, e);
      }
    }

    Request request = new Request.Builder()
        .url(url)
        .header("Authorization", "Bearer " + apiToken)
        .header("Accept", "application/json")
        .method(method, rb)
        .build();

    try (Response resp = client.newCall(request).execute()) {
      int code = resp.code();
      if (code == 404) {
        return Optional.empty();
      }
      ResponseBody rbody = resp.body();
      String text = rbody == null ? "" : rbody.string();
      if (!resp.isSuccessful()) {
        log.warn("Panel {} {} -> {}", method, path, code);
        throw new PanelApiException("Panel " + method + " " + path + " failed with HTTP " + code, code, null);
      }
      if (text.isBlank()) {
        return Optional.empty();
      }
      JsonNode root = mapper.readTree(text);
      JsonNode payload = root.has("response") ? root.get("response") : root;
      return payload == null || payload.isNull() ? Optional.empty() : Optional.of(payload);
    } catch (IOException e) {
      throw new PanelApiException("Panel " + method + " " + path + " failed: " + e.getMessage(), -1, e);
    }
  }

  private static RemoteUser toRemoteUser(JsonNode n) {
    return new RemoteUser(
        n.path("uuid").asText(null),
        n.path("username").asText(null),
        n.path("status").asText("UNKNOWN"),
        n.path("trafficLimitBytes").asLong(0),
        n.path("usedTrafficBytes").asLong(0),
        n.path("subscriptionUrl").asText(null)
    );
  }

  private static NodeInfo toNode(JsonNode n) {
    return new NodeInfo(
        n.path("uuid").asText(null),
        n.path("name").asText(null),
        n.path("isConnected").asBoolean(false),
        n.path("isDisabled").asBoolean(false)
    );
  }

  private static SquadInfo toSquad(JsonNode n) {
    return new SquadInfo(
        n.path("uuid").asText(null),
        n.path("name").asText(null),
        n.path("info").path("membersCount").asInt(0)
    );
  }

  private static String trimSlash(String s) {
    if (s == null) return "";
    String v = s.trim();
    while (v.endsWith("/")) v = v.substring(0, v.length() - 1);
    return v;
  }
}
