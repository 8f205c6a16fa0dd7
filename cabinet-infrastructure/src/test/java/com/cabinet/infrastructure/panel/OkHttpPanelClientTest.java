package com.cabinet.infrastructure.panel;

import com.cabinet.application.ports.PanelApiException;
import com.cabinet.application.ports.PanelPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OkHttpPanelClientTest {

  private final ObjectMapper mapper = new ObjectMapper();
  private MockWebServer server;
  private OkHttpPanelClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    client = new OkHttpPanelClient(server.url("/").toString(), "token-1", Duration.ofSeconds(5), mapper);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void parsesDevicesWithAlternateFieldNames() throws Exception {
    server.enqueue(new MockResponse().setBody("""
        {"response": {"total": 3, "devices": [
          {"hwid": "h1", "platform": "iOS", "deviceModel": "iPhone"},
          {"deviceId": "h2", "platformType": "Android", "model": "Pixel"},
          {"hwid": "", "platform": "x"}
        ]}}
        """));

    PanelPort.PanelDevices devices = client.getUserDevices("owner-uuid");

    assertThat(devices.total()).isEqualTo(3);
    assertThat(devices.devices()).extracting(PanelPort.PanelDevice::hwid).containsExactly("h1", "h2");
    RecordedRequest req = server.takeRequest();
    assertThat(req.getPath()).isEqualTo("/api/hwid/devices/owner-uuid");
    assertThat(req.getHeader("Authorization")).isEqualTo("Bearer token-1");
  }

  @Test
  void deleteDevicePostsOwnerAndHwid() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"response\": {\"total\": 0, \"devices\": []}}"));

    client.deleteDevice("owner-uuid", "h1");

    RecordedRequest req = server.takeRequest();
    assertThat(req.getMethod()).isEqualTo("POST");
    assertThat(req.getPath()).isEqualTo("/api/hwid/devices/delete");
    JsonNode body = mapper.readTree(req.getBody().readUtf8());
    assertThat(body.path("userUuid").asText()).isEqualTo("owner-uuid");
    assertThat(body.path("hwid").asText()).isEqualTo("h1");
  }

  @Test
  void createUserSendsSquadAndLimits() throws Exception {
    server.enqueue(new MockResponse().setBody("""
        {"response": {"uuid": "u-1", "username": "pvpn-1-abc", "status": "ACTIVE",
          "trafficLimitBytes": 1073741824, "usedTrafficBytes": 0, "subscriptionUrl": "https://sub/1"}}
        """));

    PanelPort.RemoteUser user = client.createUser(new PanelPort.NewRemoteUser(
        "pvpn-1-abc", Instant.parse("2026-05-01T00:00:00Z"), 1073741824L, 2, "desc", List.of("squad-1")));

    assertThat(user.uuid()).isEqualTo("u-1");
    assertThat(user.subscriptionUrl()).isEqualTo("https://sub/1");
    JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
    assertThat(body.path("hwidDeviceLimit").asInt()).isEqualTo(2);
    assertThat(body.path("activeInternalSquads").get(0).asText()).isEqualTo("squad-1");
  }

  @Test
  void notFoundIsEmptyAndServerErrorThrows() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(404));
    server.enqueue(new MockResponse().setResponseCode(500));

    assertThat(client.getNode("n-1")).isEmpty();
    assertThatThrownBy(() -> client.getNode("n-1"))
        .isInstanceOf(PanelApiException.class)
        .satisfies(e -> assertThat(((PanelApiException) e).statusCode()).isEqualTo(500));
  }

  @Test
  void nodeOnlineNeedsConnectedAndEnabled() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"response\": {\"uuid\": \"n-1\", \"name\": \"de-1\", \"isConnected\": true, \"isDisabled\": true}}"));

    PanelPort.NodeInfo node = client.getNode("n-1").orElseThrow();

    assertThat(node.name()).isEqualTo("de-1");
    assertThat(node.online()).isFalse();
  }

  @Test
  void unconfiguredClientRefusesCalls() {
    OkHttpPanelClient blank = new OkHttpPanelClient("", "", Duration.ofSeconds(1), mapper);

    assertThat(blank.isConfigured()).isFalse();
    assertThatThrownBy(() -> blank.listNodes()).isInstanceOf(PanelApiException.class);
  }
}
