package com.cabinet.application.ports;

import com.cabinet.application.ports.PanelPort.PanelDevice;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PanelDeviceTest {

  @Test
  void fallsBackThroughAlternateFieldNames() {
    PanelDevice d = PanelDevice.fromRaw(Map.of("deviceId", " abc ", "platformType", "Android", "name", "Pixel 8"));

    assertThat(d.hwid()).isEqualTo("abc");
    assertThat(d.platform()).isEqualTo("Android");
    assertThat(d.deviceModel()).isEqualTo("Pixel 8");
  }

  @Test
  void missingDescriptorsDefaultToUnknown() {
    PanelDevice d = PanelDevice.fromRaw(Map.of("hwid", "h1"));

    assertThat(d.platform()).isEqualTo(PanelDevice.UNKNOWN);
    assertThat(d.deviceModel()).isEqualTo(PanelDevice.UNKNOWN);
  }

  @Test
  void blankHwidIsSkipped() {
    assertThat(PanelDevice.fromRaw(Map.of("hwid", "  ", "platform", "iOS"))).isNull();
    assertThat(PanelDevice.fromRaw(null)).isNull();
  }
}
