package com.mmwave.zone_configurator.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mmwave.zone_configurator.model.AreaRegistryEntry;
import com.mmwave.zone_configurator.model.DeviceRegistryEntry;
import com.mmwave.zone_configurator.transport.HomeAssistantTransportException;
import com.mmwave.zone_configurator.transport.StateTransport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(DeviceController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class DeviceControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private StateTransport stateTransport;

  @Test
  void listDevicesReturnsRegistryEntries() throws Exception {
    when(stateTransport.listDevices())
        .thenReturn(
            List.of(
                new DeviceRegistryEntry(
                    "dev-1",
                    "Kitchen EP Lite",
                    null,
                    "Everything Smart Technology",
                    "EP Lite",
                    "1.2.0",
                    null,
                    "kitchen",
                    null)));

    mockMvc
        .perform(get("/api/devices"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("dev-1"))
        .andExpect(jsonPath("$[0].area_id").value("kitchen"));
  }

  @Test
  void listAreasReturnsRegistryEntries() throws Exception {
    when(stateTransport.listAreaRegistry())
        .thenReturn(List.of(new AreaRegistryEntry("kitchen", "Kitchen", null, null)));

    mockMvc
        .perform(get("/api/devices/areas"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("Kitchen"));
  }

  @Test
  void listServicesRequiresDomain() throws Exception {
    mockMvc
        .perform(get("/api/devices/services").param("domain", " "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void servicesForDeviceUseDeviceIdTarget() throws Exception {
    when(stateTransport.getServicesForTarget(Map.of("device_id", List.of("dev-1")), true))
        .thenReturn(List.of("esphome.kitchen_set_zone", "number.set_value"));

    mockMvc
        .perform(get("/api/devices/services/target").param("deviceId", "dev-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]").value("esphome.kitchen_set_zone"))
        .andExpect(jsonPath("$[1]").value("number.set_value"));
  }

  @Test
  void servicesForDeviceRequireDeviceId() throws Exception {
    mockMvc
        .perform(get("/api/devices/services/target").param("deviceId", " "))
        .andExpect(status().isBadRequest());

    verify(stateTransport, never()).getServicesForTarget(any(), anyBoolean());
  }

  @Test
  void transportTimeoutMapsTo504() throws Exception {
    when(stateTransport.listEntityRegistry())
        .thenThrow(
            new HomeAssistantTransportException(
                HomeAssistantTransportException.Reason.REQUEST_TIMEOUT, "Request timeout"));

    mockMvc
        .perform(get("/api/devices/entities"))
        .andExpect(status().isGatewayTimeout())
        .andExpect(jsonPath("$.code").value("HA_REQUEST_TIMEOUT"));
  }
}
