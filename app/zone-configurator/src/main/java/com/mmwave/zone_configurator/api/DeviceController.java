package com.mmwave.zone_configurator.api;

import com.mmwave.zone_configurator.model.AreaRegistryEntry;
import com.mmwave.zone_configurator.model.DeviceRegistryEntry;
import com.mmwave.zone_configurator.model.EntityRegistryEntry;
import com.mmwave.zone_configurator.transport.StateTransport;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/devices")
public class DeviceController {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StateTransport は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StateTransport stateTransport;

  public DeviceController(StateTransport stateTransport) {
    this.stateTransport = stateTransport;
  }

  @GetMapping
  public List<DeviceRegistryEntry> listDevices() {
    return stateTransport.listDevices();
  }

  @GetMapping("/entities")
  public List<EntityRegistryEntry> listEntities() {
    return stateTransport.listEntityRegistry();
  }

  @GetMapping("/areas")
  public List<AreaRegistryEntry> listAreas() {
    return stateTransport.listAreaRegistry();
  }

  @GetMapping("/services")
  public List<String> listServices(@RequestParam("domain") String domain) {
    if (domain.isBlank()) {
      throw new IllegalArgumentException("domain is required");
    }
    return stateTransport.getServicesByDomain(domain);
  }

  // REST トランスポートでは常に空
  @GetMapping("/services/target")
  public List<String> listServicesForDevice(
      @RequestParam("deviceId") String deviceId,
      @RequestParam(name = "expandGroup", defaultValue = "true") boolean expandGroup) {
    if (deviceId.isBlank()) {
      throw new IllegalArgumentException("deviceId is required");
    }
    return stateTransport.getServicesForTarget(
        Map.of("device_id", List.of(deviceId)), expandGroup);
  }
}
