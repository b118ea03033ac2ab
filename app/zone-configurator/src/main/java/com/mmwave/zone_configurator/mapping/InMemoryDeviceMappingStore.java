package com.mmwave.zone_configurator.mapping;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class InMemoryDeviceMappingStore implements DeviceMappingStore {

  private final ConcurrentMap<String, DeviceMapping> mappings = new ConcurrentHashMap<>();

  @Override
  public Optional<DeviceMapping> find(String deviceId) {
    return deviceId == null ? Optional.empty() : Optional.ofNullable(mappings.get(deviceId));
  }

  @Override
  public DeviceMapping save(DeviceMapping mapping) {
    mappings.put(mapping.deviceId(), mapping);
    return mapping;
  }

  @Override
  public boolean delete(String deviceId) {
    return mappings.remove(deviceId) != null;
  }

  @Override
  public List<DeviceMapping> findAll() {
    return mappings.values().stream()
        .sorted(Comparator.comparing(DeviceMapping::deviceId))
        .toList();
  }
}
