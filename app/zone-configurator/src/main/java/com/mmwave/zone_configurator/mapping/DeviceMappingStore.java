package com.mmwave.zone_configurator.mapping;

import java.util.List;
import java.util.Optional;

public interface DeviceMappingStore {

  Optional<DeviceMapping> find(String deviceId);

  DeviceMapping save(DeviceMapping mapping);

  boolean delete(String deviceId);

  List<DeviceMapping> findAll();
}
