package com.mmwave.zone_configurator.api;

public class DeviceMappingNotFoundException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public DeviceMappingNotFoundException(String deviceId) {
    super("no entity mapping stored for device " + deviceId);
  }
}
