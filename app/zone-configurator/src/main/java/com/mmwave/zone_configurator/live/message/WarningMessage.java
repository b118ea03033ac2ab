package com.mmwave.zone_configurator.live.message;

public record WarningMessage(String type, String code, String message, String deviceId) {

  public static final String MAPPING_NOT_FOUND = "MAPPING_NOT_FOUND";

  public static WarningMessage mappingNotFound(String deviceId) {
    return new WarningMessage(
        "warning",
        MAPPING_NOT_FOUND,
        "No entity mappings found for this device. Run entity discovery to auto-match entities.",
        deviceId);
  }
}
