package com.mmwave.zone_configurator.live.message;

public record ErrorMessage(String type, String error) {

  public static ErrorMessage of(String error) {
    return new ErrorMessage("error", error);
  }
}
