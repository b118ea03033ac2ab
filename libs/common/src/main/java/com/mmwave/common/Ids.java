package com.mmwave.common;

import java.util.UUID;

public final class Ids {
  private Ids() {}

  public static String newRequestId() {
    return UUID.randomUUID().toString();
  }

  public static String newSubscriptionId() {
    return UUID.randomUUID().toString();
  }

  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
