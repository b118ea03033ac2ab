package com.mmwave.zone_configurator.mapping;

// メッセージはそのまま live クライアントへ返す
public class EntityResolutionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public EntityResolutionException(String message) {
    super(message);
  }
}
