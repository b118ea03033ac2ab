package com.mmwave.zone_configurator.live.message;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Map;

// 初期取得に失敗したときは initialStates を省く
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubscribedMessage(
    String type,
    String deviceId,
    String profileId,
    List<String> entities,
    Map<String, LiveEntityState> initialStates,
    boolean hasMappings) {

  public static SubscribedMessage of(
      String deviceId,
      String profileId,
      List<String> entities,
      Map<String, LiveEntityState> initialStates,
      boolean hasMappings) {
    return new SubscribedMessage(
        "subscribed", deviceId, profileId, entities, initialStates, hasMappings);
  }
}
