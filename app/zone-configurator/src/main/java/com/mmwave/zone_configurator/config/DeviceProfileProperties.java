/*
 * どこで: Zone Configurator 設定
 * 何を: デバイスプロファイル (エンティティテンプレート) を保持する
 * なぜ: モデルごとのエンティティ命名規則をコード外で管理するため
 */
package com.mmwave.zone_configurator.config;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "zone-configurator.device")
public record DeviceProfileProperties(Map<String, Profile> profiles) {

  public DeviceProfileProperties {
    profiles = profiles == null ? Map.of() : Map.copyOf(profiles);
  }

  public record Profile(String label, Map<String, String> entities, Integer trackingTargets) {

    public Profile {
      label = label == null ? "" : label;
      entities = entities == null ? Map.of() : Map.copyOf(entities);
      trackingTargets = trackingTargets == null || trackingTargets < 0 ? 0 : trackingTargets;
    }
  }
}
