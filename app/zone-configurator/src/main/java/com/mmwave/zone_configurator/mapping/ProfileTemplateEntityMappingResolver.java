/*
 * どこで: Zone Configurator エンティティ解決
 * 何を: 保存済みマッピング、クライアント送信マッピング、命名テンプレートの順にエンティティ ID を決める
 * なぜ: マッピング未登録のデバイスでも命名規約から live 表示できるようにするため
 */
package com.mmwave.zone_configurator.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ProfileTemplateEntityMappingResolver implements EntityMappingResolver {

  private static final Logger logger =
      LoggerFactory.getLogger(ProfileTemplateEntityMappingResolver.class);

  static final List<String> TARGET_PROPERTIES =
      List.of("x", "y", "distance", "speed", "angle", "resolution", "active");

  private static final Pattern DOMAIN_PREFIX = Pattern.compile("^(sensor|binary_sensor|number)\\.");
  private static final Pattern DEVICE_SUFFIX =
      Pattern.compile("(_occupancy|_mmwave_target_distance)$");
  private static final String NAME_PLACEHOLDER = "{name}";

  private final DeviceProfileCatalog profiles;
  private final DeviceMappingStore mappingStore;

  @Override
  public EntityResolution resolveEntitiesForDevice(EntityResolutionRequest request) {
    final DeviceProfile profile =
        profiles
            .findById(request.profileId())
            .orElseThrow(() -> new EntityResolutionException("Profile not found"));
    final String prefix = resolvePrefix(request);
    if (prefix == null || prefix.isBlank()) {
      throw new EntityResolutionException("Could not determine entity name prefix");
    }
    final Optional<DeviceMapping> stored = mappingStore.find(request.deviceId());
    final JsonNode legacy = usable(request.legacyMappings());
    final Set<String> entityIds = new LinkedHashSet<>();
    for (Map.Entry<String, String> template : profile.entityTemplates().entrySet()) {
      add(
          entityIds,
          stored.map(mapping -> mapping.entities().get(template.getKey())).orElse(null),
          text(legacy, template.getKey()),
          template.getValue().replace(NAME_PLACEHOLDER, prefix));
    }
    for (int target = 1; target <= profile.trackingTargets(); target++) {
      final String targetKey = "target" + target;
      for (String property : TARGET_PROPERTIES) {
        add(
            entityIds,
            stored
                .map(mapping -> mapping.trackingTargets().get(targetKey))
                .map(properties -> properties.get(property))
                .orElse(null),
            text(legacy, "trackingTargets." + targetKey + "." + property),
            targetEntityId(prefix, target, property));
      }
    }
    final boolean hasMappings = stored.isPresent() || legacy != null;
    logger.debug(
        "entities resolved deviceId={} profileId={} prefix={} count={} hasMappings={}",
        request.deviceId(),
        profile.id(),
        prefix,
        entityIds.size(),
        hasMappings);
    return new EntityResolution(entityIds, hasMappings);
  }

  static String targetEntityId(String prefix, int target, String property) {
    final String domain = "active".equals(property) ? "binary_sensor" : "sensor";
    return domain + "." + prefix + "_target_" + target + "_" + property;
  }

  static String derivePrefix(String deviceId) {
    if (deviceId == null) {
      return null;
    }
    final String withoutDomain = DOMAIN_PREFIX.matcher(deviceId).replaceFirst("");
    return DEVICE_SUFFIX.matcher(withoutDomain).replaceFirst("");
  }

  private String resolvePrefix(EntityResolutionRequest request) {
    if (request.entityNamePrefix() != null && !request.entityNamePrefix().isBlank()) {
      return request.entityNamePrefix().trim();
    }
    return derivePrefix(request.deviceId());
  }

  private static void add(Set<String> entityIds, String stored, String legacy, String fallback) {
    if (stored != null && !stored.isBlank()) {
      entityIds.add(stored);
    } else if (legacy != null && !legacy.isBlank()) {
      entityIds.add(legacy);
    } else {
      entityIds.add(fallback);
    }
  }

  private static JsonNode usable(JsonNode legacy) {
    return legacy != null && legacy.isObject() && !legacy.isEmpty() ? legacy : null;
  }

  // "a.b.c" のような入れ子キーを辿る
  private static String text(JsonNode legacy, String dottedKey) {
    if (legacy == null) {
      return null;
    }
    JsonNode current = legacy;
    for (String part : dottedKey.split("\\.")) {
      current = current.path(part);
    }
    return current.isTextual() ? current.asText() : null;
  }
}
