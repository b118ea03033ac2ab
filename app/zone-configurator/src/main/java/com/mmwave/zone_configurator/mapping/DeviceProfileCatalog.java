package com.mmwave.zone_configurator.mapping;

import com.mmwave.zone_configurator.config.DeviceProfileProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class DeviceProfileCatalog {

  private static final Logger logger = LoggerFactory.getLogger(DeviceProfileCatalog.class);

  private final Map<String, DeviceProfile> profiles;

  public DeviceProfileCatalog(DeviceProfileProperties properties) {
    final Map<String, DeviceProfile> loaded = new LinkedHashMap<>();
    properties
        .profiles()
        .forEach(
            (id, profile) ->
                loaded.put(
                    id,
                    new DeviceProfile(
                        id, profile.label(), profile.entities(), profile.trackingTargets())));
    this.profiles = Map.copyOf(loaded);
    logger.info("device profiles loaded count={} ids={}", profiles.size(), profiles.keySet());
  }

  public Optional<DeviceProfile> findById(String profileId) {
    return profileId == null ? Optional.empty() : Optional.ofNullable(profiles.get(profileId));
  }

  public List<DeviceProfile> all() {
    return List.copyOf(profiles.values());
  }
}
