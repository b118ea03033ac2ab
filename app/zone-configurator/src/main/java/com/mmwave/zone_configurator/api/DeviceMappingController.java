package com.mmwave.zone_configurator.api;

import com.mmwave.zone_configurator.api.request.DeviceMappingRequest;
import com.mmwave.zone_configurator.api.response.DeviceMappingResponse;
import com.mmwave.zone_configurator.mapping.DeviceMapping;
import com.mmwave.zone_configurator.mapping.DeviceMappingStore;
import jakarta.validation.Valid;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/device-mappings")
@RequiredArgsConstructor
public class DeviceMappingController {

  private static final Logger logger = LoggerFactory.getLogger(DeviceMappingController.class);

  private final DeviceMappingStore mappingStore;
  private final Clock clock;

  @GetMapping("/{deviceId}")
  public DeviceMappingResponse get(@PathVariable("deviceId") String deviceId) {
    return mappingStore
        .find(deviceId)
        .map(DeviceMappingController::toResponse)
        .orElseThrow(() -> new DeviceMappingNotFoundException(deviceId));
  }

  @PutMapping("/{deviceId}")
  public DeviceMappingResponse put(
      @PathVariable("deviceId") String deviceId,
      @Valid @RequestBody DeviceMappingRequest request) {
    final DeviceMapping saved =
        mappingStore.save(
            new DeviceMapping(
                deviceId,
                request.profileId(),
                request.entities(),
                request.trackingTargets(),
                clock.instant()));
    logger.info(
        "device mapping saved deviceId={} profileId={} entityCount={}",
        deviceId,
        saved.profileId(),
        saved.entities().size());
    return toResponse(saved);
  }

  @DeleteMapping("/{deviceId}")
  public ResponseEntity<Void> delete(@PathVariable("deviceId") String deviceId) {
    if (!mappingStore.delete(deviceId)) {
      throw new DeviceMappingNotFoundException(deviceId);
    }
    logger.info("device mapping deleted deviceId={}", deviceId);
    return ResponseEntity.noContent().build();
  }

  private static DeviceMappingResponse toResponse(DeviceMapping mapping) {
    return new DeviceMappingResponse(
        mapping.deviceId(),
        mapping.profileId(),
        mapping.entities(),
        mapping.trackingTargets(),
        mapping.updatedAt().toString());
  }
}
