package com.mmwave.zone_configurator.mapping;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record EntityResolution(Set<String> entityIds, boolean hasMappings) {

  public EntityResolution {
    entityIds =
        entityIds == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(entityIds));
  }
}
