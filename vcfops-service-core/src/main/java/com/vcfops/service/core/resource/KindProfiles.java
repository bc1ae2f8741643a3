package com.vcfops.service.core.resource;

import com.vcfops.service.core.config.VcfOperationsProperties;
import java.util.EnumMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class KindProfiles {
    private final Map<ResourceType, KindProfile> profiles;

    public KindProfiles(Map<ResourceType, KindProfile> profiles) {
        this.profiles = profiles.isEmpty() ? new EnumMap<>(ResourceType.class) : new EnumMap<>(profiles);
    }

    public static KindProfiles defaults() {
        return fromProperties(new VcfOperationsProperties());
    }

    public static KindProfiles fromProperties(VcfOperationsProperties properties) {
        Map<ResourceType, KindProfile> out = new EnumMap<>(ResourceType.class);
        if (properties.getKindProfiles() != null) {
            properties.getKindProfiles().forEach((key, raw) -> {
                ResourceType type = ResourceType.fromValue(key);
                if (type == ResourceType.GENERAL) {
                    log.warn("Ignoring kind profile for unknown resource type '{}'", key);
                    return;
                }
                out.put(type, new KindProfile(raw.getAdapterKinds(), raw.getResourceKinds()));
            });
        }
        return new KindProfiles(out);
    }

    public KindProfile profile(ResourceType type) {
        return profiles.getOrDefault(type, KindProfile.NONE);
    }
}
