package io.github.riemr.maintenance.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public final class WeatherProfileRegistry {

    private final Map<String, WeatherProfile> profiles;
    private final WeatherProfile defaultProfile;

    public WeatherProfileRegistry(Collection<WeatherProfile> profiles, String defaultKey) {
        Map<String, WeatherProfile> map = new LinkedHashMap<>();
        for (WeatherProfile p : profiles) {
            map.put(normalizeKey(p.key()), p);
        }
        this.profiles = Collections.unmodifiableMap(map);
        this.defaultProfile = this.profiles.get(normalizeKey(defaultKey));
        if (this.defaultProfile == null) {
            throw new IllegalArgumentException("default weather profile not registered: " + defaultKey);
        }
    }

    public Optional<WeatherProfile> find(String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        return Optional.ofNullable(profiles.get(normalizeKey(key)));
    }

    public WeatherProfile getDefaultProfile() {
        return defaultProfile;
    }

    private static String normalizeKey(String key) {
        return key == null ? null : key.trim().toUpperCase(Locale.ROOT);
    }
}
