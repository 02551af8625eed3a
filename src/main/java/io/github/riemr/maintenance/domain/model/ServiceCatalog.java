package io.github.riemr.maintenance.domain.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.github.riemr.maintenance.util.ServiceCodes;

/**
 * サービス定義の一覧（不変）。
 */
public final class ServiceCatalog {

    private final Map<String, ServiceDefinition> definitions;

    public ServiceCatalog(Collection<ServiceDefinition> definitions) {
        Map<String, ServiceDefinition> map = new LinkedHashMap<>();
        for (ServiceDefinition d : definitions) {
            map.put(ServiceCodes.normalize(d.getCode()), d);
        }
        this.definitions = Collections.unmodifiableMap(map);
    }

    public Optional<ServiceDefinition> find(String code) {
        return Optional.ofNullable(definitions.get(ServiceCodes.normalize(code)));
    }

    public String nameOf(String code) {
        return find(code).map(ServiceDefinition::getName).orElse("Service " + code);
    }

    public boolean isWeatherSensitive(String code) {
        return find(code).map(ServiceDefinition::isWeatherSensitive).orElse(false);
    }

    public List<ServiceDefinition> all() {
        return List.copyOf(definitions.values());
    }
}
