package io.github.riemr.maintenance.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GeneratorUnit {
    String id;
    String name;
    double kw;
    String fuelType;
    String site;

    public String getDisplayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
