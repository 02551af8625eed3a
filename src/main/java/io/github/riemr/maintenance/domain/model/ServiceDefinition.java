package io.github.riemr.maintenance.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ServiceDefinition {
    String code;
    String name;
    int defaultFrequency; // 1 | 2 | 4
    boolean weatherSensitive;
}
