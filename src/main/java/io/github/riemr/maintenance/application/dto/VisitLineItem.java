package io.github.riemr.maintenance.application.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnore;

import io.github.riemr.maintenance.domain.model.ServiceAssignment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisitLineItem {
    private String unitId;
    private String unitName;
    private double kw;
    private String serviceCode;
    private String serviceName;
    private int frequency;
    private double hours;
    private BigDecimal cost;
    private boolean heavy;
    private boolean weatherSensitive;

    @JsonIgnore
    private ServiceAssignment source;
}
