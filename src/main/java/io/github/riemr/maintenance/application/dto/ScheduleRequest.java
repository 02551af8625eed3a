package io.github.riemr.maintenance.application.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import io.github.riemr.maintenance.domain.model.Contract;
import io.github.riemr.maintenance.domain.model.GeneratorUnit;
import io.github.riemr.maintenance.domain.model.SchedulingPolicy;
import io.github.riemr.maintenance.domain.model.ServiceAssignment;
import io.github.riemr.maintenance.util.ServiceCodes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

/**
 * 見積画面/API からの契約入力。スケジューラ呼び出し前にここで検証する。
 */
@Data
public class ScheduleRequest {

    private String startDate; // yyyy-MM-dd。未指定・解釈不能は当日

    @Positive(message = "crewSize must be positive")
    private Integer crewSize;

    @Positive(message = "hoursPerTechnician must be positive")
    private Double hoursPerTechnician;

    private String weatherProfile;

    @NotEmpty(message = "units is required")
    @Valid
    private List<UnitRequest> units = new ArrayList<>();

    @Data
    public static class UnitRequest {
        @NotBlank(message = "unit id is required")
        private String id;
        private String name;
        @NotNull(message = "kw is required")
        @PositiveOrZero(message = "kw must not be negative")
        private Double kw;
        private String fuelType;
        private String site;
        @Valid
        private List<ServiceRequest> services = new ArrayList<>();
    }

    @Data
    public static class ServiceRequest {
        @NotBlank(message = "service code is required")
        private String code;
        private String description; // CUSTOM 用
        private Integer frequency;
        @PositiveOrZero(message = "cost must not be negative")
        private BigDecimal cost;
    }

    /* -------- Request ⇒ Domain 変換 -------- */

    /** ISO 形式の開始日。空・解釈不能な値は null を返す（スケジューラ側で当日扱い）。 */
    public LocalDate parseStartDate() {
        if (startDate == null || startDate.isBlank()) return null;
        try {
            return LocalDate.parse(startDate.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public boolean hasInvalidStartDate() {
        return startDate != null && !startDate.isBlank() && parseStartDate() == null;
    }

    public Contract toContract(SchedulingPolicy policy) {
        return Contract.builder()
                .startDate(parseStartDate())
                .crewSize(crewSize != null ? crewSize : policy.getDefaultCrewSize())
                .hoursPerTechnician(hoursPerTechnician != null ? hoursPerTechnician : policy.getDefaultHoursPerTechnician())
                .weatherProfileKey(weatherProfile)
                .build();
    }

    public List<ServiceAssignment> toAssignments() {
        List<ServiceAssignment> assignments = new ArrayList<>();
        for (UnitRequest u : units) {
            GeneratorUnit unit = GeneratorUnit.builder()
                    .id(u.getId())
                    .name(u.getName())
                    .kw(u.getKw())
                    .fuelType(u.getFuelType())
                    .site(u.getSite())
                    .build();
            if (u.getServices() == null) continue;
            for (ServiceRequest s : u.getServices()) {
                String code = ServiceCodes.normalize(s.getCode());
                assignments.add(ServiceAssignment.builder()
                        .unit(unit)
                        .serviceCode(code)
                        .serviceName(s.getDescription())
                        .frequency(s.getFrequency())
                        .occurrenceCost(s.getCost())
                        .build());
            }
        }
        return assignments;
    }
}
