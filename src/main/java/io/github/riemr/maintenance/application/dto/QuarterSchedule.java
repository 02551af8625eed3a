package io.github.riemr.maintenance.application.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuarterSchedule {
    private int index;
    private String label;
    private int month;
    private LocalDate anchorDate;
    private boolean winter;
    @Builder.Default
    private List<Visit> visits = new ArrayList<>();
    @Builder.Default
    private BigDecimal total = BigDecimal.ZERO;
}
