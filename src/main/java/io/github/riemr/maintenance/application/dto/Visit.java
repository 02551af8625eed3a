package io.github.riemr.maintenance.application.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/**
 * 1日・1クルーの出動単位。
 */
@Data
public class Visit {
    private int quarter;
    private int day;
    private LocalDate date; // 天候待ちの場合は null（TBD）
    private List<VisitLineItem> items = new ArrayList<>();
    private double totalHours;
    private BigDecimal totalCost = BigDecimal.ZERO;
    private boolean overCapacity;
    private List<String> notes = new ArrayList<>();

    public void addItem(VisitLineItem item) {
        items.add(item);
        totalHours += item.getHours();
    }

    public boolean hasWeatherSensitiveItem() {
        return items.stream().anyMatch(VisitLineItem::isWeatherSensitive);
    }
}
