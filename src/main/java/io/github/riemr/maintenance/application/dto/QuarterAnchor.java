package io.github.riemr.maintenance.application.dto;

import java.time.LocalDate;

/**
 * 契約年の四半期の起点。
 *
 * @param index      1..4
 * @param label      "NOV Qtr 1" 形式
 * @param month      1..12
 * @param anchorDate 四半期月の1日（年繰り越し済み）
 */
public record QuarterAnchor(int index, String label, int month, LocalDate anchorDate) {
}
