package io.github.riemr.maintenance.application.service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import io.github.riemr.maintenance.application.dto.QuarterAnchor;
import io.github.riemr.maintenance.application.util.QuarterMonthUtils;
import lombok.RequiredArgsConstructor;

/**
 * 契約開始日から契約年の4四半期（月・ラベル・起点日）を導出する。
 * 初回サービス月は開始月の翌月、以降3か月おき。
 */
@Service
@RequiredArgsConstructor
public class ContractCalendarService {

    private final Clock clock;

    public LocalDate resolveStartDate(LocalDate startDate) {
        return startDate != null ? startDate : LocalDate.now(clock);
    }

    public List<QuarterAnchor> generateQuarters(LocalDate startDate) {
        LocalDate start = resolveStartDate(startDate);
        int firstMonth = QuarterMonthUtils.firstServiceMonth(start);
        YearMonth firstServiceMonth = YearMonth.from(start).plusMonths(1);

        List<QuarterAnchor> quarters = new ArrayList<>(QuarterMonthUtils.QUARTERS_PER_YEAR);
        for (int i = 1; i <= QuarterMonthUtils.QUARTERS_PER_YEAR; i++) {
            int month = QuarterMonthUtils.quarterMonth(firstMonth, i);
            // 年跨ぎは YearMonth 側で処理
            LocalDate anchor = firstServiceMonth.plusMonths((long) QuarterMonthUtils.MONTHS_PER_QUARTER * (i - 1)).atDay(1);
            quarters.add(new QuarterAnchor(i, QuarterMonthUtils.quarterLabel(month, i), month, anchor));
        }
        return quarters;
    }
}
