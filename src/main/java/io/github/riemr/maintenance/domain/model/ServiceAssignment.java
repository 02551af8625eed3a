package io.github.riemr.maintenance.domain.model;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

/**
 * 見積時に確定したユニット×サービスの契約。スケジューラへの不変入力。
 */
@Value
@Builder
public class ServiceAssignment {
    GeneratorUnit unit;
    String serviceCode;
    String serviceName;       // CUSTOM の説明文など。null ならカタログ名
    Integer frequency;        // 年間回数。1/2/4 以外・未設定は年1回
    BigDecimal occurrenceCost; // 1回あたり費用（外部見積エンジン算出）。未設定は 0

    public int getEffectiveFrequency() {
        if (frequency == null) return 1;
        switch (frequency) {
            case 2:
            case 4:
                return frequency;
            default:
                return 1;
        }
    }

    public BigDecimal getEffectiveCost() {
        return occurrenceCost == null ? BigDecimal.ZERO : occurrenceCost;
    }
}
