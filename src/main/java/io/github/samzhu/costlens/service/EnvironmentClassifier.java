package io.github.samzhu.costlens.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import io.github.samzhu.costlens.config.CostLensProperties;
import io.github.samzhu.costlens.model.Aggregate;

/**
 * 依維度鍵辨識正式 / 非正式環境。
 *
 * <p>維度鍵轉大寫後包含任一設定標記（預設 UAT、TEST、DEV、STAGING）即視為非正式環境。
 */
@Component
public class EnvironmentClassifier {

    private final List<String> markers;

    public EnvironmentClassifier(CostLensProperties properties) {
        this.markers = properties.environment().nonProductionMarkers().stream()
            .map(marker -> marker.toUpperCase(Locale.ROOT))
            .toList();
    }

    /**
     * 判斷維度是否屬於非正式環境。
     */
    public boolean isNonProduction(String dimensionKey) {
        String upper = dimensionKey.toUpperCase(Locale.ROOT);
        return markers.stream().anyMatch(upper::contains);
    }

    /**
     * 將聚合依環境拆成兩組並加總。
     *
     * @param aggregates 各維度聚合
     * @return 非正式與正式環境總額
     */
    public EnvironmentSplit split(Collection<Aggregate> aggregates) {
        BigDecimal nonProduction = BigDecimal.ZERO;
        BigDecimal production = BigDecimal.ZERO;
        List<String> nonProductionKeys = new ArrayList<>();
        for (Aggregate aggregate : aggregates) {
            if (isNonProduction(aggregate.dimensionKey())) {
                nonProduction = nonProduction.add(aggregate.total());
                nonProductionKeys.add(aggregate.dimensionKey());
            } else {
                production = production.add(aggregate.total());
            }
        }
        return new EnvironmentSplit(nonProduction, production, List.copyOf(nonProductionKeys));
    }

    /**
     * 環境拆分結果。
     *
     * @param nonProductionTotal 非正式環境總額
     * @param productionTotal 正式環境總額
     * @param nonProductionKeys 被歸為非正式環境的維度鍵
     */
    public record EnvironmentSplit(
        BigDecimal nonProductionTotal,
        BigDecimal productionTotal,
        List<String> nonProductionKeys
    ) {}
}
