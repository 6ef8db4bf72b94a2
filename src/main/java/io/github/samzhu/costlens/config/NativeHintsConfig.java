package io.github.samzhu.costlens.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.costlens.dto.RawCostRecord;
import io.github.samzhu.costlens.dto.api.CostAnalysisRequest;
import io.github.samzhu.costlens.dto.api.ErrorResponse;
import io.github.samzhu.costlens.dto.api.RatioRequest;
import io.github.samzhu.costlens.dto.api.RollingAverageRequest;
import io.github.samzhu.costlens.dto.api.RollingAverageResponse;
import io.github.samzhu.costlens.model.Aggregate;
import io.github.samzhu.costlens.model.AnomalyEvent;
import io.github.samzhu.costlens.model.CostAnalysisReport;
import io.github.samzhu.costlens.model.CostDistribution;
import io.github.samzhu.costlens.model.DimensionAnalysis;
import io.github.samzhu.costlens.model.PeakDay;
import io.github.samzhu.costlens.model.RankedBreakdown;
import io.github.samzhu.costlens.model.RatioClassification;
import io.github.samzhu.costlens.model.RollingAverage;
import io.github.samzhu.costlens.model.TrendResult;
import io.github.samzhu.costlens.model.Window;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>請求與回應都是 record，由 Jackson 透過反射讀寫；
 * Native Image 無法在編譯時期推斷這些存取，需在此註冊。
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.CostLensRuntimeHints.class)
public class NativeHintsConfig {

    static class CostLensRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            // 請求 DTO
            hints.reflection()
                .registerType(RawCostRecord.class, MemberCategory.values())
                .registerType(CostAnalysisRequest.class, MemberCategory.values())
                .registerType(RollingAverageRequest.class, MemberCategory.values())
                .registerType(RatioRequest.class, MemberCategory.values());

            // 回應
            hints.reflection()
                .registerType(CostAnalysisReport.class, MemberCategory.values())
                .registerType(DimensionAnalysis.class, MemberCategory.values())
                .registerType(Window.class, MemberCategory.values())
                .registerType(Aggregate.class, MemberCategory.values())
                .registerType(TrendResult.class, MemberCategory.values())
                .registerType(AnomalyEvent.class, MemberCategory.values())
                .registerType(PeakDay.class, MemberCategory.values())
                .registerType(RankedBreakdown.class, MemberCategory.values())
                .registerType(RankedBreakdown.Entry.class, MemberCategory.values())
                .registerType(RatioClassification.class, MemberCategory.values())
                .registerType(CostDistribution.class, MemberCategory.values())
                .registerType(RollingAverage.class, MemberCategory.values())
                .registerType(RollingAverageResponse.class, MemberCategory.values())
                .registerType(ErrorResponse.class, MemberCategory.values());
        }
    }
}
