package io.github.samzhu.costlens.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link CostLensProperties} 的型別安全配置綁定，
 * 使服務可以透過 constructor injection 取得預設門檻值。
 *
 * @see CostLensProperties
 */
@Configuration
@EnableConfigurationProperties(CostLensProperties.class)
public class AppConfig {
}
