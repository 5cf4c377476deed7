package io.github.samzhu.advisor.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link AdvisorProperties} 的型別安全配置綁定，
 * 使服務可以透過 constructor injection 取得配置值。
 *
 * <p>同時提供 UTC {@link Clock}，所有時間視窗與建議到期判斷都由它取得「現在」。
 *
 * @see AdvisorProperties
 */
@Configuration
@EnableConfigurationProperties(AdvisorProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
