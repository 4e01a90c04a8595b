/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: 同期時刻や geocoded_at をテストで固定できるようにするため
 */
package com.trackit.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
