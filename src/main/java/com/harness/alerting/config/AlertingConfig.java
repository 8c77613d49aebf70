package com.harness.alerting.config;

import com.harness.alerting.pipeline.queue.EventBus;
import com.harness.alerting.pipeline.queue.InMemoryEventBus;
import java.time.Clock;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AlertingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public EventBus eventBus(
      @Value("${alerting.queue.realtime-capacity:10000}") int realtimeCapacity,
      @Value("${alerting.queue.archive-capacity:50000}") int archiveCapacity) {
    return new InMemoryEventBus(realtimeCapacity, archiveCapacity);
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnProperty(name = "alerting.buffer.mode", havingValue = "redis")
  public RedissonClient redissonClient(
      @Value("${alerting.buffer.redis-address:redis://localhost:6379}") String address) {
    Config config = new Config();
    config.useSingleServer().setAddress(address);
    return Redisson.create(config);
  }
}
