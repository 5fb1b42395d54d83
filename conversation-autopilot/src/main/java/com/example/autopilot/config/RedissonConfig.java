package com.example.autopilot.config;

import java.time.Duration;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
public class RedissonConfig {

    /**
     * Redisson backs the per-conversation locks and the listing profile bucket. The lock watchdog
     * keeps a lock alive while its holder runs, so a crashed node releases it after the timeout.
     */
    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(
            RedisProperties redisProperties,
            @Value("${autopilot.redis.lock-watchdog-timeout:PT30S}") Duration lockWatchdogTimeout) {
        Config config = new Config();
        config.setLockWatchdogTimeout(lockWatchdogTimeout.toMillis());
        config.useSingleServer()
                .setAddress(address(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setUsername(redisProperties.getUsername())
                .setPassword(StringUtils.hasText(redisProperties.getPassword()) ? redisProperties.getPassword() : null)
                .setRetryAttempts(3)
                .setRetryInterval(500);
        return Redisson.create(config);
    }

    private String address(RedisProperties redisProperties) {
        boolean ssl = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return (ssl ? "rediss://" : "redis://") + redisProperties.getHost() + ":" + redisProperties.getPort();
    }
}
