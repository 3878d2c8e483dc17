package com.example.admission.config;

import com.example.admission.quota.InMemoryQuotaCounterStore;
import com.example.admission.quota.QuotaCounterStore;
import com.example.admission.quota.RedisQuotaCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.time.Clock;

@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    /**
     * Checks every expected counter value and, if none moved, increments the global and
     * environment counters and refreshes their expiry. Returns 1 on commit, 0 on conflict.
     */
    @Bean
    public DefaultRedisScript<Long> quotaCompareAndIncrementScript() {
        return script("lua/quota_compare_and_increment.lua");
    }

    /**
     * Zeroes one environment's counter and subtracts its usage from the global counter.
     */
    @Bean
    public DefaultRedisScript<Long> quotaResetEnvironmentScript() {
        return script("lua/quota_reset_environment.lua");
    }

    @Bean
    public QuotaCounterStore quotaCounterStore(
            AdmissionProperties properties,
            StringRedisTemplate stringRedisTemplate,
            DefaultRedisScript<Long> quotaCompareAndIncrementScript,
            DefaultRedisScript<Long> quotaResetEnvironmentScript,
            Clock clock
    ) {
        AdmissionProperties.Quota quota = properties.getQuota();
        if (quota.getStore() == AdmissionProperties.StoreType.IN_MEMORY) {
            log.warn("admission.quota.store=in-memory: the daily limit of {} is only enforced within this process",
                    quota.getProvider());
            return new InMemoryQuotaCounterStore(clock, quota.getKeyTtl());
        }
        return new RedisQuotaCounterStore(stringRedisTemplate, quotaCompareAndIncrementScript,
                quotaResetEnvironmentScript, quota.getKeyTtl());
    }

    /**
     * UTC clock shared by quota day boundaries, rate limit windows and breaker timeouts.
     * Tests replace it with a controllable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private static DefaultRedisScript<Long> script(String location) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource(location));
        script.setResultType(Long.class);
        return script;
    }
}
