package com.sibol.contract_ledger.observability;

import com.sibol.contract_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the parts of the service the default actuator checks do not cover.
 */
public class HealthIndicators {

    /**
     * Outbox backlog. WARNING above the warning threshold, DOWN above the critical one: at
     * that point consumers are falling far behind the ledger.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private final OutboxEventRepository outboxRepository;
        private final long warningThreshold;
        private final long criticalThreshold;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.health.warning-threshold:1000}") long warningThreshold,
                                     @Value("${outbox.health.critical-threshold:10000}") long criticalThreshold) {
            this.outboxRepository = outboxRepository;
            this.warningThreshold = warningThreshold;
            this.criticalThreshold = criticalThreshold;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < warningThreshold
                        ? Health.up()
                        : backlogSize < criticalThreshold
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", warningThreshold)
                        .withDetail("criticalThreshold", criticalThreshold)
                        .build();
            } catch (RuntimeException e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the idempotency fast path, so losing it degrades the service rather
     * than taking it down.
     */
    @Component("idempotencyCacheHealth")
    @ConditionalOnBean(StringRedisTemplate.class)
    public static class IdempotencyCacheHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public IdempotencyCacheHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : degraded("Unexpected ping response: " + result);
                }
            } catch (RuntimeException e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "External references are checked against the database")
                    .build();
        }
    }
}
