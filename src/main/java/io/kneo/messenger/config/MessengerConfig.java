package io.kneo.messenger.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

@ConfigMapping(prefix = "messenger")
public interface MessengerConfig {

    @WithName("message.max-length")
    @WithDefault("4096")
    int getMaxMessageLength();

    @WithName("persistence.max-attempts")
    @WithDefault("3")
    int getPersistenceMaxAttempts();

    @WithName("persistence.initial-backoff-millis")
    @WithDefault("50")
    long getPersistenceInitialBackoffMillis();

    @WithName("persistence.max-backoff-millis")
    @WithDefault("500")
    long getPersistenceMaxBackoffMillis();

    @WithName("delivery.queue-capacity")
    @WithDefault("256")
    int getOutboundQueueCapacity();

    // frames kept above capacity during the grace period; one more evicts the connection at once
    @WithName("delivery.overflow-limit")
    @WithDefault("256")
    int getOutboundQueueOverflowLimit();

    // how long an outbound queue may stay above capacity before the connection is dropped
    @WithName("delivery.slow-consumer-grace-millis")
    @WithDefault("5000")
    long getSlowConsumerGraceMillis();

    @WithName("history.page-size")
    @WithDefault("100")
    int getHistoryPageSize();

    @WithName("auth.jwt-secret")
    @WithDefault("access_secret_key_change_me_in_production")
    String getJwtSecret();

    @WithName("db.init-schema")
    @WithDefault("true")
    boolean isSchemaInitEnabled();
}
