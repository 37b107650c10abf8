package com.motaz.rfm.api.config;

import com.redis.om.spring.annotations.EnableRedisDocumentRepositories;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * JPA entities and repositories live in the rfm-train module, the Redis documents here.
 * Kept off the application class so web slice tests start without a database.
 */
@Configuration
@EntityScan("com.motaz.rfm.training.model")
@EnableJpaRepositories("com.motaz.rfm.training.repository")
@EnableRedisDocumentRepositories(basePackages = "com.motaz.rfm.api.repositories")
public class PersistenceConfig {
}
