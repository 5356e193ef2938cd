package com.manufacturing.semanticlayer.config;

import jakarta.persistence.EntityManagerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * JPA Configuration
 * The catalog lives in PostgreSQL and is only ever read; its transaction
 * manager is the primary one so plain {@code @Transactional} resolves to it.
 */
@Configuration
@EnableJpaRepositories(
    basePackages = "com.manufacturing.semanticlayer.repository",
    transactionManagerRef = "transactionManager"
)
public class JpaConfig {

    @Primary
    @Bean(name = "transactionManager")
    public PlatformTransactionManager transactionManager(EntityManagerFactory entityManagerFactory) {
        return new JpaTransactionManager(entityManagerFactory);
    }
}
