package com.myorg.hitl.store.jdbc;

import com.myorg.hitl.store.TicketIntake;
import com.myorg.hitl.store.TicketStore;
import com.myorg.hitl.store.TicketTransitionEngine;
import com.myorg.hitl.store.memory.InMemoryTicketStore;
import org.flywaydb.core.Flyway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.autoconfigure.flyway.FlywayConfigurationCustomizer;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

@AutoConfiguration(after = {
        DataSourceAutoConfiguration.class,
        JdbcTemplateAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class,
        FlywayAutoConfiguration.class
})
@EnableConfigurationProperties(HitlStoreProperties.class)
public class HitlStoreAutoConfiguration {

    public static final String TX_BEAN = "hitlTransactionOperations";

    @Bean
    @ConditionalOnMissingBean
    public Clock hitlClock() {
        return Clock.systemUTC();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JdbcTemplate.class)
    @ConditionalOnBean(JdbcTemplate.class)
    @ConditionalOnProperty(prefix = "hitl.store", name = "backend", havingValue = "jdbc", matchIfMissing = true)
    static class JdbcStoreConfig {

        @Bean(name = TX_BEAN)
        @ConditionalOnMissingBean(name = TX_BEAN)
        public TransactionTemplate hitlTxTemplate(PlatformTransactionManager txManager) {
            return new TransactionTemplate(txManager);
        }

        @Bean
        @ConditionalOnMissingBean(TicketStore.class)
        public JdbcTicketStore jdbcTicketStore(JdbcTemplate jdbc,
                                               @Qualifier(TX_BEAN) TransactionOperations tx,
                                               HitlStoreProperties props,
                                               Clock clock) {
            return new JdbcTicketStore(jdbc, tx, props, clock);
        }

        @Bean
        @ConditionalOnMissingBean
        public JdbcClaimQueue jdbcClaimQueue(JdbcTemplate jdbc,
                                             @Qualifier(TX_BEAN) TransactionOperations tx,
                                             HitlStoreProperties props,
                                             Clock clock) {
            return new JdbcClaimQueue(jdbc, tx, props, clock);
        }
    }

    /** Feeds the configured table prefix into the shipped migration. */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Flyway.class)
    @ConditionalOnProperty(prefix = "hitl.store", name = "backend", havingValue = "jdbc", matchIfMissing = true)
    static class FlywayPrefixConfig {

        @Bean
        public FlywayConfigurationCustomizer hitlTablePrefixCustomizer(HitlStoreProperties props) {
            String prefix = TicketRows.checkedPrefix(props);
            return configuration -> {
                Map<String, String> placeholders = new HashMap<>(configuration.getPlaceholders());
                placeholders.put(TicketRows.PREFIX_PLACEHOLDER, prefix);
                configuration.placeholders(placeholders);
            };
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "hitl.store", name = "backend", havingValue = "memory")
    static class MemoryStoreConfig {

        @Bean
        @ConditionalOnMissingBean(TicketStore.class)
        public InMemoryTicketStore inMemoryTicketStore(HitlStoreProperties props, Clock clock) {
            return new InMemoryTicketStore(clock, props.getLease());
        }

        @Bean(name = TX_BEAN)
        @ConditionalOnMissingBean(name = TX_BEAN)
        public TransactionOperations hitlInMemoryTx(InMemoryTicketStore store) {
            return store.transactionOperations();
        }
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TicketStore.class)
    public TicketTransitionEngine ticketTransitionEngine(TicketStore store,
                                                         @Qualifier(TX_BEAN) TransactionOperations tx,
                                                         Clock clock) {
        return new TicketTransitionEngine(store, tx, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TicketStore.class)
    public TicketIntake ticketIntake(TicketStore store, Clock clock) {
        return new TicketIntake(store, clock);
    }
}
