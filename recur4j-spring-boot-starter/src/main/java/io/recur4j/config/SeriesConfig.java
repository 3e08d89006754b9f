package io.recur4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.recur4j.InstanceCreatedHook;
import io.recur4j.JobSeries;
import io.recur4j.core.InstanceHookRegistry;
import io.recur4j.internal.mongo.CallReminderHook;
import io.recur4j.internal.mongo.MongoJobSeries;
import io.recur4j.internal.mongo.MongoOccurrenceStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for recurrence components.
 */
@AutoConfiguration
@ConditionalOnClass({JobSeries.class, MongoTemplate.class})
@EnableConfigurationProperties(SeriesProperties.class)
@ConditionalOnProperty(prefix = "recur4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SeriesConfig {

    @Bean
    @ConditionalOnMissingBean
    protected MongoOccurrenceStore mongoOccurrenceStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoOccurrenceStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    protected SeriesMongoIndexConfig seriesMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new SeriesMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "recur4j", name = "call-reminders", havingValue = "true", matchIfMissing = true)
    public CallReminderHook callReminderHook(MongoTemplate mongoTemplate) {
        return new CallReminderHook(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public InstanceHookRegistry instanceHookRegistry(ObjectProvider<List<InstanceCreatedHook>> hooksProvider) {
        List<InstanceCreatedHook> hooks = hooksProvider.getIfAvailable(List::of);
        return new InstanceHookRegistry(hooks);
    }

    /**
     * Transactions for series writes. Requires a replica set (or sharded cluster).
     */
    @Bean(name = "recur4jTransactionOperations")
    @ConditionalOnMissingBean(name = "recur4jTransactionOperations")
    public TransactionOperations recur4jTransactionOperations(MongoDatabaseFactory databaseFactory) {
        return new TransactionTemplate(new MongoTransactionManager(databaseFactory));
    }

    @Bean(name = "recur4jClock")
    @ConditionalOnMissingBean(name = "recur4jClock")
    public Clock recur4jClock(SeriesProperties props) {
        return Clock.system(props.resolveZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobSeries jobSeries(SeriesProperties props,
                               MongoOccurrenceStore store,
                               InstanceHookRegistry hooks,
                               @Qualifier("recur4jTransactionOperations") TransactionOperations tx,
                               @Qualifier("recur4jClock") Clock clock) {
        return new MongoJobSeries(props, store, tx, hooks, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "recur4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton seriesIndexesInitializer(SeriesMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
