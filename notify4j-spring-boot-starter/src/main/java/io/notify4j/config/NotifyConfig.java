package io.notify4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.notify4j.DispatchListener;
import io.notify4j.NotificationDispatcher;
import io.notify4j.NotificationScheduler;
import io.notify4j.core.TriggerStore;
import io.notify4j.internal.DefaultNotificationScheduler;
import io.notify4j.internal.InMemoryTriggerStore;
import io.notify4j.internal.LoggingDispatchListener;
import io.notify4j.internal.LoggingNotificationDispatcher;
import io.notify4j.internal.mongo.MongoTriggerStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the notification scheduler.
 *
 * <p>{@code notify.store=mongo} (default) keeps triggers in MongoDB and needs a
 * {@link MongoTemplate}; {@code notify.store=memory} keeps them in process.
 */
@AutoConfiguration(after = {JacksonAutoConfiguration.class, MongoDataAutoConfiguration.class})
@ConditionalOnClass(NotificationScheduler.class)
@EnableConfigurationProperties(NotifyProperties.class)
@ConditionalOnProperty(prefix = "notify", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NotifyConfig {

    public static final String CLOCK_BEAN = "notifyClock";

    @Bean(CLOCK_BEAN)
    @ConditionalOnMissingBean(name = CLOCK_BEAN)
    public Clock notifyClock(NotifyProperties props) {
        return Clock.system(props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean(NotificationDispatcher.class)
    public LoggingNotificationDispatcher loggingNotificationDispatcher() {
        return new LoggingNotificationDispatcher();
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchListener dispatchListener() {
        return new LoggingDispatchListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationScheduler notificationScheduler(NotifyProperties props,
                                                       TriggerStore store,
                                                       NotificationDispatcher<?> dispatcher,
                                                       DispatchListener listener,
                                                       ObjectProvider<ObjectMapper> objectMapper,
                                                       @Qualifier(CLOCK_BEAN) Clock clock) {
        return new DefaultNotificationScheduler(
                props.toOptions(),
                store,
                dispatcher,
                listener,
                objectMapper.getIfAvailable(ObjectMapper::new),
                clock
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyLifecycle notifyLifecycle(NotificationScheduler scheduler) {
        return new NotifyLifecycle(scheduler);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "notify", name = "store", havingValue = "mongo", matchIfMissing = true)
    static class MongoStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(TriggerStore.class)
        @ConditionalOnBean(MongoTemplate.class)
        MongoTriggerStore mongoTriggerStore(MongoTemplate mongoTemplate,
                                            ObjectProvider<ObjectMapper> objectMapper,
                                            @Qualifier(CLOCK_BEAN) Clock clock) {
            return new MongoTriggerStore(mongoTemplate, objectMapper.getIfAvailable(ObjectMapper::new), clock);
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MongoTemplate.class)
        NotifyMongoIndexConfig notifyMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new NotifyMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "notify", name = "ensure-indexes-on-startup", havingValue = "true")
        SmartInitializingSingleton notifyIndexesInitializer(NotifyMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "notify", name = "store", havingValue = "memory")
    static class MemoryStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(TriggerStore.class)
        InMemoryTriggerStore inMemoryTriggerStore(@Qualifier(CLOCK_BEAN) Clock clock) {
            return new InMemoryTriggerStore(clock);
        }
    }
}
