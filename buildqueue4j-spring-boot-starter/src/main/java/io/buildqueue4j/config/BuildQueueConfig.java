package io.buildqueue4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.buildqueue4j.BuildQueue;
import io.buildqueue4j.core.QueueListener;
import io.buildqueue4j.internal.FifoBuildQueue;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for the build queue.
 */
@AutoConfiguration
@ConditionalOnClass(BuildQueue.class)
@EnableConfigurationProperties(BuildQueueProperties.class)
@ConditionalOnProperty(prefix = "buildqueue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BuildQueueConfig {

    @Bean
    @ConditionalOnMissingBean
    public BuildQueue buildQueue(BuildQueueProperties props, ObjectProvider<QueueListener> listeners) {
        FifoBuildQueue queue = new FifoBuildQueue(props, LoggerFactory.getLogger(props.getJobLoggerName()));
        listeners.orderedStream().forEach(queue::addListener);
        return queue;
    }

    @Bean
    @ConditionalOnMissingBean
    public BuildQueueLifecycle buildQueueLifecycle(BuildQueue buildQueue, BuildQueueProperties props) {
        return new BuildQueueLifecycle(buildQueue, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public BuildSummaryPublisher buildSummaryPublisher(BuildQueue buildQueue, ObjectProvider<ObjectMapper> objectMapper) {
        return new BuildSummaryPublisher(buildQueue, objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
