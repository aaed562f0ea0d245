package io.buildqueue4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.buildqueue4j.BuildQueue;
import io.buildqueue4j.core.QueueListener;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class BuildQueueAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(BuildQueueConfig.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "buildqueue.worker-count=2",
                    "buildqueue.subprocess-slots-per-worker=3",
                    "buildqueue.shutdown-timeout=2s"
            );

    @Test
    void shouldAutoConfigureBuildQueueBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BuildQueue.class);
            assertThat(context).hasSingleBean(BuildQueueLifecycle.class);
            assertThat(context).hasSingleBean(BuildQueueProperties.class);
            assertThat(context).hasSingleBean(BuildSummaryPublisher.class);
            assertThat(context.getBean(BuildQueue.class).getCurrentCapacity()).isEqualTo(2);
        });
    }

    @Test
    void expandOnStartupShouldUseFullCapacity() {
        contextRunner
                .withPropertyValues("buildqueue.expand-on-startup=true")
                .run(context -> assertThat(context.getBean(BuildQueue.class).getCurrentCapacity()).isEqualTo(6));
    }

    @Test
    void disabledPropertyShouldSkipAutoConfiguration() {
        contextRunner
                .withPropertyValues("buildqueue.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(BuildQueue.class));
    }

    @Test
    void startedQueueShouldRunJobsAndPublishSummary() {
        QueueListener listener = mock(QueueListener.class);

        contextRunner
                .withBean(QueueListener.class, () -> listener)
                .run(context -> {
                    BuildQueue queue = context.getBean(BuildQueue.class);

                    assertThat(queue.enqueue("moon", progress -> "built").join()).isEqualTo("built");
                    queue.drain().join();

                    verify(listener).onEnqueued(eq("moon"), anyInt());
                    verify(listener, timeout(1000)).onIdle();

                    BuildSummaryPublisher publisher = context.getBean(BuildSummaryPublisher.class);
                    assertThat(publisher.summary().fulfilled()).isEqualTo(1);
                    assertThat(publisher.summaryAsJson()).contains("moon built in");
                    assertThat(publisher.summaryAsMap()).containsEntry("total", 1);
                });
    }
}
