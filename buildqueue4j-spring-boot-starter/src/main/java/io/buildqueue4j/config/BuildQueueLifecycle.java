package io.buildqueue4j.config;

import io.buildqueue4j.BuildQueue;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges build queue start/stop with the Spring container lifecycle.
 */
public class BuildQueueLifecycle implements SmartLifecycle {
    private final BuildQueue buildQueue;
    private final BuildQueueProperties props;
    private volatile boolean running = false;

    public BuildQueueLifecycle(BuildQueue buildQueue, BuildQueueProperties props) {
        this.buildQueue = buildQueue;
        this.props = props;
    }

    @Override
    public void start() {
        buildQueue.start();
        if (props.isExpandOnStartup()) {
            buildQueue.expand();
        }
        running = true;
    }

    @Override
    public void stop() {
        buildQueue.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
