package net.jobclaim.integration.spring.worker;

import net.jobclaim.core.driver.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;

/** 컨텍스트가 뜨면 워커를 시작하고, 닫힐 때 진행 중인 실행이 반납될 때까지 기다린다. */
public class WorkerPoolLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(WorkerPoolLifecycle.class);

    private final WorkerPool pool;
    private final Duration shutdownTimeout;
    private volatile boolean running;

    public WorkerPoolLifecycle(WorkerPool pool, Duration shutdownTimeout) {
        this.pool = pool;
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public void start() {
        pool.start();
        running = true;
    }

    @Override
    public void stop() {
        try {
            pool.stop(shutdownTimeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("interrupted while stopping workers");
        } finally {
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public WorkerPool pool() { return pool; }
}
