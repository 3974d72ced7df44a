package net.jobclaim.core.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/** 드라이버 N개를 각자 스레드에서 돌린다. 워커끼리는 저장소 CAS 외에 아무것도 공유하지 않는다. */
public final class WorkerPool {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final IntFunction<SchedulerDriver> factory;
    private final int size;
    private final List<SchedulerDriver> drivers = new ArrayList<>();
    private final List<Thread> threads = new ArrayList<>();

    public WorkerPool(IntFunction<SchedulerDriver> factory, int size) {
        if (size < 1) throw new IllegalArgumentException("size must be >= 1");
        this.factory = factory;
        this.size = size;
    }

    public synchronized void start() {
        if (!threads.isEmpty()) return;
        for (int i = 0; i < size; i++) {
            SchedulerDriver d = factory.apply(i);
            Thread t = new Thread(d, d.name());
            drivers.add(d);
            threads.add(t);
            t.start();
        }
        log.info("started {} worker(s)", size);
    }

    public synchronized void stop(Duration timeout) throws InterruptedException {
        for (SchedulerDriver d : drivers) d.stop();
        for (Thread t : threads) t.interrupt();
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread t : threads) {
            long left = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
            t.join(left);
            if (t.isAlive()) log.warn("worker {} did not stop within {}", t.getName(), timeout);
        }
        for (SchedulerDriver d : drivers) d.close();
        drivers.clear();
        threads.clear();
    }

    public synchronized boolean isRunning() {
        return threads.stream().anyMatch(Thread::isAlive);
    }

    public synchronized List<SchedulerDriver> drivers() {
        return List.copyOf(drivers);
    }
}
