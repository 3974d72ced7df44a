package net.jobclaim.core.lease;

import net.jobclaim.core.model.Job;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 워커 쪽 소유권 핸들: 선점한 Job과 마지막으로 알고 있는 VERSION.
 * 하트비트와 반납은 같은 락을 잡으므로 한 프로세스 안에서 서로 끼어들지 않는다.
 */
public final class Lease {
    private final ReentrantLock lock = new ReentrantLock();
    private Job job;
    private boolean lost;
    private boolean closed;

    public Lease(Job claimed) {
        this.job = claimed;
    }

    public long jobId() { return job.id(); }

    public Job job() {
        lock.lock();
        try { return job; } finally { lock.unlock(); }
    }

    public long version() {
        lock.lock();
        try { return job.version(); } finally { lock.unlock(); }
    }

    public boolean isLost() {
        lock.lock();
        try { return lost; } finally { lock.unlock(); }
    }

    /** 더 이상 쓰기를 하면 안 되는 상태(반납 완료 또는 소유권 상실) */
    boolean inactive() { return lost || closed; }

    ReentrantLock lock() { return lock; }

    void advance(Job next) { this.job = next; }

    void markLost() { this.lost = true; }

    void markClosed() { this.closed = true; }
}
