package net.jobclaim.core.spi;

import net.jobclaim.core.model.Job;
import net.jobclaim.core.model.JobStatus;
import net.jobclaim.core.model.JobUpdate;
import net.jobclaim.core.model.NewJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface JobRepository {
    /** WAITING + NEXT_DUE_AT < now 중 하나 (due 빠른 순, 같으면 ID 작은 순). 잠그지 않는다 */
    Optional<Job> findDueCandidate(Instant now) throws Exception;

    /** VERSION = expected 일 때만 VERSION+1 과 주어진 필드를 쓴다. 반영 행 수(0/1) */
    int conditionalUpdate(long id, long expectedVersion, JobUpdate update) throws Exception;

    /** UPDATED_AT < threshold 인 RUNNING (하트비트 끊긴 lease) */
    List<Job> findStale(Instant threshold) throws Exception;

    Optional<Job> findById(long id) throws Exception;
    Optional<Job> findByName(String name) throws Exception;
    List<Job> findAll() throws Exception;

    // 관리용. 선점 프로토콜 밖
    Job insert(NewJob job, Instant now) throws Exception;
    int transition(long id, JobStatus from, JobStatus to, Instant now) throws Exception;
    int delete(long id) throws Exception;
}
