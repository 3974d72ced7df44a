package net.jobclaim.core.service;

import net.jobclaim.core.model.Job;

import java.util.Optional;

/** {@link PreemptionService#preempt} 한 번의 결과 */
public record Claim(Outcome outcome, Job job, int attempts) {

    public enum Outcome { CLAIMED, NOT_FOUND, CONTENTION }

    static Claim claimed(Job job, int attempts) { return new Claim(Outcome.CLAIMED, job, attempts); }
    static Claim notFound(int attempts) { return new Claim(Outcome.NOT_FOUND, null, attempts); }
    static Claim contention(int attempts) { return new Claim(Outcome.CONTENTION, null, attempts); }

    public boolean claimed() { return outcome == Outcome.CLAIMED; }

    public Optional<Job> claimedJob() { return Optional.ofNullable(job); }
}
