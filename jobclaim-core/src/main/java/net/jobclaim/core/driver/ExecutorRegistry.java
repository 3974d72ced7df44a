package net.jobclaim.core.driver;

import net.jobclaim.core.spi.JobExecutor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class ExecutorRegistry {
    private final Map<String, JobExecutor> byId;

    public ExecutorRegistry(Collection<? extends JobExecutor> executors) {
        Map<String, JobExecutor> m = new LinkedHashMap<>();
        for (JobExecutor e : executors) {
            JobExecutor prev = m.putIfAbsent(e.id(), e);
            if (prev != null) throw new IllegalStateException("duplicate executor id: " + e.id());
        }
        this.byId = Collections.unmodifiableMap(m);
    }

    public Optional<JobExecutor> find(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    public Set<String> ids() { return byId.keySet(); }
}
