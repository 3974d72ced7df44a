package net.jobclaim.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.jobclaim.core.error.ScheduleEvaluationException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** cron-utils(Quartz 문법) 기반 다음 due 계산기 (Guava 없이 LRU 캐시) */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));

    // 간단 LRU(최대 256개)
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /** from 보다 엄격히 뒤인 첫 실행 시각(UTC Instant). */
    public static Instant nextAfter(String cronExpr, ZoneId zone, Instant from) throws ScheduleEvaluationException {
        Objects.requireNonNull(zone); Objects.requireNonNull(from);
        ExecutionTime et = parse(cronExpr);

        ZonedDateTime base = from.atZone(zone);
        ZonedDateTime next = et.nextExecution(base).orElseThrow(
                () -> new ScheduleEvaluationException(cronExpr, "no next execution for [" + cronExpr + "] at " + base));
        if (!next.toInstant().isAfter(from)) {
            Optional<ZonedDateTime> after = et.nextExecution(next);
            if (after.isEmpty() || !after.get().toInstant().isAfter(from)) {
                throw new ScheduleEvaluationException(cronExpr, "expression does not advance past " + from);
            }
            next = after.get();
        }
        return next.toInstant();
    }

    /** 문법만 확인한다. 등록 시점 검증용. */
    public static void validate(String cronExpr) throws ScheduleEvaluationException {
        parse(cronExpr);
    }

    private static ExecutionTime parse(String cronExpr) throws ScheduleEvaluationException {
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new ScheduleEvaluationException(cronExpr, "empty cron expression");
        }
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(cronExpr);
            if (cached != null) return cached;
        }
        ExecutionTime et;
        try {
            et = ExecutionTime.forCron(PARSER.parse(cronExpr));
        } catch (IllegalArgumentException e) {
            throw new ScheduleEvaluationException(cronExpr, "invalid cron expression [" + cronExpr + "]: " + e.getMessage(), e);
        }
        synchronized (CACHE) {
            CACHE.put(cronExpr, et);
        }
        return et;
    }

    public static void invalidate(String expr) { synchronized (CACHE) { CACHE.remove(expr); } }
    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    // --- 내부 LRU ---
    private static final class LruMap<K,V> extends LinkedHashMap<K,V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K,V> eldest) { return size() > max; }
    }
}
