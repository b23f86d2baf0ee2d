package space.ketterling.waterstress.quality;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects data-quality issues for one pipeline run.
 *
 * <p>
 * Safe to share between worker threads. Every issue is counted; only the
 * first {@link #DEFAULT_KEEP} are retained verbatim so a badly broken input
 * cannot exhaust memory.
 * </p>
 */
public final class DataQualityLog {
    private static final Logger log = LoggerFactory.getLogger(DataQualityLog.class);

    public static final int DEFAULT_KEEP = 10_000;

    private final Map<IssueKind, AtomicLong> counts = new EnumMap<>(IssueKind.class);
    private final ConcurrentLinkedQueue<DataQualityIssue> issues = new ConcurrentLinkedQueue<>();
    private final AtomicLong retained = new AtomicLong();
    private final int keep;

    public DataQualityLog() {
        this(DEFAULT_KEEP);
    }

    public DataQualityLog(int keep) {
        this.keep = keep;
        for (IssueKind k : IssueKind.values())
            counts.put(k, new AtomicLong());
    }

    /**
     * Records an issue and logs it (WARN for join mismatches, DEBUG otherwise).
     */
    public void record(IssueKind kind, String regionId, YearMonth month, String detail) {
        counts.get(kind).incrementAndGet();
        if (retained.incrementAndGet() <= keep) {
            issues.add(new DataQualityIssue(kind, regionId, month, detail));
        }
        if (kind == IssueKind.JOIN_MISMATCH) {
            log.warn("{}: {}", kind, detail);
        } else {
            log.debug("{} region={} month={}: {}", kind, regionId, month, detail);
        }
    }

    public long count(IssueKind kind) {
        return counts.get(kind).get();
    }

    /**
     * Returns counts for every kind, zero included.
     */
    public Map<IssueKind, Long> counts() {
        Map<IssueKind, Long> out = new EnumMap<>(IssueKind.class);
        for (var e : counts.entrySet())
            out.put(e.getKey(), e.getValue().get());
        return out;
    }

    /**
     * Returns the retained issues of one kind.
     */
    public List<DataQualityIssue> issues(IssueKind kind) {
        List<DataQualityIssue> out = new ArrayList<>();
        for (DataQualityIssue i : issues) {
            if (i.kind() == kind)
                out.add(i);
        }
        return out;
    }

    public List<DataQualityIssue> issues() {
        return new ArrayList<>(issues);
    }
}
