package io.gridsweep.runtime;

import io.gridsweep.model.JobResult;
import io.gridsweep.model.JobStatus;
import io.gridsweep.store.SweepLog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Outcome of one {@code run}: counts plus the results produced in this run, in completion order. */
public record SweepReport(
        String sweepName,
        String sweepDir,
        int totalCombinations,
        int alreadyCompleted,
        List<JobResult> results
) {
    public SweepReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public int dispatched() {
        return results.size();
    }

    public long count(JobStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    public boolean anyFailed() {
        return count(JobStatus.FAILED) > 0;
    }

    public Map<String, Object> toSummary() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("sweep", sweepName);
        out.put("sweep_dir", sweepDir);
        out.put("total", totalCombinations);
        out.put("already_completed", alreadyCompleted);
        out.put("dispatched", dispatched());
        out.put("succeeded", count(JobStatus.SUCCEEDED));
        out.put("failed", count(JobStatus.FAILED));
        out.put("skipped", count(JobStatus.SKIPPED));
        out.put("results", results.stream().map(SweepLog::toRow).toList());
        return out;
    }
}
