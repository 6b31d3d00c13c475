package com.mmrag.ingest;

import java.util.List;

public record BatchIngestionReport(List<IngestionResult> results) {

    public BatchIngestionReport {
        results = List.copyOf(results);
    }

    public long successes() {
        return results.stream().filter(IngestionResult::success).count();
    }

    public long failures() {
        return results.size() - successes();
    }

    public int chunksCreated() {
        return results.stream().mapToInt(IngestionResult::chunksCreated).sum();
    }

    public boolean partialFailure() {
        return successes() > 0 && failures() > 0;
    }

    public boolean allFailed() {
        return !results.isEmpty() && successes() == 0;
    }
}
