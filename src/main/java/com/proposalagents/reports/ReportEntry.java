package com.proposalagents.reports;

import java.time.Instant;

public record ReportEntry(
        String name,
        long size,
        Instant lastModified
) {
}
