package com.proposalagents.reports;

import java.util.List;

public record ReportListing(
        String directory,
        List<ReportEntry> reports
) {
}
