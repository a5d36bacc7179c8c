package dev.jobboard.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Dashboard totals across all postings of one employer.
 * {@code applicationsByStatus} is keyed by the lower-case status value.
 */
@Data
@Builder
public class EmployerStats {
    private int totalJobs;
    private int activeJobs;
    private long totalApplications;
    private long totalViews;
    private Map<String, Long> applicationsByStatus;
}
