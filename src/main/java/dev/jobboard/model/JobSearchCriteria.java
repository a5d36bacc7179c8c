package dev.jobboard.model;

import dev.jobboard.entity.JobType;
import dev.jobboard.entity.WorkMode;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Filters shared by job search and job alerts. Every field is optional;
 * an empty criteria matches every active job.
 */
@Data
@Builder
public class JobSearchCriteria {
    private String keyword;
    private String location;
    private WorkMode workMode;
    private JobType jobType;
    private Integer minSalary;
    private Integer maxExperience;
    private List<String> skills;
}
