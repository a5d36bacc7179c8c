package dev.jobboard.model;

import dev.jobboard.entity.Job;
import dev.jobboard.entity.JobType;
import dev.jobboard.entity.WorkMode;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class JobResponse {
    private Long id;
    private String title;
    private String description;
    private String company;
    private Integer salaryMin;
    private Integer salaryMax;
    private String location;
    private List<String> skills;
    private Integer experienceRequired;
    private JobType jobType;
    private WorkMode workMode;
    private String companyLogoUrl;
    private int applicationCount;
    private int viewCount;
    private boolean active;
    private Long postedBy;
    private LocalDateTime postedAt;
    private LocalDateTime updatedAt;

    public static JobResponse from(Job job) {
        return JobResponse.builder()
                .id(job.getId())
                .title(job.getTitle())
                .description(job.getDescription())
                .company(job.getCompany())
                .salaryMin(job.getSalaryMin())
                .salaryMax(job.getSalaryMax())
                .location(job.getLocation())
                .skills(List.copyOf(job.getSkills()))
                .experienceRequired(job.getExperienceRequired())
                .jobType(job.getJobType())
                .workMode(job.getWorkMode())
                .companyLogoUrl(job.getCompanyLogoUrl())
                .applicationCount(job.getApplicationCount())
                .viewCount(job.getViewCount())
                .active(job.isActive())
                .postedBy(job.getPostedBy() != null ? job.getPostedBy().getId() : null)
                .postedAt(job.getPostedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
