package dev.jobboard.model;

import dev.jobboard.entity.JobType;
import dev.jobboard.entity.WorkMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Editable fields of a job posting, used for create and update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest {
    @NotBlank
    private String title;
    @NotBlank
    private String description;
    @NotBlank
    private String company;
    @Min(0)
    private Integer salaryMin;
    @Min(0)
    private Integer salaryMax;
    @NotBlank
    private String location;
    @Builder.Default
    private List<String> skills = new ArrayList<>();
    @Min(0)
    private Integer experienceRequired;
    private JobType jobType;
    private WorkMode workMode;
    private String companyLogoUrl;
}
