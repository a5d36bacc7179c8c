package dev.jobboard.model;

import dev.jobboard.entity.Education;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSeekerProfileRequest {
    private String phone;
    private String headline;
    @Builder.Default
    private List<String> skills = new ArrayList<>();
    @Min(0)
    private Integer experienceYears;
    @Valid
    @Builder.Default
    private List<Education> education = new ArrayList<>();
    @Builder.Default
    private List<String> preferredLocations = new ArrayList<>();
    private String resumeUrl;
}
