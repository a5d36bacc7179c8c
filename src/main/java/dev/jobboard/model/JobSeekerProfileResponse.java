package dev.jobboard.model;

import dev.jobboard.entity.Education;
import dev.jobboard.entity.JobSeekerProfile;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Job-seeker profile with the owner's name and email, also used for candidate search.
 */
@Data
@Builder
public class JobSeekerProfileResponse {
    private Long id;
    private Long userId;
    private String fullName;
    private String email;
    private String phone;
    private String headline;
    private List<String> skills;
    private Integer experienceYears;
    private List<Education> education;
    private List<String> preferredLocations;
    private String resumeUrl;
    private int profileCompletionPct;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static JobSeekerProfileResponse from(JobSeekerProfile profile) {
        return JobSeekerProfileResponse.builder()
                .id(profile.getId())
                .userId(profile.getUser().getId())
                .fullName(profile.getUser().getFullName())
                .email(profile.getUser().getEmail())
                .phone(profile.getPhone())
                .headline(profile.getHeadline())
                .skills(List.copyOf(profile.getSkills()))
                .experienceYears(profile.getExperienceYears())
                .education(List.copyOf(profile.getEducation()))
                .preferredLocations(List.copyOf(profile.getPreferredLocations()))
                .resumeUrl(profile.getResumeUrl())
                .profileCompletionPct(profile.getProfileCompletionPct())
                .createdAt(profile.getCreatedAt())
                .updatedAt(profile.getUpdatedAt())
                .build();
    }
}
