package dev.jobboard.model;

import dev.jobboard.entity.RecruiterProfile;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class RecruiterProfileResponse {
    private Long id;
    private Long userId;
    private String fullName;
    private String companyName;
    private String companyLogo;
    private String designation;
    private String companyWebsite;
    private String industry;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static RecruiterProfileResponse from(RecruiterProfile profile) {
        return RecruiterProfileResponse.builder()
                .id(profile.getId())
                .userId(profile.getUser().getId())
                .fullName(profile.getUser().getFullName())
                .companyName(profile.getCompanyName())
                .companyLogo(profile.getCompanyLogo())
                .designation(profile.getDesignation())
                .companyWebsite(profile.getCompanyWebsite())
                .industry(profile.getIndustry())
                .createdAt(profile.getCreatedAt())
                .updatedAt(profile.getUpdatedAt())
                .build();
    }
}
