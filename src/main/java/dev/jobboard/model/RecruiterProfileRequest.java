package dev.jobboard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecruiterProfileRequest {
    private String companyName;
    private String companyLogo;
    private String designation;
    private String companyWebsite;
    private String industry;
}
