package dev.jobboard.model;

import dev.jobboard.entity.Company;
import dev.jobboard.entity.CompanyVerificationStatus;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class CompanyResponse {
    private Long id;
    private Long ownerId;
    private String name;
    private String description;
    private String website;
    private String industry;
    private String size;
    private Integer foundedYear;
    private String headquarters;
    private String emailDomain;
    private CompanyVerificationStatus verificationStatus;
    private boolean verified;
    private String verificationNotes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static CompanyResponse from(Company company) {
        return CompanyResponse.builder()
                .id(company.getId())
                .ownerId(company.getOwner().getId())
                .name(company.getName())
                .description(company.getDescription())
                .website(company.getWebsite())
                .industry(company.getIndustry())
                .size(company.getSize())
                .foundedYear(company.getFoundedYear())
                .headquarters(company.getHeadquarters())
                .emailDomain(company.getEmailDomain())
                .verificationStatus(company.getVerificationStatus())
                .verified(company.isVerified())
                .verificationNotes(company.getVerificationNotes())
                .createdAt(company.getCreatedAt())
                .updatedAt(company.getUpdatedAt())
                .build();
    }
}
