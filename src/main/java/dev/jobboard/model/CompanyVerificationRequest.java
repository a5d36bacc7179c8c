package dev.jobboard.model;

import dev.jobboard.entity.CompanyVerificationStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompanyVerificationRequest {
    @NotNull
    private CompanyVerificationStatus status;
    private String notes;
}
