package dev.jobboard.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Editable fields of a company page, used for create and update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyRequest {
    @NotBlank
    private String name;
    private String description;
    private String website;
    private String industry;
    private String size;
    @Min(1800)
    @Max(2100)
    private Integer foundedYear;
    private String headquarters;
    private String emailDomain;
}
