package dev.jobboard.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A new company review. Each rating is 1 to 5.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewRequest {
    @NotNull
    private Long companyId;
    @NotNull
    @Min(1)
    @Max(5)
    private Integer ratingWorkCulture;
    @NotNull
    @Min(1)
    @Max(5)
    private Integer ratingSalary;
    @NotNull
    @Min(1)
    @Max(5)
    private Integer ratingHr;
    @NotNull
    @Min(1)
    @Max(5)
    private Integer ratingManagement;
    private String pros;
    private String cons;
    private String interviewExperience;
}
