package dev.jobboard.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a review; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewUpdateRequest {
    @Min(1)
    @Max(5)
    private Integer ratingWorkCulture;
    @Min(1)
    @Max(5)
    private Integer ratingSalary;
    @Min(1)
    @Max(5)
    private Integer ratingHr;
    @Min(1)
    @Max(5)
    private Integer ratingManagement;
    private String pros;
    private String cons;
    private String interviewExperience;
}
