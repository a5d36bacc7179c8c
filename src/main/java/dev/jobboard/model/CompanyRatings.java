package dev.jobboard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Average review ratings of a company, rounded to two decimals. All zero without reviews.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyRatings {
    private Long companyId;
    private String companyName;
    private Averages averageRatings;
    private long totalReviews;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Averages {
        private double workCulture;
        private double salary;
        private double hr;
        private double management;
    }
}
