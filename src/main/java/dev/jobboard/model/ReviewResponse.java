package dev.jobboard.model;

import dev.jobboard.entity.CompanyReview;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class ReviewResponse {
    private Long id;
    private Long companyId;
    private String companyName;
    private Long userId;
    private String userName;
    private int ratingWorkCulture;
    private int ratingSalary;
    private int ratingHr;
    private int ratingManagement;
    private String pros;
    private String cons;
    private String interviewExperience;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ReviewResponse from(CompanyReview review) {
        return ReviewResponse.builder()
                .id(review.getId())
                .companyId(review.getCompany().getId())
                .companyName(review.getCompany().getName())
                .userId(review.getAuthor().getId())
                .userName(review.getAuthor().getFullName())
                .ratingWorkCulture(review.getRatingWorkCulture())
                .ratingSalary(review.getRatingSalary())
                .ratingHr(review.getRatingHr())
                .ratingManagement(review.getRatingManagement())
                .pros(review.getPros())
                .cons(review.getCons())
                .interviewExperience(review.getInterviewExperience())
                .createdAt(review.getCreatedAt())
                .updatedAt(review.getUpdatedAt())
                .build();
    }
}
