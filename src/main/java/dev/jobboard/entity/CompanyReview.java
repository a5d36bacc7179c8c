package dev.jobboard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A user's review of a company, rated 1 to 5 on four aspects. One per user and company.
 */
@Getter
@Setter
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "company_reviews",
        uniqueConstraints = @UniqueConstraint(name = "uk_review_user_company", columnNames = {"user_id", "company_id"}),
        indexes = @Index(name = "idx_company_reviews_company", columnList = "company_id"))
public class CompanyReview {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "company_id", nullable = false)
    private Company company;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User author;

    @Column(nullable = false)
    private int ratingWorkCulture;

    @Column(nullable = false)
    private int ratingSalary;

    @Column(nullable = false)
    private int ratingHr;

    @Column(nullable = false)
    private int ratingManagement;

    @Column(columnDefinition = "TEXT")
    private String pros;

    @Column(columnDefinition = "TEXT")
    private String cons;

    @Column(columnDefinition = "TEXT")
    private String interviewExperience;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public boolean isWrittenBy(User user) {
        return user != null && author != null && author.getId().equals(user.getId());
    }
}
