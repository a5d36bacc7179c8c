package dev.jobboard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A job posting owned by the employer who created it.
 */
@Getter
@Setter
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_posted_by", columnList = "posted_by"),
        @Index(name = "idx_jobs_posted_at", columnList = "postedAt"),
        @Index(name = "idx_jobs_active", columnList = "active")
})
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false)
    private String company;

    private Integer salaryMin;

    private Integer salaryMax;

    @Column(nullable = false, length = 500)
    private String location;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_skills", joinColumns = @JoinColumn(name = "job_id"))
    @Column(name = "skill", nullable = false)
    private List<String> skills = new ArrayList<>();

    /** Years of experience asked for; null when unspecified. */
    private Integer experienceRequired;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private JobType jobType;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private WorkMode workMode;

    @Column(length = 2048)
    private String companyLogoUrl;

    @Column(nullable = false)
    private int applicationCount;

    @Column(nullable = false)
    private int viewCount;

    @Column(nullable = false)
    private boolean active;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "posted_by", nullable = false)
    private User postedBy;

    @Column(nullable = false)
    private LocalDateTime postedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public boolean isOwnedBy(User user) {
        return user != null && postedBy != null && postedBy.getId().equals(user.getId());
    }
}
