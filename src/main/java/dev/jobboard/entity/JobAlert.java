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
 * Saved search that periodically notifies its owner about new matching jobs.
 */
@Getter
@Setter
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_alerts", indexes = {
        @Index(name = "idx_job_alerts_user", columnList = "user_id"),
        @Index(name = "idx_job_alerts_active", columnList = "active")
})
public class JobAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(nullable = false)
    private String title;

    private String keyword;

    private String location;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private WorkMode workMode;

    private Integer minSalary;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "job_alert_skills", joinColumns = @JoinColumn(name = "alert_id"))
    @Column(name = "skill", nullable = false)
    private List<String> skills = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private AlertFrequency frequency;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false)
    private boolean emailNotifications;

    private LocalDateTime lastTriggeredAt;

    @Column(nullable = false)
    private int matchedJobsCount;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;
}
