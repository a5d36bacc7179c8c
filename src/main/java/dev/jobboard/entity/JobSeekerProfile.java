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
 * Extended profile of a job seeker. One per user.
 */
@Getter
@Setter
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "job_seeker_profiles")
public class JobSeekerProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, unique = true)
    private User user;

    @Column(length = 20)
    private String phone;

    private String headline;

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "job_seeker_skills", joinColumns = @JoinColumn(name = "profile_id"))
    @Column(name = "skill", nullable = false)
    private List<String> skills = new ArrayList<>();

    private Integer experienceYears;

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "job_seeker_education", joinColumns = @JoinColumn(name = "profile_id"))
    private List<Education> education = new ArrayList<>();

    @Builder.Default
    @ElementCollection
    @CollectionTable(name = "job_seeker_locations", joinColumns = @JoinColumn(name = "profile_id"))
    @Column(name = "location", nullable = false)
    private List<String> preferredLocations = new ArrayList<>();

    @Column(length = 2048)
    private String resumeUrl;

    @Column(nullable = false)
    private int profileCompletionPct;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;
}
