package dev.jobboard.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A company page created by an employer. Names are unique regardless of case.
 */
@Getter
@Setter
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "companies", indexes = {
        @Index(name = "idx_companies_owner", columnList = "owner_id")
})
public class Company {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false)
    private User owner;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(length = 2048)
    private String website;

    private String industry;

    /** Head-count band, e.g. "51-200". */
    @Column(name = "company_size", length = 50)
    private String size;

    private Integer foundedYear;

    private String headquarters;

    /** Domain the company's staff email addresses use, without '@'. */
    private String emailDomain;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CompanyVerificationStatus verificationStatus;

    @Column(nullable = false)
    private boolean verified;

    @Column(columnDefinition = "TEXT")
    private String verificationNotes;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    public boolean isOwnedBy(User user) {
        return user != null && owner != null && owner.getId().equals(user.getId());
    }
}
