package dev.jobboard.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class Education {

    @NotBlank
    @Column(nullable = false)
    private String institution;

    @NotBlank
    @Column(nullable = false)
    private String degree;

    private String fieldOfStudy;

    private Integer startYear;

    private Integer endYear;
}
