package dev.jobboard.model;

import dev.jobboard.entity.AlertFrequency;
import dev.jobboard.entity.WorkMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobAlertRequest {
    @NotBlank
    private String title;
    private String keyword;
    private String location;
    private WorkMode workMode;
    @Min(0)
    private Integer minSalary;
    @Builder.Default
    private List<String> skills = new ArrayList<>();
    @Builder.Default
    private AlertFrequency frequency = AlertFrequency.DAILY;
    @Builder.Default
    private boolean emailNotifications = true;
    @Builder.Default
    private boolean active = true;
}
