package dev.jobboard.model;

import dev.jobboard.entity.AlertFrequency;
import dev.jobboard.entity.JobAlert;
import dev.jobboard.entity.WorkMode;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class JobAlertResponse {
    private Long id;
    private Long userId;
    private String title;
    private String keyword;
    private String location;
    private WorkMode workMode;
    private Integer minSalary;
    private List<String> skills;
    private AlertFrequency frequency;
    private boolean active;
    private boolean emailNotifications;
    private LocalDateTime lastTriggeredAt;
    private int matchedJobsCount;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static JobAlertResponse from(JobAlert alert) {
        return JobAlertResponse.builder()
                .id(alert.getId())
                .userId(alert.getUser().getId())
                .title(alert.getTitle())
                .keyword(alert.getKeyword())
                .location(alert.getLocation())
                .workMode(alert.getWorkMode())
                .minSalary(alert.getMinSalary())
                .skills(List.copyOf(alert.getSkills()))
                .frequency(alert.getFrequency())
                .active(alert.isActive())
                .emailNotifications(alert.isEmailNotifications())
                .lastTriggeredAt(alert.getLastTriggeredAt())
                .matchedJobsCount(alert.getMatchedJobsCount())
                .createdAt(alert.getCreatedAt())
                .updatedAt(alert.getUpdatedAt())
                .build();
    }
}
