package dev.jobboard.model;

import dev.jobboard.entity.SavedJob;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class SavedJobResponse {
    private Long id;
    private Long jobId;
    private LocalDateTime createdAt;
    private JobResponse job;

    public static SavedJobResponse from(SavedJob savedJob) {
        return SavedJobResponse.builder()
                .id(savedJob.getId())
                .jobId(savedJob.getJob().getId())
                .createdAt(savedJob.getCreatedAt())
                .job(JobResponse.from(savedJob.getJob()))
                .build();
    }
}
