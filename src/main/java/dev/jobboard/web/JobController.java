package dev.jobboard.web;

import dev.jobboard.entity.JobType;
import dev.jobboard.entity.WorkMode;
import dev.jobboard.model.JobRequest;
import dev.jobboard.model.JobResponse;
import dev.jobboard.model.JobSearchCriteria;
import dev.jobboard.model.PageResponse;
import dev.jobboard.service.JobMatcher;
import dev.jobboard.service.JobService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobController {

    private final JobService jobService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<JobResponse> create(@ActingUser Long actorId,
            @Valid @RequestBody JobRequest request) {
        return Requests.call(() -> jobService.create(actorId, request));
    }

    /**
     * Public search over active jobs.
     *
     * @param skills Comma-separated, any-of
     */
    @GetMapping
    public Mono<PageResponse<JobResponse>> search(
            @RequestParam(required = false) String keyword,
            @RequestParam(required = false) String location,
            @RequestParam(required = false) String workMode,
            @RequestParam(required = false) String jobType,
            @RequestParam(required = false) Integer minSalary,
            @RequestParam(required = false) Integer maxExperience,
            @RequestParam(required = false) String skills,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        JobSearchCriteria criteria = JobSearchCriteria.builder()
                .keyword(keyword)
                .location(location)
                .workMode(Requests.parseEnum(workMode, WorkMode::fromValue, "workMode"))
                .jobType(Requests.parseEnum(jobType, JobType::fromValue, "jobType"))
                .minSalary(minSalary)
                .maxExperience(maxExperience)
                .skills(JobMatcher.parseSkills(skills))
                .build();
        return Requests.call(() -> jobService.search(criteria, page, size));
    }

    @GetMapping("/mine")
    public Mono<List<JobResponse>> mine(@ActingUser Long actorId) {
        return Requests.call(() -> jobService.mine(actorId));
    }

    @GetMapping("/{jobId}")
    public Mono<JobResponse> get(@PathVariable Long jobId) {
        return Requests.call(() -> jobService.view(jobId));
    }

    @PutMapping("/{jobId}")
    public Mono<JobResponse> update(@ActingUser Long actorId,
            @PathVariable Long jobId, @Valid @RequestBody JobRequest request) {
        return Requests.call(() -> jobService.update(actorId, jobId, request));
    }

    @PostMapping("/{jobId}/activate")
    public Mono<JobResponse> activate(@ActingUser Long actorId,
            @PathVariable Long jobId) {
        return Requests.call(() -> jobService.setActive(actorId, jobId, true));
    }

    @PostMapping("/{jobId}/deactivate")
    public Mono<JobResponse> deactivate(@ActingUser Long actorId,
            @PathVariable Long jobId) {
        return Requests.call(() -> jobService.setActive(actorId, jobId, false));
    }

    @DeleteMapping("/{jobId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@ActingUser Long actorId,
            @PathVariable Long jobId) {
        return Requests.run(() -> jobService.delete(actorId, jobId));
    }
}
