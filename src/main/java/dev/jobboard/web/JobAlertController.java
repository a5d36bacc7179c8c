package dev.jobboard.web;

import dev.jobboard.model.JobAlertRequest;
import dev.jobboard.model.JobAlertResponse;
import dev.jobboard.model.JobResponse;
import dev.jobboard.service.JobAlertService;
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
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/job-alerts")
@RequiredArgsConstructor
public class JobAlertController {

    private final JobAlertService jobAlertService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<JobAlertResponse> create(@ActingUser Long actorId,
            @Valid @RequestBody JobAlertRequest request) {
        return Requests.call(() -> jobAlertService.create(actorId, request));
    }

    @GetMapping
    public Mono<List<JobAlertResponse>> list(
            @ActingUser Long actorId) {
        return Requests.call(() -> jobAlertService.list(actorId));
    }

    @GetMapping("/{alertId}")
    public Mono<JobAlertResponse> get(@ActingUser Long actorId,
            @PathVariable Long alertId) {
        return Requests.call(() -> jobAlertService.get(actorId, alertId));
    }

    @PutMapping("/{alertId}")
    public Mono<JobAlertResponse> update(@ActingUser Long actorId,
            @PathVariable Long alertId, @Valid @RequestBody JobAlertRequest request) {
        return Requests.call(() -> jobAlertService.update(actorId, alertId, request));
    }

    @DeleteMapping("/{alertId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@ActingUser Long actorId,
            @PathVariable Long alertId) {
        return Requests.run(() -> jobAlertService.delete(actorId, alertId));
    }

    /**
     * Jobs the alert would report right now.
     */
    @GetMapping("/{alertId}/matches")
    public Mono<List<JobResponse>> matches(@ActingUser Long actorId,
            @PathVariable Long alertId) {
        return Requests.call(() -> jobAlertService.matches(actorId, alertId));
    }
}
