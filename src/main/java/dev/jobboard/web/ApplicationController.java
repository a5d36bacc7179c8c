package dev.jobboard.web;

import dev.jobboard.entity.ApplicationStatus;
import dev.jobboard.model.ApplicationRequest;
import dev.jobboard.model.ApplicationResponse;
import dev.jobboard.model.PageResponse;
import dev.jobboard.model.StatusUpdateRequest;
import dev.jobboard.service.ApplicationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/applications")
@RequiredArgsConstructor
public class ApplicationController {

    private final ApplicationService applicationService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApplicationResponse> apply(
            @ActingUser Long actorId,
            @Valid @RequestBody ApplicationRequest request) {
        return Requests.call(() -> applicationService.apply(actorId, request));
    }

    @GetMapping("/mine")
    public Mono<PageResponse<ApplicationResponse>> mine(
            @ActingUser Long actorId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return Requests.call(() -> applicationService.mine(actorId, page, size));
    }

    @GetMapping("/job/{jobId}")
    public Mono<List<ApplicationResponse>> forJob(
            @ActingUser Long actorId,
            @PathVariable Long jobId,
            @RequestParam(required = false) String status) {
        ApplicationStatus filter = Requests.parseEnum(status, ApplicationStatus::fromValue, "status");
        return Requests.call(() -> applicationService.forJob(actorId, jobId, filter));
    }

    @GetMapping("/job/{jobId}/counts")
    public Mono<Map<String, Long>> statusCounts(
            @ActingUser Long actorId,
            @PathVariable Long jobId) {
        return Requests.call(() -> applicationService.statusCounts(actorId, jobId));
    }

    @GetMapping("/{applicationId}")
    public Mono<ApplicationResponse> get(@ActingUser Long actorId,
            @PathVariable Long applicationId) {
        return Requests.call(() -> applicationService.get(actorId, applicationId));
    }

    @PatchMapping("/{applicationId}/status")
    public Mono<ApplicationResponse> updateStatus(
            @ActingUser Long actorId,
            @PathVariable Long applicationId,
            @Valid @RequestBody StatusUpdateRequest request) {
        return Requests.call(() -> applicationService.updateStatus(actorId, applicationId, request));
    }

    @DeleteMapping("/{applicationId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> withdraw(@ActingUser Long actorId,
            @PathVariable Long applicationId) {
        return Requests.run(() -> applicationService.withdraw(actorId, applicationId));
    }
}
