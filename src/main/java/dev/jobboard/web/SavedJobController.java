package dev.jobboard.web;

import dev.jobboard.model.SavedJobResponse;
import dev.jobboard.service.SavedJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/saved-jobs")
@RequiredArgsConstructor
public class SavedJobController {

    private final SavedJobService savedJobService;

    @PostMapping("/job/{jobId}")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SavedJobResponse> save(@ActingUser Long actorId,
            @PathVariable Long jobId) {
        return Requests.call(() -> savedJobService.save(actorId, jobId));
    }

    @GetMapping
    public Mono<List<SavedJobResponse>> list(
            @ActingUser Long actorId) {
        return Requests.call(() -> savedJobService.list(actorId));
    }

    @GetMapping("/job/{jobId}")
    public Mono<Map<String, Boolean>> isSaved(
            @ActingUser Long actorId,
            @PathVariable Long jobId) {
        return Requests.call(() -> Map.of("saved", savedJobService.isSaved(actorId, jobId)));
    }

    @DeleteMapping("/{savedJobId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> unsave(@ActingUser Long actorId,
            @PathVariable Long savedJobId) {
        return Requests.run(() -> savedJobService.unsave(actorId, savedJobId));
    }

    @DeleteMapping("/job/{jobId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> unsaveByJob(@ActingUser Long actorId,
            @PathVariable Long jobId) {
        return Requests.run(() -> savedJobService.unsaveByJob(actorId, jobId));
    }
}
