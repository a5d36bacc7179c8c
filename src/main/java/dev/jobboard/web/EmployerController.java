package dev.jobboard.web;

import dev.jobboard.model.EmployerStats;
import dev.jobboard.service.EmployerStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/employer")
@RequiredArgsConstructor
public class EmployerController {

    private final EmployerStatsService statsService;

    @GetMapping("/stats")
    public Mono<EmployerStats> stats(@ActingUser Long actorId) {
        return Requests.call(() -> statsService.stats(actorId));
    }
}
