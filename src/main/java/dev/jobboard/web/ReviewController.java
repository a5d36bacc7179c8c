package dev.jobboard.web;

import dev.jobboard.model.CompanyRatings;
import dev.jobboard.model.PageResponse;
import dev.jobboard.model.ReviewRequest;
import dev.jobboard.model.ReviewResponse;
import dev.jobboard.model.ReviewUpdateRequest;
import dev.jobboard.service.ReviewService;
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

@RestController
@RequestMapping("/api/reviews")
@RequiredArgsConstructor
public class ReviewController {

    private final ReviewService reviewService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ReviewResponse> create(@ActingUser Long actorId,
            @Valid @RequestBody ReviewRequest request) {
        return Requests.call(() -> reviewService.create(actorId, request));
    }

    @GetMapping
    public Mono<PageResponse<ReviewResponse>> list(
            @RequestParam(required = false) Long companyId,
            @RequestParam(required = false) Long userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {
        return Requests.call(() -> reviewService.list(companyId, userId, page, size));
    }

    @GetMapping("/{reviewId}")
    public Mono<ReviewResponse> get(@PathVariable Long reviewId) {
        return Requests.call(() -> reviewService.get(reviewId));
    }

    @PutMapping("/{reviewId}")
    public Mono<ReviewResponse> update(@ActingUser Long actorId,
            @PathVariable Long reviewId, @Valid @RequestBody ReviewUpdateRequest request) {
        return Requests.call(() -> reviewService.update(actorId, reviewId, request));
    }

    @DeleteMapping("/{reviewId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> delete(@ActingUser Long actorId,
            @PathVariable Long reviewId) {
        return Requests.run(() -> reviewService.delete(actorId, reviewId));
    }

    @GetMapping("/company/{companyId}/average")
    public Mono<CompanyRatings> averages(@PathVariable Long companyId) {
        return Requests.call(() -> reviewService.averages(companyId));
    }
}
