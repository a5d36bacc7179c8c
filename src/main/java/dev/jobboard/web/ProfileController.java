package dev.jobboard.web;

import dev.jobboard.model.JobSeekerProfileRequest;
import dev.jobboard.model.JobSeekerProfileResponse;
import dev.jobboard.model.RecruiterProfileRequest;
import dev.jobboard.model.RecruiterProfileResponse;
import dev.jobboard.service.JobMatcher;
import dev.jobboard.service.ProfileService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
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
@RequestMapping("/api/profiles")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileService profileService;

    @PostMapping("/seeker")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<JobSeekerProfileResponse> createSeeker(
            @ActingUser Long actorId,
            @Valid @RequestBody JobSeekerProfileRequest request) {
        return Requests.call(() -> profileService.createSeekerProfile(actorId, request));
    }

    @PutMapping("/seeker")
    public Mono<JobSeekerProfileResponse> updateSeeker(
            @ActingUser Long actorId,
            @Valid @RequestBody JobSeekerProfileRequest request) {
        return Requests.call(() -> profileService.updateSeekerProfile(actorId, request));
    }

    @GetMapping("/seeker/me")
    public Mono<JobSeekerProfileResponse> mySeeker(
            @ActingUser Long actorId) {
        return Requests.call(() -> profileService.getMySeekerProfile(actorId));
    }

    /**
     * @param skills Comma-separated, any-of
     */
    @GetMapping("/seeker/search")
    public Mono<List<JobSeekerProfileResponse>> searchCandidates(
            @ActingUser Long actorId,
            @RequestParam(required = false) String skills,
            @RequestParam(required = false) Integer minExperience,
            @RequestParam(required = false) String location) {
        List<String> wanted = JobMatcher.parseSkills(skills);
        return Requests.call(() -> profileService.searchCandidates(actorId, wanted, minExperience, location));
    }

    @GetMapping("/seeker/{userId}")
    public Mono<JobSeekerProfileResponse> seeker(
            @ActingUser Long actorId,
            @PathVariable Long userId) {
        return Requests.call(() -> profileService.getSeekerProfile(actorId, userId));
    }

    @PostMapping("/recruiter")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<RecruiterProfileResponse> createRecruiter(
            @ActingUser Long actorId,
            @Valid @RequestBody RecruiterProfileRequest request) {
        return Requests.call(() -> profileService.createRecruiterProfile(actorId, request));
    }

    @PutMapping("/recruiter")
    public Mono<RecruiterProfileResponse> updateRecruiter(
            @ActingUser Long actorId,
            @Valid @RequestBody RecruiterProfileRequest request) {
        return Requests.call(() -> profileService.updateRecruiterProfile(actorId, request));
    }

    @GetMapping("/recruiter/me")
    public Mono<RecruiterProfileResponse> myRecruiter(
            @ActingUser Long actorId) {
        return Requests.call(() -> profileService.getMyRecruiterProfile(actorId));
    }

    @GetMapping("/recruiter/{userId}")
    public Mono<RecruiterProfileResponse> recruiter(
            @ActingUser Long actorId,
            @PathVariable Long userId) {
        return Requests.call(() -> profileService.getRecruiterProfile(actorId, userId));
    }
}
