package dev.jobboard.service;

import dev.jobboard.entity.Education;
import dev.jobboard.entity.JobSeekerProfile;
import dev.jobboard.entity.RecruiterProfile;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ConflictException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.model.JobSeekerProfileRequest;
import dev.jobboard.model.JobSeekerProfileResponse;
import dev.jobboard.model.RecruiterProfileRequest;
import dev.jobboard.model.RecruiterProfileResponse;
import dev.jobboard.repository.JobSeekerProfileRepository;
import dev.jobboard.repository.RecruiterProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Service for job-seeker and recruiter profiles.
 *
 * <p>Each account has at most one profile of the kind matching its role.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfileService {

    private final JobSeekerProfileRepository seekerRepository;
    private final RecruiterProfileRepository recruiterRepository;
    private final AccountService accountService;
    private final ProfileCompletionCalculator completionCalculator;

    // Job seekers

    @Transactional
    public JobSeekerProfileResponse createSeekerProfile(Long actorId, JobSeekerProfileRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        AccessRules.requireExactRole(actor, "have a job seeker profile", Role.JOB_SEEKER);
        if (seekerRepository.existsByUserId(actor.getId())) {
            throw new ConflictException("Job seeker profile already exists");
        }

        LocalDateTime now = LocalDateTime.now();
        JobSeekerProfile profile = JobSeekerProfile.builder()
                .user(actor)
                .createdAt(now)
                .build();
        applySeekerRequest(profile, request, now);

        JobSeekerProfile saved = seekerRepository.save(profile);
        log.info("Created job seeker profile {} for user {} ({}% complete)", saved.getId(), actor.getId(),
                saved.getProfileCompletionPct());
        return JobSeekerProfileResponse.from(saved);
    }

    /**
     * Replace every editable field of the acting user's profile.
     */
    @Transactional
    public JobSeekerProfileResponse updateSeekerProfile(Long actorId, JobSeekerProfileRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        JobSeekerProfile profile = seekerRepository.findByUserId(actor.getId())
                .orElseThrow(() -> new NotFoundException("Job seeker profile not found"));

        applySeekerRequest(profile, request, LocalDateTime.now());
        JobSeekerProfile saved = seekerRepository.save(profile);
        log.info("Updated job seeker profile {} ({}% complete)", saved.getId(), saved.getProfileCompletionPct());
        return JobSeekerProfileResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public JobSeekerProfileResponse getMySeekerProfile(Long actorId) {
        User actor = accountService.requireActiveUser(actorId);
        return seekerRepository.findByUserId(actor.getId())
                .map(JobSeekerProfileResponse::from)
                .orElseThrow(() -> new NotFoundException("Job seeker profile not found"));
    }

    /**
     * Read another user's job-seeker profile. Employers, admins and the owner may do so.
     */
    @Transactional(readOnly = true)
    public JobSeekerProfileResponse getSeekerProfile(Long actorId, Long userId) {
        User actor = accountService.requireActiveUser(actorId);
        if (!actor.getId().equals(userId)) {
            AccessRules.requireRole(actor, "view candidate profiles", Role.EMPLOYER);
        }
        return seekerRepository.findByUserId(userId)
                .map(JobSeekerProfileResponse::from)
                .orElseThrow(() -> NotFoundException.of("Job seeker profile for user", userId));
    }

    /**
     * Find candidates among job seekers with an active account, most complete profile first.
     *
     * @param skills        Any-of, case-insensitive; empty means no filter
     * @param minExperience Minimum years of experience; profiles without a value are excluded
     * @param location      Case-insensitive substring of a preferred location
     */
    @Transactional(readOnly = true)
    public List<JobSeekerProfileResponse> searchCandidates(Long actorId, List<String> skills,
            Integer minExperience, String location) {
        User actor = accountService.requireActiveUser(actorId);
        AccessRules.requireRole(actor, "search candidates", Role.EMPLOYER);

        List<String> wanted = skills == null ? List.of() : skills.stream()
                .filter(Objects::nonNull)
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .toList();
        String place = location == null || location.isBlank() ? null : location.trim().toLowerCase(Locale.ROOT);

        List<JobSeekerProfileResponse> found = seekerRepository.findByUserActiveTrueOrderByProfileCompletionPctDesc()
                .stream()
                .filter(p -> wanted.isEmpty() || p.getSkills().stream()
                        .anyMatch(skill -> wanted.contains(skill.toLowerCase(Locale.ROOT))))
                .filter(p -> minExperience == null
                        || (p.getExperienceYears() != null && p.getExperienceYears() >= minExperience))
                .filter(p -> place == null || p.getPreferredLocations().stream()
                        .anyMatch(loc -> loc.toLowerCase(Locale.ROOT).contains(place)))
                .map(JobSeekerProfileResponse::from)
                .toList();
        log.debug("Candidate search by user {} returned {} profiles", actor.getId(), found.size());
        return found;
    }

    // Recruiters

    @Transactional
    public RecruiterProfileResponse createRecruiterProfile(Long actorId, RecruiterProfileRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        AccessRules.requireExactRole(actor, "have a recruiter profile", Role.EMPLOYER);
        if (recruiterRepository.existsByUserId(actor.getId())) {
            throw new ConflictException("Recruiter profile already exists");
        }

        LocalDateTime now = LocalDateTime.now();
        RecruiterProfile profile = RecruiterProfile.builder()
                .user(actor)
                .createdAt(now)
                .build();
        applyRecruiterRequest(profile, request, now);

        RecruiterProfile saved = recruiterRepository.save(profile);
        log.info("Created recruiter profile {} for user {}", saved.getId(), actor.getId());
        return RecruiterProfileResponse.from(saved);
    }

    @Transactional
    public RecruiterProfileResponse updateRecruiterProfile(Long actorId, RecruiterProfileRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        RecruiterProfile profile = recruiterRepository.findByUserId(actor.getId())
                .orElseThrow(() -> new NotFoundException("Recruiter profile not found"));

        applyRecruiterRequest(profile, request, LocalDateTime.now());
        return RecruiterProfileResponse.from(recruiterRepository.save(profile));
    }

    @Transactional(readOnly = true)
    public RecruiterProfileResponse getMyRecruiterProfile(Long actorId) {
        User actor = accountService.requireActiveUser(actorId);
        return recruiterRepository.findByUserId(actor.getId())
                .map(RecruiterProfileResponse::from)
                .orElseThrow(() -> new NotFoundException("Recruiter profile not found"));
    }

    @Transactional(readOnly = true)
    public RecruiterProfileResponse getRecruiterProfile(Long actorId, Long userId) {
        accountService.requireActiveUser(actorId);
        return recruiterRepository.findByUserId(userId)
                .map(RecruiterProfileResponse::from)
                .orElseThrow(() -> NotFoundException.of("Recruiter profile for user", userId));
    }

    private void applySeekerRequest(JobSeekerProfile profile, JobSeekerProfileRequest request, LocalDateTime now) {
        profile.setPhone(trimToNull(request.getPhone()));
        profile.setHeadline(trimToNull(request.getHeadline()));
        profile.setSkills(new ArrayList<>(cleanList(request.getSkills())));
        profile.setExperienceYears(request.getExperienceYears());
        profile.setEducation(new ArrayList<>(request.getEducation() == null
                ? List.<Education>of()
                : request.getEducation().stream().filter(Objects::nonNull).toList()));
        profile.setPreferredLocations(new ArrayList<>(cleanList(request.getPreferredLocations())));
        profile.setResumeUrl(trimToNull(request.getResumeUrl()));
        profile.setUpdatedAt(now);
        profile.setProfileCompletionPct(completionCalculator.calculate(profile));
    }

    private void applyRecruiterRequest(RecruiterProfile profile, RecruiterProfileRequest request,
            LocalDateTime now) {
        profile.setCompanyName(trimToNull(request.getCompanyName()));
        profile.setCompanyLogo(trimToNull(request.getCompanyLogo()));
        profile.setDesignation(trimToNull(request.getDesignation()));
        profile.setCompanyWebsite(trimToNull(request.getCompanyWebsite()));
        profile.setIndustry(trimToNull(request.getIndustry()));
        profile.setUpdatedAt(now);
    }

    private List<String> cleanList(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
    }

    private String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
