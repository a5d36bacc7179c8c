package dev.jobboard.service;

import dev.jobboard.TestData;
import dev.jobboard.config.ProfileCompletionConfig;
import dev.jobboard.entity.JobSeekerProfile;
import dev.jobboard.entity.RecruiterProfile;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ConflictException;
import dev.jobboard.exception.ForbiddenException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.model.JobSeekerProfileRequest;
import dev.jobboard.model.JobSeekerProfileResponse;
import dev.jobboard.model.RecruiterProfileRequest;
import dev.jobboard.model.RecruiterProfileResponse;
import dev.jobboard.repository.JobSeekerProfileRepository;
import dev.jobboard.repository.RecruiterProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProfileServiceTest {

    @Mock
    private JobSeekerProfileRepository seekerRepository;

    @Mock
    private RecruiterProfileRepository recruiterRepository;

    @Mock
    private AccountService accountService;

    private ProfileService profileService;
    private User seeker;
    private User employer;

    @BeforeEach
    void setUp() {
        profileService = new ProfileService(seekerRepository, recruiterRepository, accountService,
                new ProfileCompletionCalculator(new ProfileCompletionConfig()));
        seeker = TestData.user(2L, Role.JOB_SEEKER);
        employer = TestData.user(1L, Role.EMPLOYER);
    }

    private JobSeekerProfile profile(User user, int experience, String skill, String location) {
        return JobSeekerProfile.builder()
                .id(user.getId() * 10)
                .user(user)
                .skills(new ArrayList<>(List.of(skill)))
                .experienceYears(experience)
                .preferredLocations(new ArrayList<>(List.of(location)))
                .profileCompletionPct(60)
                .createdAt(LocalDateTime.now())
                .updatedAt(LocalDateTime.now())
                .build();
    }

    @Nested
    @DisplayName("Job seeker profiles")
    class SeekerTests {

        @Test
        @DisplayName("Should create a profile and compute its completion")
        void shouldCreate() {
            when(accountService.requireActiveUser(2L)).thenReturn(seeker);
            when(seekerRepository.existsByUserId(2L)).thenReturn(false);
            when(seekerRepository.save(any(JobSeekerProfile.class))).thenAnswer(inv -> inv.getArgument(0));

            JobSeekerProfileResponse response = profileService.createSeekerProfile(2L, JobSeekerProfileRequest.builder()
                    .headline(" Backend engineer ")
                    .skills(List.of("Java", "java ", "Java"))
                    .build());

            assertThat(response.getHeadline()).isEqualTo("Backend engineer");
            assertThat(response.getSkills()).containsExactly("Java", "java");
            assertThat(response.getFullName()).isEqualTo("User 2");
            // name, email, headline, skills: 6 of 11
            assertThat(response.getProfileCompletionPct()).isEqualTo(54);
        }

        @Test
        @DisplayName("Should refuse a second profile")
        void shouldRefuseSecond() {
            when(accountService.requireActiveUser(2L)).thenReturn(seeker);
            when(seekerRepository.existsByUserId(2L)).thenReturn(true);

            assertThatThrownBy(() -> profileService.createSeekerProfile(2L, new JobSeekerProfileRequest()))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("Should refuse accounts of another role")
        void shouldRefuseOtherRoles() {
            when(accountService.requireActiveUser(1L)).thenReturn(employer);

            assertThatThrownBy(() -> profileService.createSeekerProfile(1L, new JobSeekerProfileRequest()))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("Should recompute completion on update")
        void shouldRecomputeOnUpdate() {
            JobSeekerProfile existing = profile(seeker, 3, "Java", "Berlin");
            when(accountService.requireActiveUser(2L)).thenReturn(seeker);
            when(seekerRepository.findByUserId(2L)).thenReturn(Optional.of(existing));
            when(seekerRepository.save(existing)).thenReturn(existing);

            JobSeekerProfileResponse response = profileService.updateSeekerProfile(2L, new JobSeekerProfileRequest());

            assertThat(response.getSkills()).isEmpty();
            assertThat(response.getProfileCompletionPct()).isEqualTo(36);
        }

        @Test
        @DisplayName("Should let employers read candidates but not other job seekers")
        void shouldRestrictReads() {
            User otherSeeker = TestData.user(3L, Role.JOB_SEEKER);
            when(accountService.requireActiveUser(1L)).thenReturn(employer);
            when(accountService.requireActiveUser(3L)).thenReturn(otherSeeker);
            when(seekerRepository.findByUserId(2L)).thenReturn(Optional.of(profile(seeker, 3, "Java", "Berlin")));

            assertThat(profileService.getSeekerProfile(1L, 2L).getUserId()).isEqualTo(2L);
            assertThatThrownBy(() -> profileService.getSeekerProfile(3L, 2L))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("Should report a missing profile")
        void shouldReportMissing() {
            when(accountService.requireActiveUser(2L)).thenReturn(seeker);
            when(seekerRepository.findByUserId(2L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> profileService.getMySeekerProfile(2L)).isInstanceOf(NotFoundException.class);
        }
    }

    @Test
    @DisplayName("Should filter candidates by skill, experience and location")
    void shouldSearchCandidates() {
        User alice = TestData.user(20L, Role.JOB_SEEKER);
        User bob = TestData.user(21L, Role.JOB_SEEKER);
        User carol = TestData.user(22L, Role.JOB_SEEKER);
        when(accountService.requireActiveUser(1L)).thenReturn(employer);
        when(seekerRepository.findByUserActiveTrueOrderByProfileCompletionPctDesc()).thenReturn(List.of(
                profile(alice, 5, "Java", "Berlin"),
                profile(bob, 1, "java", "Munich"),
                profile(carol, 8, "Go", "Berlin")));

        assertThat(profileService.searchCandidates(1L, List.of("JAVA"), null, null))
                .extracting(JobSeekerProfileResponse::getUserId).containsExactly(20L, 21L);
        assertThat(profileService.searchCandidates(1L, List.of(), 4, "berl"))
                .extracting(JobSeekerProfileResponse::getUserId).containsExactly(20L, 22L);
    }

    @Test
    @DisplayName("Should refuse candidate search to job seekers")
    void shouldRefuseSearchToSeekers() {
        when(accountService.requireActiveUser(2L)).thenReturn(seeker);

        assertThatThrownBy(() -> profileService.searchCandidates(2L, List.of(), null, null))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("Should create a recruiter profile for employers only")
    void shouldCreateRecruiterProfile() {
        when(accountService.requireActiveUser(1L)).thenReturn(employer);
        when(accountService.requireActiveUser(2L)).thenReturn(seeker);
        when(recruiterRepository.existsByUserId(1L)).thenReturn(false);
        when(recruiterRepository.save(any(RecruiterProfile.class))).thenAnswer(inv -> inv.getArgument(0));

        RecruiterProfileResponse response = profileService.createRecruiterProfile(1L,
                RecruiterProfileRequest.builder().companyName(" Acme ").industry("Software").build());

        assertThat(response.getCompanyName()).isEqualTo("Acme");
        assertThat(response.getUserId()).isEqualTo(1L);
        assertThatThrownBy(() -> profileService.createRecruiterProfile(2L, new RecruiterProfileRequest()))
                .isInstanceOf(ForbiddenException.class);
    }
}
