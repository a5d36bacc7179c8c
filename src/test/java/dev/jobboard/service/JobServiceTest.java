package dev.jobboard.service;

import dev.jobboard.TestData;
import dev.jobboard.config.PaginationConfig;
import dev.jobboard.entity.Job;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ForbiddenException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.exception.ValidationException;
import dev.jobboard.metrics.JobBoardMetrics;
import dev.jobboard.model.JobRequest;
import dev.jobboard.model.JobResponse;
import dev.jobboard.model.JobSearchCriteria;
import dev.jobboard.model.PageResponse;
import dev.jobboard.repository.ApplicationRepository;
import dev.jobboard.repository.JobRepository;
import dev.jobboard.repository.SavedJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock
    private JobRepository jobRepository;

    @Mock
    private ApplicationRepository applicationRepository;

    @Mock
    private SavedJobRepository savedJobRepository;

    @Mock
    private AccountService accountService;

    @Mock
    private JobBoardMetrics metrics;

    @Captor
    private ArgumentCaptor<Job> jobCaptor;

    private JobService jobService;
    private User employer;
    private User seeker;

    @BeforeEach
    void setUp() {
        jobService = new JobService(jobRepository, applicationRepository, savedJobRepository, accountService,
                new JobMatcher(), new PaginationConfig(), metrics);
        employer = TestData.user(1L, Role.EMPLOYER);
        seeker = TestData.user(2L, Role.JOB_SEEKER);
    }

    private JobRequest request() {
        return JobRequest.builder()
                .title(" Java Developer ")
                .description("Spring services")
                .company("Acme")
                .location("Remote")
                .salaryMin(40_000)
                .salaryMax(60_000)
                .skills(List.of("Java", " Spring ", "Java", ""))
                .build();
    }

    @Nested
    @DisplayName("Create")
    class CreateTests {

        @Test
        @DisplayName("Should post an active job with zero counters")
        void shouldCreateJob() {
            when(accountService.requireActiveUser(1L)).thenReturn(employer);
            when(jobRepository.save(any(Job.class))).thenAnswer(inv -> inv.getArgument(0));

            JobResponse response = jobService.create(1L, request());

            verify(jobRepository).save(jobCaptor.capture());
            Job saved = jobCaptor.getValue();
            assertThat(saved.getTitle()).isEqualTo("Java Developer");
            assertThat(saved.getSkills()).containsExactly("Java", "Spring");
            assertThat(saved.isActive()).isTrue();
            assertThat(saved.getApplicationCount()).isZero();
            assertThat(saved.getViewCount()).isZero();
            assertThat(saved.getPostedBy()).isSameAs(employer);
            assertThat(saved.getPostedAt()).isNotNull();
            assertThat(response.getPostedBy()).isEqualTo(1L);
            verify(metrics).recordJobPosted();
        }

        @Test
        @DisplayName("Should refuse job seekers")
        void shouldRefuseJobSeekers() {
            when(accountService.requireActiveUser(2L)).thenReturn(seeker);

            assertThatThrownBy(() -> jobService.create(2L, request()))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessage("Only employers can post jobs");
            verify(jobRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should refuse an inverted salary range")
        void shouldRefuseInvertedSalary() {
            when(accountService.requireActiveUser(1L)).thenReturn(employer);
            JobRequest request = request();
            request.setSalaryMin(90_000);

            assertThatThrownBy(() -> jobService.create(1L, request)).isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("Should filter and page active jobs")
        void shouldFilterAndPage() {
            List<Job> active = List.of(
                    TestData.job(3L, employer, "Java Developer", "Java"),
                    TestData.job(2L, employer, "Python Developer", "Python"),
                    TestData.job(1L, employer, "Senior Java Engineer", "Java"));
            when(jobRepository.findByActiveTrueOrderByPostedAtDesc()).thenReturn(active);

            PageResponse<JobResponse> page = jobService.search(
                    JobSearchCriteria.builder().keyword("java").build(), 0, 1);

            assertThat(page.getTotal()).isEqualTo(2);
            assertThat(page.getSize()).isEqualTo(1);
            assertThat(page.getItems()).extracting(JobResponse::getId).containsExactly(3L);

            PageResponse<JobResponse> second = jobService.search(
                    JobSearchCriteria.builder().keyword("java").build(), 1, 1);
            assertThat(second.getItems()).extracting(JobResponse::getId).containsExactly(1L);
        }

        @Test
        @DisplayName("Should return an empty page past the end")
        void shouldReturnEmptyPastEnd() {
            when(jobRepository.findByActiveTrueOrderByPostedAtDesc())
                    .thenReturn(List.of(TestData.job(1L, employer, "Java Developer")));

            PageResponse<JobResponse> page = jobService.search(JobSearchCriteria.builder().build(), 5, 10);

            assertThat(page.getItems()).isEmpty();
            assertThat(page.getTotal()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("View")
    class ViewTests {

        @Test
        @DisplayName("Should count the view")
        void shouldCountView() {
            Job job = TestData.job(5L, employer, "Java Developer");
            job.setViewCount(4);
            when(jobRepository.findByIdAndActiveTrue(5L)).thenReturn(Optional.of(job));

            JobResponse response = jobService.view(5L);

            assertThat(response.getViewCount()).isEqualTo(5);
            verify(jobRepository).incrementViewCount(5L);
            verify(metrics).recordJobView();
        }

        @Test
        @DisplayName("Should hide inactive or missing jobs")
        void shouldHideInactive() {
            when(jobRepository.findByIdAndActiveTrue(5L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> jobService.view(5L)).isInstanceOf(NotFoundException.class);
            verify(jobRepository, never()).incrementViewCount(any());
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class MaintenanceTests {

        @Test
        @DisplayName("Should only let the owner or an admin update")
        void shouldCheckOwnership() {
            User otherEmployer = TestData.user(8L, Role.EMPLOYER);
            when(accountService.requireActiveUser(8L)).thenReturn(otherEmployer);
            when(jobRepository.findById(5L)).thenReturn(Optional.of(TestData.job(5L, employer, "Java Developer")));

            assertThatThrownBy(() -> jobService.update(8L, 5L, request()))
                    .isInstanceOf(ForbiddenException.class)
                    .hasMessage("Not authorized to update this job");
        }

        @Test
        @DisplayName("Should let an admin deactivate any job")
        void shouldLetAdminDeactivate() {
            User admin = TestData.user(99L, Role.ADMIN);
            Job job = TestData.job(5L, employer, "Java Developer");
            when(accountService.requireActiveUser(99L)).thenReturn(admin);
            when(jobRepository.findById(5L)).thenReturn(Optional.of(job));
            when(jobRepository.save(job)).thenReturn(job);

            JobResponse response = jobService.setActive(99L, 5L, false);

            assertThat(response.isActive()).isFalse();
        }

        @Test
        @DisplayName("Should delete applications and bookmarks before the job")
        void shouldCascadeDelete() {
            Job job = TestData.job(5L, employer, "Java Developer");
            when(accountService.requireActiveUser(1L)).thenReturn(employer);
            when(jobRepository.findById(5L)).thenReturn(Optional.of(job));

            jobService.delete(1L, 5L);

            InOrder inOrder = inOrder(applicationRepository, savedJobRepository, jobRepository);
            inOrder.verify(applicationRepository).deleteByJobId(5L);
            inOrder.verify(savedJobRepository).deleteByJobId(5L);
            inOrder.verify(jobRepository).delete(job);
        }

        @Test
        @DisplayName("Should list only the employer's jobs")
        void shouldListMine() {
            when(accountService.requireActiveUser(1L)).thenReturn(employer);
            when(jobRepository.findByPostedByIdOrderByPostedAtDesc(1L))
                    .thenReturn(List.of(TestData.job(5L, employer, "Java Developer")));

            assertThat(jobService.mine(1L)).extracting(JobResponse::getId).containsExactly(5L);
        }
    }
}
