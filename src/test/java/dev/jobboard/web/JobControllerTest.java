package dev.jobboard.web;

import dev.jobboard.TestTokens;
import dev.jobboard.TestData;
import dev.jobboard.entity.JobType;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.WorkMode;
import dev.jobboard.exception.ForbiddenException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.model.JobRequest;
import dev.jobboard.model.JobResponse;
import dev.jobboard.model.JobSearchCriteria;
import dev.jobboard.model.PageResponse;
import dev.jobboard.service.JobService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobControllerTest {

    @Mock
    private JobService jobService;

    @Captor
    private ArgumentCaptor<JobSearchCriteria> criteriaCaptor;

    private final TestTokens tokens = new TestTokens();

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        client = WebTestClient.bindToController(new JobController(jobService))
                .argumentResolvers(configurer -> configurer.addCustomResolver(tokens.resolver()))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private JobResponse sampleJob() {
        return JobResponse.from(TestData.job(10L, TestData.user(1L, Role.EMPLOYER), "Java Developer", "Java"));
    }

    @Nested
    @DisplayName("Search")
    class SearchTests {

        @Test
        @DisplayName("Should pass every filter to the service")
        void shouldPassFilters() {
            when(jobService.search(any(), eq(1), eq(5)))
                    .thenReturn(new PageResponse<>(List.of(sampleJob()), 1, 5, 6));

            client.get()
                    .uri("/api/jobs?keyword=java&location=berlin&workMode=remote&jobType=full_time"
                            + "&minSalary=50000&maxExperience=4&skills=java,kafka&page=1&size=5")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.total").isEqualTo(6)
                    .jsonPath("$.items[0].title").isEqualTo("Java Developer")
                    .jsonPath("$.items[0].workMode").isEqualTo("hybrid");

            verify(jobService).search(criteriaCaptor.capture(), eq(1), eq(5));
            JobSearchCriteria criteria = criteriaCaptor.getValue();
            assertThat(criteria.getKeyword()).isEqualTo("java");
            assertThat(criteria.getWorkMode()).isEqualTo(WorkMode.REMOTE);
            assertThat(criteria.getJobType()).isEqualTo(JobType.FULL_TIME);
            assertThat(criteria.getMinSalary()).isEqualTo(50000);
            assertThat(criteria.getMaxExperience()).isEqualTo(4);
            assertThat(criteria.getSkills()).containsExactly("java", "kafka");
        }

        @Test
        @DisplayName("Should answer 400 for an unknown work mode")
        void shouldRejectUnknownWorkMode() {
            client.get()
                    .uri("/api/jobs?workMode=spaceship")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo(400)
                    .jsonPath("$.message").isEqualTo("Invalid workMode: spaceship")
                    .jsonPath("$.path").isEqualTo("/api/jobs");

            verifyNoInteractions(jobService);
        }
    }

    @Test
    @DisplayName("Should create a job for the acting user")
    void shouldCreateJob() {
        when(jobService.create(eq(1L), any(JobRequest.class))).thenReturn(sampleJob());

        client.post()
                .uri("/api/jobs")
                .header(HttpHeaders.AUTHORIZATION, tokens.bearer(1L, Role.EMPLOYER))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of(
                        "title", "Java Developer",
                        "description", "Spring services",
                        "company", "Acme",
                        "location", "Berlin",
                        "workMode", "hybrid",
                        "skills", List.of("Java")))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo(10)
                .jsonPath("$.postedBy").isEqualTo(1);
    }

    @Test
    @DisplayName("Should answer 400 with field messages for an invalid job")
    void shouldRejectInvalidJob() {
        client.post()
                .uri("/api/jobs")
                .header(HttpHeaders.AUTHORIZATION, tokens.bearer(1L, Role.EMPLOYER))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("title", "", "description", "d", "company", "c", "location", "l"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("title"));

        verifyNoInteractions(jobService);
    }

    @Test
    @DisplayName("Should map service errors to their status")
    void shouldMapServiceErrors() {
        when(jobService.view(404L)).thenThrow(NotFoundException.of("Job", 404L));
        doThrow(new ForbiddenException("Not authorized to delete this job")).when(jobService).delete(2L, 10L);

        client.get()
                .uri("/api/jobs/404")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Not Found")
                .jsonPath("$.message").isEqualTo("Job not found: 404");

        client.delete()
                .uri("/api/jobs/10")
                .header(HttpHeaders.AUTHORIZATION, tokens.bearer(2L, Role.EMPLOYER))
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    @DisplayName("Should answer 204 when a job is deleted")
    void shouldDeleteJob() {
        client.delete()
                .uri("/api/jobs/10")
                .header(HttpHeaders.AUTHORIZATION, tokens.bearer(1L, Role.EMPLOYER))
                .exchange()
                .expectStatus().isNoContent();

        verify(jobService).delete(1L, 10L);
    }
}
