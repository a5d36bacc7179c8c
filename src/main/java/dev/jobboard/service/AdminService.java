package dev.jobboard.service;

import dev.jobboard.config.PaginationConfig;
import dev.jobboard.entity.Application;
import dev.jobboard.entity.Company;
import dev.jobboard.entity.Job;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ConflictException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.model.PageResponse;
import dev.jobboard.model.UserResponse;
import dev.jobboard.repository.ApplicationRepository;
import dev.jobboard.repository.CompanyRepository;
import dev.jobboard.repository.CompanyReviewRepository;
import dev.jobboard.repository.JobAlertRepository;
import dev.jobboard.repository.JobRepository;
import dev.jobboard.repository.JobSeekerProfileRepository;
import dev.jobboard.repository.NotificationRepository;
import dev.jobboard.repository.RecruiterProfileRepository;
import dev.jobboard.repository.SavedJobRepository;
import dev.jobboard.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Account administration. Every operation requires an admin as acting user.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminService {

    private final UserRepository userRepository;
    private final JobRepository jobRepository;
    private final ApplicationRepository applicationRepository;
    private final SavedJobRepository savedJobRepository;
    private final JobSeekerProfileRepository seekerProfileRepository;
    private final RecruiterProfileRepository recruiterProfileRepository;
    private final NotificationRepository notificationRepository;
    private final JobAlertRepository alertRepository;
    private final CompanyRepository companyRepository;
    private final CompanyReviewRepository reviewRepository;
    private final AccountService accountService;
    private final JobService jobService;
    private final CompanyService companyService;
    private final PaginationConfig paginationConfig;

    /**
     * @param role Optional role filter
     */
    @Transactional(readOnly = true)
    public PageResponse<UserResponse> listUsers(Long actorId, Role role, Integer page, Integer size) {
        requireAdmin(actorId);
        Pageable pageable = paginationConfig.pageable(page, size);
        return PageResponse.of(role == null
                        ? userRepository.findAll(pageable)
                        : userRepository.findByRole(role, pageable),
                UserResponse::from);
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(Long actorId, Long userId) {
        requireAdmin(actorId);
        return UserResponse.from(requireUser(userId));
    }

    @Transactional
    public UserResponse setActive(Long actorId, Long userId, boolean active) {
        User admin = requireAdmin(actorId);
        if (!active && admin.getId().equals(userId)) {
            throw new ConflictException("Admins cannot deactivate their own account");
        }
        User user = requireUser(userId);
        user.setActive(active);
        user.setUpdatedAt(LocalDateTime.now());
        log.info("User {} {} by admin {}", userId, active ? "activated" : "deactivated", admin.getId());
        return UserResponse.from(userRepository.save(user));
    }

    @Transactional
    public UserResponse verify(Long actorId, Long userId) {
        User admin = requireAdmin(actorId);
        User user = requireUser(userId);
        if (!user.isVerified()) {
            user.setVerified(true);
            user.setUpdatedAt(LocalDateTime.now());
            user = userRepository.save(user);
            log.info("User {} verified by admin {}", userId, admin.getId());
        }
        return UserResponse.from(user);
    }

    /**
     * Delete an account and everything that references it: posted jobs (with their applications
     * and bookmarks), owned companies (with their reviews), own applications, reviews, bookmarks,
     * profiles, notifications and alerts.
     */
    @Transactional
    public void deleteUser(Long actorId, Long userId) {
        User admin = requireAdmin(actorId);
        if (admin.getId().equals(userId)) {
            throw new ConflictException("Admins cannot delete their own account");
        }
        User user = requireUser(userId);

        int jobs = 0;
        for (Job job : jobRepository.findByPostedByIdOrderByPostedAtDesc(userId)) {
            jobService.removeWithDependents(job);
            jobs++;
        }

        int applications = 0;
        for (Application application : applicationRepository.findByApplicantId(userId)) {
            Long jobId = application.getJob().getId();
            applicationRepository.delete(application);
            jobRepository.decrementApplicationCount(jobId);
            applications++;
        }

        reviewRepository.deleteByAuthorId(userId);
        int companies = 0;
        for (Company company : companyRepository.findByOwnerId(userId)) {
            companyService.removeWithDependents(company);
            companies++;
        }

        savedJobRepository.deleteByUserId(userId);
        seekerProfileRepository.deleteByUserId(userId);
        recruiterProfileRepository.deleteByUserId(userId);
        notificationRepository.deleteByUserId(userId);
        alertRepository.deleteByUserId(userId);
        userRepository.delete(user);

        log.info("User {} deleted by admin {} ({} jobs, {} companies, {} applications removed)", userId,
                admin.getId(), jobs, companies, applications);
    }

    private User requireAdmin(Long actorId) {
        User actor = accountService.requireActiveUser(actorId);
        AccessRules.requireRole(actor, "manage users", Role.ADMIN);
        return actor;
    }

    private User requireUser(Long userId) {
        return userRepository.findById(userId).orElseThrow(() -> NotFoundException.of("User", userId));
    }
}
