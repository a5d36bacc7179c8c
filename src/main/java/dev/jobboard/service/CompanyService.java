package dev.jobboard.service;

import dev.jobboard.config.PaginationConfig;
import dev.jobboard.entity.Company;
import dev.jobboard.entity.CompanyVerificationStatus;
import dev.jobboard.entity.NotificationType;
import dev.jobboard.entity.Role;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ConflictException;
import dev.jobboard.exception.ForbiddenException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.model.CompanyRequest;
import dev.jobboard.model.CompanyResponse;
import dev.jobboard.model.CompanyVerificationRequest;
import dev.jobboard.model.PageResponse;
import dev.jobboard.repository.CompanyRepository;
import dev.jobboard.repository.CompanyReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Locale;

/**
 * Service for company pages. Employers create and maintain them, admins verify them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompanyService {

    private final CompanyRepository companyRepository;
    private final CompanyReviewRepository reviewRepository;
    private final AccountService accountService;
    private final NotificationService notificationService;
    private final PaginationConfig paginationConfig;

    /**
     * Create a company owned by the acting employer. It starts out pending verification.
     */
    @Transactional
    public CompanyResponse create(Long actorId, CompanyRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        AccessRules.requireExactRole(actor, "create companies", Role.EMPLOYER);

        String name = request.getName().trim();
        if (companyRepository.existsByNameIgnoreCase(name)) {
            throw new ConflictException("A company named '" + name + "' already exists");
        }

        LocalDateTime now = LocalDateTime.now();
        Company company = Company.builder()
                .owner(actor)
                .verificationStatus(CompanyVerificationStatus.PENDING)
                .verified(false)
                .createdAt(now)
                .build();
        applyRequest(company, request, now);

        Company saved = companyRepository.save(company);
        log.info("Employer {} created company {} '{}'", actor.getId(), saved.getId(), saved.getName());
        return CompanyResponse.from(saved);
    }

    /**
     * @param verified Optional filter on the verification flag
     */
    @Transactional(readOnly = true)
    public PageResponse<CompanyResponse> list(Boolean verified, Integer page, Integer size) {
        Pageable pageable = paginationConfig.pageable(page, size);
        return PageResponse.of(verified == null
                        ? companyRepository.findAllByOrderByNameAsc(pageable)
                        : companyRepository.findByVerifiedOrderByNameAsc(verified, pageable),
                CompanyResponse::from);
    }

    @Transactional(readOnly = true)
    public CompanyResponse get(Long companyId) {
        return CompanyResponse.from(requireCompany(companyId));
    }

    @Transactional
    public CompanyResponse update(Long actorId, Long companyId, CompanyRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        Company company = requireCompany(companyId);
        if (!actor.isAdmin() && !company.isOwnedBy(actor)) {
            throw new ForbiddenException("Not authorized to update this company");
        }

        String name = request.getName().trim();
        if (companyRepository.existsByNameIgnoreCaseAndIdNot(name, companyId)) {
            throw new ConflictException("A company named '" + name + "' already exists");
        }
        applyRequest(company, request, LocalDateTime.now());
        log.info("Company {} updated by user {}", companyId, actor.getId());
        return CompanyResponse.from(companyRepository.save(company));
    }

    /**
     * Record an admin's verification decision and tell the owner about it.
     */
    @Transactional
    public CompanyResponse setVerification(Long actorId, Long companyId, CompanyVerificationRequest request) {
        User admin = accountService.requireActiveUser(actorId);
        AccessRules.requireRole(admin, "verify companies", Role.ADMIN);
        Company company = requireCompany(companyId);

        CompanyVerificationStatus status = request.getStatus();
        company.setVerificationStatus(status);
        company.setVerified(status == CompanyVerificationStatus.VERIFIED);
        company.setVerificationNotes(trimToNull(request.getNotes()));
        company.setUpdatedAt(LocalDateTime.now());
        Company saved = companyRepository.save(company);

        if (status != CompanyVerificationStatus.PENDING) {
            notificationService.notify(company.getOwner(), NotificationType.COMPANY_VERIFICATION,
                    "Company " + status.value(),
                    "Your company " + company.getName() + " was " + status.value(),
                    companyId);
        }
        log.info("Company {} marked {} by admin {}", companyId, status.value(), admin.getId());
        return CompanyResponse.from(saved);
    }

    /**
     * Delete a company together with its reviews.
     */
    @Transactional
    public void removeWithDependents(Company company) {
        reviewRepository.deleteByCompanyId(company.getId());
        companyRepository.delete(company);
    }

    private Company requireCompany(Long companyId) {
        return companyRepository.findById(companyId).orElseThrow(() -> NotFoundException.of("Company", companyId));
    }

    private void applyRequest(Company company, CompanyRequest request, LocalDateTime now) {
        company.setName(request.getName().trim());
        company.setDescription(trimToNull(request.getDescription()));
        company.setWebsite(trimToNull(request.getWebsite()));
        company.setIndustry(trimToNull(request.getIndustry()));
        company.setSize(trimToNull(request.getSize()));
        company.setFoundedYear(request.getFoundedYear());
        company.setHeadquarters(trimToNull(request.getHeadquarters()));
        String domain = trimToNull(request.getEmailDomain());
        company.setEmailDomain(domain == null ? null : stripAt(domain).toLowerCase(Locale.ROOT));
        company.setUpdatedAt(now);
    }

    private static String stripAt(String domain) {
        return domain.startsWith("@") ? domain.substring(1) : domain;
    }

    private String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
