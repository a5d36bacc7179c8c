package dev.jobboard.service;

import dev.jobboard.config.PaginationConfig;
import dev.jobboard.entity.Company;
import dev.jobboard.entity.CompanyReview;
import dev.jobboard.entity.User;
import dev.jobboard.exception.ConflictException;
import dev.jobboard.exception.ForbiddenException;
import dev.jobboard.exception.NotFoundException;
import dev.jobboard.exception.ValidationException;
import dev.jobboard.model.CompanyRatings;
import dev.jobboard.model.PageResponse;
import dev.jobboard.model.ReviewRequest;
import dev.jobboard.model.ReviewResponse;
import dev.jobboard.model.ReviewUpdateRequest;
import dev.jobboard.repository.CompanyRepository;
import dev.jobboard.repository.CompanyReviewRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Service for company reviews and their rating averages.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewService {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    private final CompanyReviewRepository reviewRepository;
    private final CompanyRepository companyRepository;
    private final AccountService accountService;
    private final PaginationConfig paginationConfig;

    /**
     * Review a company. Any active user may, once per company.
     */
    @Transactional
    public ReviewResponse create(Long actorId, ReviewRequest request) {
        User actor = accountService.requireActiveUser(actorId);
        Company company = companyRepository.findById(request.getCompanyId())
                .orElseThrow(() -> NotFoundException.of("Company", request.getCompanyId()));

        CompanyReview review = CompanyReview.builder()
                .company(company)
                .author(actor)
                .ratingWorkCulture(requireRating("ratingWorkCulture", request.getRatingWorkCulture()))
                .ratingSalary(requireRating("ratingSalary", request.getRatingSalary()))
                .ratingHr(requireRating("ratingHr", request.getRatingHr()))
                .ratingManagement(requireRating("ratingManagement", request.getRatingManagement()))
                .pros(trimToNull(request.getPros()))
                .cons(trimToNull(request.getCons()))
                .interviewExperience(trimToNull(request.getInterviewExperience()))
                .build();

        if (reviewRepository.existsByAuthorIdAndCompanyId(actor.getId(), company.getId())) {
            throw new ConflictException("You have already reviewed this company");
        }

        LocalDateTime now = LocalDateTime.now();
        review.setCreatedAt(now);
        review.setUpdatedAt(now);
        CompanyReview saved = reviewRepository.save(review);
        log.info("User {} reviewed company {}", actor.getId(), company.getId());
        return ReviewResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public ReviewResponse get(Long reviewId) {
        return ReviewResponse.from(requireReview(reviewId));
    }

    /**
     * Newest first, optionally narrowed to one company and/or one author.
     */
    @Transactional(readOnly = true)
    public PageResponse<ReviewResponse> list(Long companyId, Long userId, Integer page, Integer size) {
        Pageable pageable = paginationConfig.pageable(page, size);
        Page<CompanyReview> reviews;
        if (companyId != null && userId != null) {
            reviews = reviewRepository.findByCompanyIdAndAuthorIdOrderByCreatedAtDesc(companyId, userId, pageable);
        } else if (companyId != null) {
            reviews = reviewRepository.findByCompanyIdOrderByCreatedAtDesc(companyId, pageable);
        } else if (userId != null) {
            reviews = reviewRepository.findByAuthorIdOrderByCreatedAtDesc(userId, pageable);
        } else {
            reviews = reviewRepository.findAllByOrderByCreatedAtDesc(pageable);
        }
        return PageResponse.of(reviews, ReviewResponse::from);
    }

    @Transactional
    public ReviewResponse update(Long actorId, Long reviewId, ReviewUpdateRequest request) {
        CompanyReview review = requireEditable(actorId, reviewId, "update");

        if (request.getRatingWorkCulture() != null) {
            review.setRatingWorkCulture(requireRating("ratingWorkCulture", request.getRatingWorkCulture()));
        }
        if (request.getRatingSalary() != null) {
            review.setRatingSalary(requireRating("ratingSalary", request.getRatingSalary()));
        }
        if (request.getRatingHr() != null) {
            review.setRatingHr(requireRating("ratingHr", request.getRatingHr()));
        }
        if (request.getRatingManagement() != null) {
            review.setRatingManagement(requireRating("ratingManagement", request.getRatingManagement()));
        }
        if (request.getPros() != null) {
            review.setPros(trimToNull(request.getPros()));
        }
        if (request.getCons() != null) {
            review.setCons(trimToNull(request.getCons()));
        }
        if (request.getInterviewExperience() != null) {
            review.setInterviewExperience(trimToNull(request.getInterviewExperience()));
        }
        review.setUpdatedAt(LocalDateTime.now());
        return ReviewResponse.from(reviewRepository.save(review));
    }

    @Transactional
    public void delete(Long actorId, Long reviewId) {
        CompanyReview review = requireEditable(actorId, reviewId, "delete");
        reviewRepository.delete(review);
        log.info("Review {} deleted by user {}", reviewId, actorId);
    }

    /**
     * Average of each rating over all of a company's reviews, rounded to two decimals.
     */
    @Transactional(readOnly = true)
    public CompanyRatings averages(Long companyId) {
        Company company = companyRepository.findById(companyId)
                .orElseThrow(() -> NotFoundException.of("Company", companyId));

        List<Object[]> rows = reviewRepository.aggregateRatings(companyId);
        Object[] row = rows.isEmpty() ? new Object[5] : rows.get(0);
        long total = row[4] == null ? 0 : ((Number) row[4]).longValue();

        return CompanyRatings.builder()
                .companyId(company.getId())
                .companyName(company.getName())
                .averageRatings(new CompanyRatings.Averages(
                        round(row[0]), round(row[1]), round(row[2]), round(row[3])))
                .totalReviews(total)
                .build();
    }

    static double round(Object average) {
        if (average == null) {
            return 0;
        }
        return BigDecimal.valueOf(((Number) average).doubleValue())
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private CompanyReview requireEditable(Long actorId, Long reviewId, String action) {
        User actor = accountService.requireActiveUser(actorId);
        CompanyReview review = requireReview(reviewId);
        if (!actor.isAdmin() && !review.isWrittenBy(actor)) {
            throw new ForbiddenException("Not authorized to " + action + " this review");
        }
        return review;
    }

    private CompanyReview requireReview(Long reviewId) {
        return reviewRepository.findById(reviewId).orElseThrow(() -> NotFoundException.of("Review", reviewId));
    }

    private static int requireRating(String field, Integer value) {
        if (value == null || value < MIN_RATING || value > MAX_RATING) {
            throw new ValidationException(field + " must be between " + MIN_RATING + " and " + MAX_RATING);
        }
        return value;
    }

    private String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
