package dev.jobboard.repository;

import dev.jobboard.entity.CompanyReview;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CompanyReviewRepository extends JpaRepository<CompanyReview, Long> {

    boolean existsByAuthorIdAndCompanyId(Long authorId, Long companyId);

    Page<CompanyReview> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<CompanyReview> findByCompanyIdOrderByCreatedAtDesc(Long companyId, Pageable pageable);

    Page<CompanyReview> findByAuthorIdOrderByCreatedAtDesc(Long authorId, Pageable pageable);

    Page<CompanyReview> findByCompanyIdAndAuthorIdOrderByCreatedAtDesc(Long companyId, Long authorId,
            Pageable pageable);

    /**
     * Single row of averages and count over a company's reviews: work culture, salary, HR,
     * management, count. The averages are null when there are no reviews.
     */
    @Query("SELECT AVG(r.ratingWorkCulture), AVG(r.ratingSalary), AVG(r.ratingHr), AVG(r.ratingManagement), COUNT(r) "
            + "FROM CompanyReview r WHERE r.company.id = :companyId")
    List<Object[]> aggregateRatings(@Param("companyId") Long companyId);

    void deleteByAuthorId(Long authorId);

    void deleteByCompanyId(Long companyId);
}
