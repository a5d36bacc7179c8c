package dev.jobboard.repository;

import dev.jobboard.entity.SavedJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SavedJobRepository extends JpaRepository<SavedJob, Long> {

    boolean existsByUserIdAndJobId(Long userId, Long jobId);

    Optional<SavedJob> findByIdAndUserId(Long id, Long userId);

    Optional<SavedJob> findByUserIdAndJobId(Long userId, Long jobId);

    List<SavedJob> findByUserIdOrderByCreatedAtDesc(Long userId);

    void deleteByJobId(Long jobId);

    void deleteByUserId(Long userId);
}
