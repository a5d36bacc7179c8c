package dev.jobboard.repository;

import dev.jobboard.entity.JobAlert;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JobAlertRepository extends JpaRepository<JobAlert, Long> {

    List<JobAlert> findByUserIdOrderByCreatedAtDesc(Long userId);

    Optional<JobAlert> findByIdAndUserId(Long id, Long userId);

    List<JobAlert> findByActiveTrue();

    void deleteByUserId(Long userId);
}
