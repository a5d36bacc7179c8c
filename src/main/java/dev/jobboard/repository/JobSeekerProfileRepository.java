package dev.jobboard.repository;

import dev.jobboard.entity.JobSeekerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface JobSeekerProfileRepository extends JpaRepository<JobSeekerProfile, Long> {

    Optional<JobSeekerProfile> findByUserId(Long userId);

    boolean existsByUserId(Long userId);

    List<JobSeekerProfile> findByUserActiveTrueOrderByProfileCompletionPctDesc();

    void deleteByUserId(Long userId);
}
