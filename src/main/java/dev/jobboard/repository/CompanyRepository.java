package dev.jobboard.repository;

import dev.jobboard.entity.Company;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CompanyRepository extends JpaRepository<Company, Long> {

    boolean existsByNameIgnoreCase(String name);

    boolean existsByNameIgnoreCaseAndIdNot(String name, Long id);

    Page<Company> findAllByOrderByNameAsc(Pageable pageable);

    Page<Company> findByVerifiedOrderByNameAsc(boolean verified, Pageable pageable);

    List<Company> findByOwnerId(Long ownerId);
}
