package dev.jobscout.repository;

import dev.jobscout.entity.Company;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CompanyRepository extends JpaRepository<Company, Long> {

    Optional<Company> findFirstByNormalizedName(String normalizedName);

    @Query("SELECT c.name FROM Company c WHERE c.excluded = true")
    List<String> findExcludedNames();
}
