package dev.jobscout.repository;

import dev.jobscout.entity.PipelineJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Set;

/**
 * Repository for the user's application pipeline.
 */
@Repository
public interface PipelineJobRepository extends JpaRepository<PipelineJob, Long> {

    @Query("SELECT p.jdUrl FROM PipelineJob p WHERE p.userId = :userId AND p.jdUrl IS NOT NULL")
    Set<String> findJdUrlsByUserId(@Param("userId") String userId);

    @Query("SELECT p.roleTitle, p.companyName FROM PipelineJob p WHERE p.userId = :userId")
    List<Object[]> findTitleCompanyPairsByUserId(@Param("userId") String userId);

    List<PipelineJob> findByUserId(String userId);
}
