package dev.jobscout.repository;

import dev.jobscout.entity.ScoutResult;
import dev.jobscout.entity.ScoutResultStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for per-user AI-scored results of on-demand runs.
 */
@Repository
public interface ScoutResultRepository extends JpaRepository<ScoutResult, Long> {

    Optional<ScoutResult> findByIdAndUserId(Long id, String userId);

    @Query("SELECT r.sourceUrl FROM ScoutResult r WHERE r.userId = :userId AND r.sourceUrl IS NOT NULL")
    Set<String> findSourceUrlsByUserId(@Param("userId") String userId);

    @Query("SELECT r.dedupHash FROM ScoutResult r WHERE r.userId = :userId AND r.dedupHash IS NOT NULL")
    Set<String> findDedupHashesByUserId(@Param("userId") String userId);

    /**
     * Source-specific keys ("source:externalId") already recorded for the user.
     */
    @Query("SELECT CONCAT(r.source, ':', r.externalId) FROM ScoutResult r "
            + "WHERE r.userId = :userId AND r.externalId IS NOT NULL")
    Set<String> findSourceKeysByUserId(@Param("userId") String userId);

    @Query("SELECT r.title, r.companyName FROM ScoutResult r WHERE r.userId = :userId")
    List<Object[]> findTitleCompanyPairsByUserId(@Param("userId") String userId);

    List<ScoutResult> findByUserIdAndStatus(String userId, ScoutResultStatus status);

    List<ScoutResult> findByScoutRunId(String scoutRunId);
}
