package dev.jobscout.repository;

import dev.jobscout.entity.ScoutedJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for the shared posting pool.
 */
@Repository
public interface ScoutedJobRepository extends JpaRepository<ScoutedJob, Long> {

    /**
     * Find pool entries for a set of fingerprints (upsert lookup).
     */
    List<ScoutedJob> findByDedupHashIn(Collection<String> dedupHashes);

    long countByActiveTrue();

    /**
     * Mark active entries not re-sighted since the cutoff as inactive.
     *
     * @return number of entries deactivated
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ScoutedJob j SET j.active = false, j.inactiveReason = :reason "
            + "WHERE j.active = true AND j.lastSeenAt < :cutoff")
    int markStale(@Param("cutoff") Instant cutoff, @Param("reason") String reason);

    /**
     * Active pool entries the user has no match row for yet.
     */
    @Query("SELECT j FROM ScoutedJob j WHERE j.active = true AND NOT EXISTS "
            + "(SELECT u.id FROM UserScoutedJob u WHERE u.userId = :userId AND u.scoutedJob = j)")
    List<ScoutedJob> findActiveUnmatchedForUser(@Param("userId") String userId);
}
