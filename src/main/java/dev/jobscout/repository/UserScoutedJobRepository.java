package dev.jobscout.repository;

import dev.jobscout.entity.UserScoutedJob;
import dev.jobscout.entity.UserScoutedJobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for per-user matches against the shared pool.
 */
@Repository
public interface UserScoutedJobRepository extends JpaRepository<UserScoutedJob, Long> {

    Optional<UserScoutedJob> findByIdAndUserId(Long id, String userId);

    boolean existsByUserIdAndScoutedJobId(String userId, Long scoutedJobId);

    /**
     * Count the user's dismissals with the given reason (learning thresholds).
     */
    long countByUserIdAndDismissReason(String userId, String dismissReason);

    List<UserScoutedJob> findByUserIdAndStatusOrderByMatchedAtDesc(String userId, UserScoutedJobStatus status);

    long countByUserId(String userId);
}
