package dev.jobscout.repository;

import dev.jobscout.entity.UserScoutPreferences;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserScoutPreferencesRepository extends JpaRepository<UserScoutPreferences, Long> {

    Optional<UserScoutPreferences> findByUserId(String userId);

    @Query("SELECT p.userId FROM UserScoutPreferences p ORDER BY p.id")
    List<String> findAllUserIds();
}
