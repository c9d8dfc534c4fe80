package dev.jobscout.service;

import dev.jobscout.entity.UserProfile;
import dev.jobscout.entity.UserScoutPreferences;
import dev.jobscout.repository.UserProfileRepository;
import dev.jobscout.repository.UserScoutPreferencesRepository;
import dev.jobscout.service.PreferencesService.PreferencesUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PreferencesServiceTest {

  private static final Instant NOW = Instant.parse("2025-03-10T08:00:00Z");

  @Mock
  private UserScoutPreferencesRepository preferencesRepository;

  @Mock
  private UserProfileRepository profileRepository;

  private PreferencesService preferencesService;

  @BeforeEach
  void setUp() {
    preferencesService = new PreferencesService(preferencesRepository, profileRepository,
        Clock.fixed(NOW, ZoneOffset.UTC));
    lenient().when(preferencesRepository.save(any(UserScoutPreferences.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
  }

  private UserProfile profile() {
    return UserProfile.builder()
        .userId("u1")
        .targetRoles(List.of("Head of Growth", "VP Marketing"))
        .targetLocations(List.of("Bangalore"))
        .coreSkills(List.of("performance marketing", "retention"))
        .resumeKeywords(List.of("retention", "seo"))
        .industries(List.of("Fintech"))
        .targetSalaryRange("50-80 Lakh")
        .build();
  }

  @Test
  void getOrCreate_shouldReturnExisting() {
    UserScoutPreferences existing = UserScoutPreferences.builder().userId("u1").minScore(55).build();
    when(preferencesRepository.findByUserId("u1")).thenReturn(Optional.of(existing));

    assertThat(preferencesService.getOrCreate("u1")).isSameAs(existing);
    verify(preferencesRepository, never()).save(any());
  }

  @Test
  void getOrCreate_shouldDeriveFromProfile() {
    when(preferencesRepository.findByUserId("u1")).thenReturn(Optional.empty());
    when(profileRepository.findByUserId("u1")).thenReturn(Optional.of(profile()));

    UserScoutPreferences prefs = preferencesService.getOrCreate("u1");

    assertThat(prefs.getTargetRoles()).containsExactly("Head of Growth", "VP Marketing");
    assertThat(prefs.getTargetLocations()).containsExactly("Bangalore");
    assertThat(prefs.getRoleKeywords()).containsExactly("performance marketing", "retention", "seo");
    assertThat(prefs.getTargetIndustries()).containsExactly("Fintech");
    assertThat(prefs.getExcludedIndustries()).containsExactly("Food Delivery");
    assertThat(prefs.getMinSalary()).isEqualTo(5_000_000L);
    assertThat(prefs.getMinScore()).isEqualTo(UserScoutPreferences.DEFAULT_MIN_SCORE);
    assertThat(prefs.getLocationFlexibility()).isEqualTo(UserScoutPreferences.FLEX_PREFERRED);
    assertThat(prefs.getSalaryFlexibility()).isEqualTo(UserScoutPreferences.FLEX_FLEXIBLE);
  }

  @Test
  void getOrCreate_shouldUseDefaultsWithoutProfile() {
    when(preferencesRepository.findByUserId("ghost")).thenReturn(Optional.empty());
    when(profileRepository.findByUserId("ghost")).thenReturn(Optional.empty());

    UserScoutPreferences prefs = preferencesService.getOrCreate("ghost");

    assertThat(prefs.getUserId()).isEqualTo("ghost");
    assertThat(prefs.getTargetRoles()).isEmpty();
    assertThat(prefs.getMinSalary()).isNull();
  }

  @Test
  void syncFromProfile_shouldRefreshAndStamp() {
    UserScoutPreferences existing = UserScoutPreferences.builder().userId("u1").minScore(60).build();
    when(preferencesRepository.findByUserId("u1")).thenReturn(Optional.of(existing));
    when(profileRepository.findByUserId("u1")).thenReturn(Optional.of(profile()));

    Optional<UserScoutPreferences> synced = preferencesService.syncFromProfile("u1");

    assertThat(synced).isPresent();
    assertThat(synced.get().getTargetRoles()).contains("Head of Growth");
    assertThat(synced.get().getMinScore()).isEqualTo(60);
    assertThat(synced.get().getSyncedFromProfileAt()).isEqualTo(NOW);
  }

  @Test
  void syncFromProfile_shouldReturnEmptyWithoutPreferences() {
    when(preferencesRepository.findByUserId("u1")).thenReturn(Optional.empty());

    assertThat(preferencesService.syncFromProfile("u1")).isEmpty();
  }

  @Test
  void update_shouldApplyOnlyProvidedFields() {
    UserScoutPreferences existing = UserScoutPreferences.builder()
        .userId("u1")
        .targetRoles(List.of("Head of Growth"))
        .build();
    when(preferencesRepository.findByUserId("u1")).thenReturn(Optional.of(existing));

    UserScoutPreferences updated = preferencesService.update("u1", new PreferencesUpdate(
        null, null, List.of("Remote"), "STRICT", null, null, null, null, null,
        6_000_000L, "bogus", 45));

    assertThat(updated.getTargetRoles()).containsExactly("Head of Growth");
    assertThat(updated.getTargetLocations()).containsExactly("Remote");
    assertThat(updated.isStrictLocation()).isTrue();
    assertThat(updated.getSalaryFlexibility()).isEqualTo(UserScoutPreferences.FLEX_FLEXIBLE);
    assertThat(updated.getMinSalary()).isEqualTo(6_000_000L);
    assertThat(updated.getMinScore()).isEqualTo(45);
  }

  @Test
  void update_shouldRejectOutOfRangeMinScore() {
    when(preferencesRepository.findByUserId("u1"))
        .thenReturn(Optional.of(UserScoutPreferences.builder().userId("u1").build()));

    PreferencesUpdate update = new PreferencesUpdate(null, null, null, null, null, null, null, null, null,
        null, null, 101);

    assertThatThrownBy(() -> preferencesService.update("u1", update))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("minScore");
  }

  @Test
  void parseMinSalary_shouldHandleCommonFormats() {
    assertThat(PreferencesService.parseMinSalary("50-80 Lakh")).isEqualTo(5_000_000L);
    assertThat(PreferencesService.parseMinSalary("90 LPA")).isEqualTo(9_000_000L);
    assertThat(PreferencesService.parseMinSalary("45")).isEqualTo(4_500_000L);
    assertThat(PreferencesService.parseMinSalary("2500000")).isEqualTo(2_500_000L);
    assertThat(PreferencesService.parseMinSalary("negotiable")).isNull();
    assertThat(PreferencesService.parseMinSalary(null)).isNull();
  }
}
