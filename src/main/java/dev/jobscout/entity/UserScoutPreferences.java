package dev.jobscout.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-user matching preferences for the shared pool. Derived from the profile on first
 * access, editable afterwards, and adjusted by dismiss feedback.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "user_scout_preferences")
public class UserScoutPreferences {

    public static final String FLEX_PREFERRED = "preferred";
    public static final String FLEX_FLEXIBLE = "flexible";
    public static final String FLEX_STRICT = "strict";
    public static final int DEFAULT_MIN_SCORE = 30;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String userId;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> targetRoles = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 4000)
    private List<String> roleKeywords = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> targetLocations = new ArrayList<>();

    @Builder.Default
    @Column(length = 20)
    private String locationFlexibility = FLEX_PREFERRED;

    @Builder.Default
    @Convert(converter = LongSetConverter.class)
    @Column(length = 2000)
    private Set<Long> targetCompanyIds = new LinkedHashSet<>();

    @Builder.Default
    @Convert(converter = LongSetConverter.class)
    @Column(length = 2000)
    private Set<Long> excludedCompanyIds = new LinkedHashSet<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> targetIndustries = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> excludedIndustries = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 1000)
    private List<String> companyStages = new ArrayList<>();

    private Long minSalary;

    @Builder.Default
    @Column(length = 20)
    private String salaryFlexibility = FLEX_FLEXIBLE;

    @Builder.Default
    private int minScore = DEFAULT_MIN_SCORE;

    @Builder.Default
    @Convert(converter = LearnedAdjustmentListConverter.class)
    @Column(length = 8000)
    private List<LearnedAdjustment> learnedBoosts = new ArrayList<>();

    @Builder.Default
    @Convert(converter = LearnedAdjustmentListConverter.class)
    @Column(length = 8000)
    private List<LearnedAdjustment> learnedPenalties = new ArrayList<>();

    private Instant syncedFromProfileAt;

    public boolean isStrictLocation() {
        return FLEX_STRICT.equalsIgnoreCase(locationFlexibility);
    }

    public boolean isStrictSalary() {
        return FLEX_STRICT.equalsIgnoreCase(salaryFlexibility);
    }
}
