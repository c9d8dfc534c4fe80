package dev.jobscout.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The user's career profile: source of derived scout preferences and of the
 * profile summary handed to the AI scorer.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "user_profiles")
public class UserProfile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String userId;

    private String name;

    private String email;

    // Chat id or address the notification sink delivers to
    private String notificationRecipient;

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> targetRoles = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> targetLocations = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 4000)
    private List<String> coreSkills = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 4000)
    private List<String> resumeKeywords = new ArrayList<>();

    @Builder.Default
    @Convert(converter = StringListConverter.class)
    @Column(length = 2000)
    private List<String> industries = new ArrayList<>();

    private String experienceLevel;

    // Free text such as "50-80 Lakh" or "90 LPA"
    private String targetSalaryRange;
}
