package dev.jobscout.service;

import dev.jobscout.config.ScoutConfig;
import dev.jobscout.config.SourcesConfig;
import dev.jobscout.entity.UserProfile;
import dev.jobscout.entity.UserScoutPreferences;
import dev.jobscout.source.SearchQuery;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds search queries for both run types and the profile summary sent to the AI scorer.
 */
@Component
@RequiredArgsConstructor
public class ScoutQueryBuilder {

    static final String NO_PROFILE = "No detailed profile available.";

    private final ScoutConfig scoutConfig;
    private final SourcesConfig sourcesConfig;

    /**
     * On-demand queries: the user's first few target roles crossed with their target locations.
     * Preferences win over the profile, the configured defaults fill in when both are empty.
     */
    public List<SearchQuery> userQueries(UserScoutPreferences prefs, UserProfile profile) {
        List<String> roles = targetRoles(prefs, profile);
        List<SearchQuery> queries = new ArrayList<>();
        for (String role : roles.subList(0, Math.min(roles.size(), scoutConfig.getMaxQueryRoles()))) {
            for (String location : targetLocations(prefs, profile)) {
                queries.add(new SearchQuery(role, location));
            }
        }
        return queries;
    }

    public List<String> targetRoles(UserScoutPreferences prefs, UserProfile profile) {
        return firstNonEmpty(
                prefs != null ? prefs.getTargetRoles() : null,
                profile != null ? profile.getTargetRoles() : null,
                scoutConfig.getDefaultTargetRoles());
    }

    public List<String> targetLocations(UserScoutPreferences prefs, UserProfile profile) {
        return firstNonEmpty(
                prefs != null ? prefs.getTargetLocations() : null,
                profile != null ? profile.getTargetLocations() : null,
                scoutConfig.getDefaultTargetLocations());
    }

    /**
     * Shared-pool queries: every configured template with its {@code {location}} placeholder filled.
     */
    public List<SearchQuery> poolQueries() {
        List<SearchQuery> queries = new ArrayList<>();
        for (String template : sourcesConfig.getQueryTemplates()) {
            for (String location : sourcesConfig.getLocations()) {
                queries.add(new SearchQuery(template.replace("{location}", location).trim(), location));
            }
        }
        return queries;
    }

    public static String profileSummary(UserProfile profile) {
        if (profile == null) {
            return NO_PROFILE;
        }
        List<String> parts = new ArrayList<>();
        if (!profile.getTargetRoles().isEmpty()) {
            parts.add("Target roles: " + String.join(", ", profile.getTargetRoles()));
        }
        if (!profile.getTargetLocations().isEmpty()) {
            parts.add("Target locations: " + String.join(", ", profile.getTargetLocations()));
        }
        if (!profile.getCoreSkills().isEmpty()) {
            parts.add("Core skills: " + String.join(", ", profile.getCoreSkills()));
        }
        if (!profile.getIndustries().isEmpty()) {
            parts.add("Industries: " + String.join(", ", profile.getIndustries()));
        }
        if (profile.getExperienceLevel() != null && !profile.getExperienceLevel().isBlank()) {
            parts.add("Experience level: " + profile.getExperienceLevel());
        }
        return parts.isEmpty() ? NO_PROFILE : String.join("\n", parts);
    }

    @SafeVarargs
    private static List<String> firstNonEmpty(List<String>... candidates) {
        for (List<String> candidate : candidates) {
            if (candidate != null) {
                List<String> cleaned = candidate.stream()
                        .filter(value -> value != null && !value.isBlank())
                        .toList();
                if (!cleaned.isEmpty()) {
                    return cleaned;
                }
            }
        }
        return List.of();
    }
}
