package dev.jobscout.service;

import dev.jobscout.entity.Company;

import java.util.Optional;
import java.util.Set;

/**
 * Lookup into the internal company directory.
 */
public interface CompanyDirectory {

    /**
     * Resolve a company by name. The name is normalized before matching.
     */
    Optional<Company> resolveByName(String companyName);

    Optional<Company> findById(Long id);

    /**
     * Lowercase names of companies flagged as excluded.
     */
    Set<String> excludedNames();
}
