package dev.jobscout.service;

import dev.jobscout.entity.Company;
import dev.jobscout.normalize.PostingNormalizer;
import dev.jobscout.repository.CompanyRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaCompanyDirectory implements CompanyDirectory {

    private final CompanyRepository companyRepository;

    @Override
    public Optional<Company> resolveByName(String companyName) {
        String normalized = PostingNormalizer.normalizeCompany(companyName);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return companyRepository.findFirstByNormalizedName(normalized);
    }

    @Override
    public Optional<Company> findById(Long id) {
        return id == null ? Optional.empty() : companyRepository.findById(id);
    }

    @Override
    public Set<String> excludedNames() {
        return companyRepository.findExcludedNames().stream()
                .map(name -> name.toLowerCase(Locale.ROOT).trim())
                .collect(Collectors.toSet());
    }
}
