package com.eyelevel.invoiceingestion.service.matching;

import com.eyelevel.invoiceingestion.model.Company;
import com.eyelevel.invoiceingestion.repository.CompanyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Maps an extracted account number to an active company: exact reference number, then the digits-only form of
 * the value, then the company code.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityMatcher {

    private final CompanyRepository companyRepository;

    @Transactional(readOnly = true)
    public Optional<Company> match(final String accountNumber) {
        if (accountNumber == null || accountNumber.isBlank()) {
            return Optional.empty();
        }
        final String trimmed = accountNumber.trim();

        Optional<Company> company = companyRepository.findFirstByReferenceNoAndActiveTrueOrderByIdAsc(trimmed);
        if (company.isEmpty()) {
            final String digits = trimmed.replaceAll("\\D", "");
            if (!digits.isEmpty() && !digits.equals(trimmed)) {
                company = companyRepository.findFirstByReferenceNoAndActiveTrueOrderByIdAsc(digits);
            }
        }
        if (company.isEmpty()) {
            company = companyRepository.findFirstByCodeAndActiveTrueOrderByIdAsc(trimmed);
        }

        company.ifPresentOrElse(
                c -> log.info("Account number '{}' matched company {} ('{}').", trimmed, c.getId(), c.getName()),
                () -> log.info("Account number '{}' matched no active company.", trimmed));
        return company;
    }
}
