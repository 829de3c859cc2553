package com.eyelevel.invoiceingestion.repository;

import com.eyelevel.invoiceingestion.model.Company;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyRepository extends JpaRepository<Company, Long> {

    Optional<Company> findFirstByReferenceNoAndActiveTrueOrderByIdAsc(String referenceNo);

    Optional<Company> findFirstByCodeAndActiveTrueOrderByIdAsc(String code);
}
