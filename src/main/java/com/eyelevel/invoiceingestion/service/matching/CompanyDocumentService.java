package com.eyelevel.invoiceingestion.service.matching;

import com.eyelevel.invoiceingestion.model.Company;
import com.eyelevel.invoiceingestion.model.CompanyDocument;
import com.eyelevel.invoiceingestion.model.DocumentRecord;
import com.eyelevel.invoiceingestion.model.DocumentType;
import com.eyelevel.invoiceingestion.repository.CompanyDocumentRepository;
import com.eyelevel.invoiceingestion.service.extraction.ExtractedValueParser;
import com.eyelevel.invoiceingestion.service.extraction.ExtractionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Creates or updates the company-linked invoice, credit note or statement for a parsed document. Document
 * numbers are unique per company and type, so replaying the same file updates the existing row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompanyDocumentService {

    private final CompanyDocumentRepository companyDocumentRepository;

    @Transactional
    public CompanyDocument upsert(final DocumentRecord record, final Company company, final DocumentType type,
                                  final ExtractionResult result) {
        final String number = documentNumber(type, result)
                .orElseGet(() -> placeholderNumber(type, record.getContentDigest(), System.currentTimeMillis()));

        final CompanyDocument document = companyDocumentRepository
                .findByCompanyIdAndDocumentTypeAndDocumentNumber(company.getId(), type, number)
                .orElseGet(() -> CompanyDocument.builder()
                                                .companyId(company.getId())
                                                .documentType(type)
                                                .documentNumber(number)
                                                .build());
        final boolean existing = document.getId() != null;

        document.setDocumentRecordId(record.getId());
        document.setDocumentDate(result.field("invoiceDate")
                                       .flatMap(ExtractedValueParser::parseDate)
                                       .orElseGet(LocalDate::now));
        document.setAmount(result.field("totalAmount").flatMap(ExtractedValueParser::parseAmount).orElse(null));
        document.setVatAmount(result.field("vatAmount").flatMap(ExtractedValueParser::parseAmount).orElse(null));
        document.setGoodsAmount(result.field("goodsAmount").flatMap(ExtractedValueParser::parseAmount).orElse(null));
        document.setCustomerPo(result.field("customerPO").orElse(null));
        document.setFileLocation(record.getFileLocation());

        final CompanyDocument saved = companyDocumentRepository.save(document);
        log.info("{} {} {} '{}' for company {}.", existing ? "Updated" : "Created", type, saved.getId(), number,
                 company.getId());
        return saved;
    }

    /**
     * Credit notes prefer {@code creditNumber}; every other type uses {@code invoiceNumber}.
     */
    static Optional<String> documentNumber(final DocumentType type, final ExtractionResult result) {
        if (type == DocumentType.CREDIT_NOTE) {
            return result.field("creditNumber").or(() -> result.field("invoiceNumber"));
        }
        return result.field("invoiceNumber");
    }

    static String placeholderNumber(final DocumentType type, final String contentDigest, final long epochMillis) {
        final String digestPrefix = contentDigest == null ? "00000000"
                : contentDigest.substring(0, Math.min(8, contentDigest.length()));
        return type.getNumberPrefix() + "-" + epochMillis + "-" + digestPrefix;
    }
}
