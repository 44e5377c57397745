package com.invoiceflow.matcher.repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.invoiceflow.common.model.InvoiceStatus;
import com.invoiceflow.common.model.MatchStatus;
import com.invoiceflow.matcher.model.Invoice;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

    /**
     * PROCESSING -> AUTO_APPROVED | NEEDS_REVIEW, with the decision detail.
     * Amount, vendor and PO candidate columns are never written here.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET i.status = :next, i.matchStatus = :matchStatus, "
            + "i.matchedPoNumber = :poNumber, i.matchedPoAmount = :poAmount, i.matchVariance = :variance, "
            + "i.matchError = :error, i.matchedAt = :now, i.updatedAt = :now "
            + "WHERE i.id = :id AND i.status = :expected")
    int recordDecision(
            @Param("id") UUID id,
            @Param("expected") InvoiceStatus expected,
            @Param("next") InvoiceStatus next,
            @Param("matchStatus") MatchStatus matchStatus,
            @Param("poNumber") String poNumber,
            @Param("poAmount") BigDecimal poAmount,
            @Param("variance") BigDecimal variance,
            @Param("error") String error,
            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET i.matchPublished = true WHERE i.id = :id")
    int markMatchPublished(@Param("id") UUID id);
}
