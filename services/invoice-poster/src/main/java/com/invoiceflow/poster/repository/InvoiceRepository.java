package com.invoiceflow.poster.repository;

import java.time.Instant;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import com.invoiceflow.common.model.InvoiceStatus;
import com.invoiceflow.poster.model.Invoice;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET i.status = :next, i.externalReference = :reference, i.postingError = :error, "
            + "i.postingAttempts = :attempts, i.postedAt = :postedAt, i.updatedAt = :now "
            + "WHERE i.id = :id AND i.status = :expected")
    int recordPosting(
            @Param("id") UUID id,
            @Param("expected") InvoiceStatus expected,
            @Param("next") InvoiceStatus next,
            @Param("reference") String reference,
            @Param("error") String error,
            @Param("attempts") Integer attempts,
            @Param("postedAt") Instant postedAt,
            @Param("now") Instant now);

    /**
     * REVIEWED -> POSTED
     */
    default int markPosted(UUID id, String reference, int attempts, Instant now) {
        return recordPosting(id, InvoiceStatus.REVIEWED, InvoiceStatus.POSTED, reference, null, attempts, now, now);
    }

    /**
     * REVIEWED -> POSTING_FAILED
     */
    default int markPostingFailed(UUID id, String error, int attempts, Instant now) {
        return recordPosting(id, InvoiceStatus.REVIEWED, InvoiceStatus.POSTING_FAILED, null, error, attempts,
                null, now);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE Invoice i SET i.postingPublished = true WHERE i.id = :id")
    int markPostingPublished(@Param("id") UUID id);
}
