package com.invoiceflow.poster.erp;

/**
 * Posts invoices to the external ledger. Transient failures are retried inside the call;
 * the returned outcome is final.
 */
public interface ErpClient {

    /**
     * @param idempotencyKey sent as {@code Idempotency-Key} so a repeated post is not booked twice
     * @throws ErpInterruptedException if interrupted while backing off between retries
     */
    ErpPostingOutcome post(ErpInvoicePayload payload, String idempotencyKey);
}
