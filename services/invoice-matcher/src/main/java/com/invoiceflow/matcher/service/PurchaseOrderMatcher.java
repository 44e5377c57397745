package com.invoiceflow.matcher.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.invoiceflow.common.model.InvoiceFields;
import com.invoiceflow.common.model.MatchStatus;
import com.invoiceflow.common.model.MatchedDetails;
import com.invoiceflow.matcher.config.MatcherProperties;
import com.invoiceflow.matcher.model.MatchDecision;
import com.invoiceflow.matcher.model.PurchaseOrder;
import com.invoiceflow.matcher.repository.PurchaseOrderRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reconciles an invoice total against the first purchase order found among its PO candidates.
 *
 * Candidates are tried in the order supplied; blanks and unknown numbers are skipped.
 * Only a variance within {@code invoiceflow.matcher.tolerance} is auto-approved.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PurchaseOrderMatcher {

    private final PurchaseOrderRepository purchaseOrderRepository;
    private final MatcherProperties properties;

    public MatchDecision decide(InvoiceFields fields) {
        BigDecimal invoiceAmount = fields.getTotalAmount();
        List<String> candidates = fields.getPoNumbers();

        if (candidates == null || candidates.stream().allMatch(PurchaseOrderMatcher::isBlank)) {
            log.info("No PO candidates on invoice, routing to review");
            return review(MatchedDetails.unmatched(invoiceAmount));
        }

        for (String candidate : candidates) {
            if (isBlank(candidate)) {
                continue;
            }
            String poNumber = normalize(candidate);
            Optional<PurchaseOrder> po = purchaseOrderRepository.findByPoNumber(poNumber);
            if (po.isEmpty()) {
                log.debug("PO {} not found, trying next candidate", poNumber);
                continue;
            }
            return evaluate(invoiceAmount, po.get());
        }

        log.info("None of the PO candidates {} exist, routing to review", candidates);
        return review(MatchedDetails.unmatched(invoiceAmount));
    }

    private MatchDecision evaluate(BigDecimal invoiceAmount, PurchaseOrder po) {
        BigDecimal variance = variance(invoiceAmount, po.getTotalAmount());
        MatchedDetails details = MatchedDetails.builder()
                .poNumber(po.getPoNumber())
                .poAmount(po.getTotalAmount())
                .invoiceAmount(invoiceAmount)
                .variancePct(variance)
                .build();

        boolean withinTolerance = variance.abs().compareTo(properties.getTolerance()) <= 0;
        log.info("Matched PO {}: invoice {} vs PO {}, variance {} ({} tolerance {})",
                po.getPoNumber(), invoiceAmount, po.getTotalAmount(), variance,
                withinTolerance ? "within" : "over", properties.getTolerance());

        return withinTolerance
                ? MatchDecision.builder().status(MatchStatus.AUTO_APPROVED).details(details).build()
                : review(details);
    }

    /**
     * Signed (invoice - po) / po. A zero PO amount yields 1.
     */
    static BigDecimal variance(BigDecimal invoiceAmount, BigDecimal poAmount) {
        if (poAmount.signum() == 0) {
            return BigDecimal.ONE;
        }
        return invoiceAmount.subtract(poAmount, MathContext.DECIMAL64).divide(poAmount, MathContext.DECIMAL64);
    }

    static String normalize(String poNumber) {
        return poNumber.trim().toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static MatchDecision review(MatchedDetails details) {
        return MatchDecision.builder().status(MatchStatus.NEEDS_REVIEW).details(details).build();
    }
}
