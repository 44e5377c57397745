package com.invoiceflow.matcher.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import com.invoiceflow.common.model.InvoiceStatus;
import com.invoiceflow.common.model.MatchStatus;
import com.invoiceflow.matcher.model.Invoice;
import com.invoiceflow.matcher.model.PurchaseOrder;

@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=create-drop")
@DisplayName("Matcher repository Tests")
class InvoiceRepositoryTest {

    @Autowired
    private InvoiceRepository invoiceRepository;

    @Autowired
    private PurchaseOrderRepository purchaseOrderRepository;

    private Invoice save(InvoiceStatus status) {
        return invoiceRepository.saveAndFlush(Invoice.builder()
                .id(UUID.randomUUID())
                .totalAmount(new BigDecimal("1020.00"))
                .status(status)
                .updatedAt(Instant.now())
                .build());
    }

    private int approve(UUID id) {
        return invoiceRepository.recordDecision(id, InvoiceStatus.PROCESSING, InvoiceStatus.AUTO_APPROVED,
                MatchStatus.AUTO_APPROVED, "PO-1", new BigDecimal("1000.00"), new BigDecimal("0.02"), null,
                Instant.now());
    }

    @Test
    @DisplayName("Decision is recorded once, from PROCESSING only")
    void decisionIsGuardedOnProcessing() {
        Invoice invoice = save(InvoiceStatus.PROCESSING);

        assertThat(approve(invoice.getId())).isEqualTo(1);
        assertThat(approve(invoice.getId())).isZero();

        Invoice reloaded = invoiceRepository.findById(invoice.getId()).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(InvoiceStatus.AUTO_APPROVED);
        assertThat(reloaded.getMatchStatus()).isEqualTo(MatchStatus.AUTO_APPROVED);
        assertThat(reloaded.getMatchedPoNumber()).isEqualTo("PO-1");
        assertThat(reloaded.getMatchVariance()).isEqualByComparingTo("0.02");
        assertThat(reloaded.getTotalAmount()).isEqualByComparingTo("1020.00");
        assertThat(reloaded.isMatchPublished()).isFalse();
    }

    @Test
    @DisplayName("Decision does not overwrite a reviewed invoice")
    void decisionIgnoresReviewedInvoice() {
        Invoice reviewed = save(InvoiceStatus.REVIEWED);

        assertThat(approve(reviewed.getId())).isZero();
        assertThat(invoiceRepository.findById(reviewed.getId()).orElseThrow().getStatus())
                .isEqualTo(InvoiceStatus.REVIEWED);
    }

    @Test
    @DisplayName("Publish flag is set independently of status")
    void publishFlag() {
        Invoice invoice = save(InvoiceStatus.NEEDS_REVIEW);

        assertThat(invoiceRepository.markMatchPublished(invoice.getId())).isEqualTo(1);

        assertThat(invoiceRepository.findById(invoice.getId()).orElseThrow().isMatchPublished()).isTrue();
    }

    @Test
    @DisplayName("Purchase orders are found by exact normalized number")
    void purchaseOrderLookup() {
        purchaseOrderRepository.saveAndFlush(PurchaseOrder.builder()
                .id(UUID.randomUUID())
                .poNumber("PO-1")
                .totalAmount(new BigDecimal("1000.00"))
                .vendorName("Acme Corp")
                .build());

        assertThat(purchaseOrderRepository.findByPoNumber("PO-1"))
                .hasValueSatisfying(po -> assertThat(po.getTotalAmount()).isEqualByComparingTo("1000.00"));
        assertThat(purchaseOrderRepository.findByPoNumber("po-1")).isEmpty();
    }
}
