package com.invoiceflow.matcher.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.invoiceflow.common.model.InvoiceFields;
import com.invoiceflow.common.model.MatchStatus;
import com.invoiceflow.matcher.config.MatcherProperties;
import com.invoiceflow.matcher.model.MatchDecision;
import com.invoiceflow.matcher.model.PurchaseOrder;
import com.invoiceflow.matcher.repository.PurchaseOrderRepository;

@ExtendWith(MockitoExtension.class)
@DisplayName("PurchaseOrderMatcher Tests")
class PurchaseOrderMatcherTest {

    @Mock
    private PurchaseOrderRepository purchaseOrderRepository;

    private PurchaseOrderMatcher matcher;

    @BeforeEach
    void setUp() {
        matcher = new PurchaseOrderMatcher(purchaseOrderRepository, new MatcherProperties());
    }

    private static InvoiceFields invoice(String total, String... poNumbers) {
        return InvoiceFields.builder()
                .totalAmount(new BigDecimal(total))
                .poNumbers(Arrays.asList(poNumbers))
                .build();
    }

    private static Optional<PurchaseOrder> po(String number, String amount) {
        return Optional.of(PurchaseOrder.builder()
                .id(UUID.randomUUID())
                .poNumber(number)
                .totalAmount(new BigDecimal(amount))
                .build());
    }

    @Nested
    @DisplayName("Tolerance")
    class ToleranceTests {

        @Test
        @DisplayName("Should auto-approve a variance of exactly 2%")
        void shouldApproveAtBoundary() {
            // Given
            when(purchaseOrderRepository.findByPoNumber("PO-1")).thenReturn(po("PO-1", "1000.00"));

            // When
            MatchDecision decision = matcher.decide(invoice("1020.00", "PO-1"));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.AUTO_APPROVED);
            assertThat(decision.getDetails().getVariancePct()).isEqualByComparingTo("0.02");
            assertThat(decision.getDetails().getPoNumber()).isEqualTo("PO-1");
            assertThat(decision.getDetails().getPoAmount()).isEqualByComparingTo("1000.00");
            assertThat(decision.getDetails().getInvoiceAmount()).isEqualByComparingTo("1020.00");
            assertThat(decision.getError()).isNull();
        }

        @Test
        @DisplayName("Should route to review one cent over the boundary")
        void shouldReviewJustOverBoundary() {
            // Given
            when(purchaseOrderRepository.findByPoNumber("PO-1")).thenReturn(po("PO-1", "1000.00"));

            // When
            MatchDecision decision = matcher.decide(invoice("1020.01", "PO-1"));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.NEEDS_REVIEW);
            assertThat(decision.getDetails().getVariancePct()).isEqualByComparingTo("0.02001");
        }

        @Test
        @DisplayName("Should treat under-billing symmetrically")
        void shouldApproveNegativeVarianceWithinTolerance() {
            // Given
            when(purchaseOrderRepository.findByPoNumber("PO-1")).thenReturn(po("PO-1", "1000.00"));

            // When
            MatchDecision decision = matcher.decide(invoice("980.00", "PO-1"));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.AUTO_APPROVED);
            assertThat(decision.getDetails().getVariancePct()).isEqualByComparingTo("-0.02");
        }

        @Test
        @DisplayName("Should use the configured tolerance")
        void shouldHonourConfiguredTolerance() {
            // Given
            MatcherProperties strict = new MatcherProperties();
            strict.setTolerance(new BigDecimal("0.01"));
            matcher = new PurchaseOrderMatcher(purchaseOrderRepository, strict);
            when(purchaseOrderRepository.findByPoNumber("PO-1")).thenReturn(po("PO-1", "1000.00"));

            // When
            MatchDecision decision = matcher.decide(invoice("1015.00", "PO-1"));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.NEEDS_REVIEW);
        }

        @Test
        @DisplayName("Should give a variance of 1 for a zero PO amount")
        void shouldReviewZeroPoAmount() {
            // Given
            when(purchaseOrderRepository.findByPoNumber("PO-0")).thenReturn(po("PO-0", "0.00"));

            // When
            MatchDecision decision = matcher.decide(invoice("100.00", "PO-0"));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.NEEDS_REVIEW);
            assertThat(decision.getDetails().getVariancePct()).isEqualByComparingTo(BigDecimal.ONE);
        }
    }

    @Nested
    @DisplayName("Candidate selection")
    class CandidateTests {

        @Test
        @DisplayName("Should skip a missing candidate and match the next one")
        void shouldSkipMissingCandidate() {
            // Given
            when(purchaseOrderRepository.findByPoNumber("MISSING")).thenReturn(Optional.empty());
            when(purchaseOrderRepository.findByPoNumber("PO-1")).thenReturn(po("PO-1", "1000.00"));

            // When
            MatchDecision decision = matcher.decide(invoice("1000.00", "MISSING", "PO-1"));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.AUTO_APPROVED);
            assertThat(decision.getDetails().getPoNumber()).isEqualTo("PO-1");
        }

        @Test
        @DisplayName("Should stop at the first PO found, in the order supplied")
        void shouldStopAtFirstFound() {
            // Given
            when(purchaseOrderRepository.findByPoNumber("PO-2")).thenReturn(po("PO-2", "5000.00"));

            // When
            MatchDecision decision = matcher.decide(invoice("1000.00", "PO-2", "PO-1"));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.NEEDS_REVIEW);
            assertThat(decision.getDetails().getPoNumber()).isEqualTo("PO-2");
            verify(purchaseOrderRepository, never()).findByPoNumber("PO-1");
        }

        @Test
        @DisplayName("Should normalize candidates and skip blanks")
        void shouldNormalizeCandidates() {
            // Given
            when(purchaseOrderRepository.findByPoNumber("PO-7")).thenReturn(po("PO-7", "200.00"));

            // When
            MatchDecision decision = matcher.decide(invoice("200.00", "  ", " po-7 "));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.AUTO_APPROVED);
            InOrder order = inOrder(purchaseOrderRepository);
            order.verify(purchaseOrderRepository).findByPoNumber("PO-7");
            order.verifyNoMoreInteractions();
        }

        @Test
        @DisplayName("Should route to review without a lookup when there are no candidates")
        void shouldReviewWithoutCandidates() {
            // When
            MatchDecision decision = matcher.decide(invoice("100.00"));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.NEEDS_REVIEW);
            assertThat(decision.getDetails().getPoNumber()).isNull();
            assertThat(decision.getDetails().getVariancePct()).isNull();
            assertThat(decision.getDetails().getInvoiceAmount()).isEqualByComparingTo("100.00");
            verifyNoInteractions(purchaseOrderRepository);
        }

        @Test
        @DisplayName("Should treat a list of blanks like no candidates")
        void shouldReviewOnlyBlankCandidates() {
            // When
            MatchDecision decision = matcher.decide(InvoiceFields.builder()
                    .totalAmount(new BigDecimal("100.00"))
                    .poNumbers(Arrays.asList("", null, "   "))
                    .build());

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.NEEDS_REVIEW);
            verifyNoInteractions(purchaseOrderRepository);
        }

        @Test
        @DisplayName("Should route to review when no candidate exists")
        void shouldReviewWhenNothingFound() {
            // Given
            when(purchaseOrderRepository.findByPoNumber(anyString())).thenReturn(Optional.empty());

            // When
            MatchDecision decision = matcher.decide(invoice("100.00", "PO-X", "PO-Y"));

            // Then
            assertThat(decision.getStatus()).isEqualTo(MatchStatus.NEEDS_REVIEW);
            assertThat(decision.getDetails().getPoNumber()).isNull();
            assertThat(decision.getDetails().getPoAmount()).isNull();
        }
    }

    @Test
    @DisplayName("Variance is signed and relative to the PO amount")
    void varianceArithmetic() {
        assertThat(PurchaseOrderMatcher.variance(new BigDecimal("1100.00"), new BigDecimal("1000.00")))
                .isEqualByComparingTo("0.1");
        assertThat(PurchaseOrderMatcher.variance(new BigDecimal("100.00"), new BigDecimal("300.00")))
                .isEqualByComparingTo("-0.6666666666666667");
        assertThat(PurchaseOrderMatcher.normalize(" abc-1 ")).isEqualTo("ABC-1");
    }
}
