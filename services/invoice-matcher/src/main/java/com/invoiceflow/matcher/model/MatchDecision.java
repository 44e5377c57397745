package com.invoiceflow.matcher.model;

import com.invoiceflow.common.model.MatchStatus;
import com.invoiceflow.common.model.MatchedDetails;

import lombok.Builder;
import lombok.Value;

/**
 * Result of matching one invoice. {@code error} is set only on the fail-safe path.
 */
@Value
@Builder
public class MatchDecision {

    MatchStatus status;

    MatchedDetails details;

    String error;

    public boolean isAutoApproved() {
        return status == MatchStatus.AUTO_APPROVED;
    }
}
