package com.invoiceflow.common.model;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LineItem {

    private String description;

    private String sku;

    private BigDecimal quantity;

    private BigDecimal unitPrice;

    private BigDecimal totalPrice;

    public boolean hasAnyValue() {
        return description != null || sku != null || quantity != null
                || unitPrice != null || totalPrice != null;
    }
}
