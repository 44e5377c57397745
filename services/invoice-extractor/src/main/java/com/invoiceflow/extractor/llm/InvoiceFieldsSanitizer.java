package com.invoiceflow.extractor.llm;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.JsonNode;
import com.invoiceflow.common.model.InvoiceFields;
import com.invoiceflow.common.model.LineItem;

import lombok.extern.slf4j.Slf4j;

/**
 * Normalises the model's JSON answer into {@link InvoiceFields}.
 * <p>
 * Strings are trimmed and blanks dropped, numbers become {@link BigDecimal} or null,
 * {@code po_number} and {@code po_numbers} are merged, and empty line items are discarded.
 * Both snake_case and camelCase keys are accepted.
 */
@Component
@Slf4j
public class InvoiceFieldsSanitizer {

    public InvoiceFields sanitize(JsonNode root) {
        if (root == null || !root.isObject()) {
            return InvoiceFields.empty();
        }

        return InvoiceFields.builder()
                .vendorName(text(root, "vendor_name", "vendorName"))
                .invoiceNumber(text(root, "invoice_number", "invoiceNumber"))
                .invoiceDate(text(root, "invoice_date", "invoiceDate"))
                .dueDate(text(root, "due_date", "dueDate"))
                .currency(text(root, "currency", "currency"))
                .totalAmount(decimal(root, "total_amount", "totalAmount"))
                .subtotal(decimal(root, "subtotal", "subtotal"))
                .taxAmount(decimal(root, "tax_amount", "taxAmount"))
                .poNumbers(poNumbers(root))
                .lineItems(lineItems(root))
                .build();
    }

    private List<String> poNumbers(JsonNode root) {
        Set<String> merged = new LinkedHashSet<>();
        String single = text(root, "po_number", "poNumber");
        if (single != null) {
            merged.add(single);
        }
        JsonNode many = field(root, "po_numbers", "poNumbers");
        if (many != null && many.isArray()) {
            for (JsonNode item : many) {
                String value = asText(item);
                if (value != null) {
                    merged.add(value);
                }
            }
        } else if (many != null) {
            String value = asText(many);
            if (value != null) {
                merged.add(value);
            }
        }
        return new ArrayList<>(merged);
    }

    private List<LineItem> lineItems(JsonNode root) {
        List<LineItem> items = new ArrayList<>();
        JsonNode array = field(root, "line_items", "lineItems");
        if (array == null || !array.isArray()) {
            return items;
        }
        for (JsonNode node : array) {
            if (!node.isObject()) {
                continue;
            }
            LineItem item = LineItem.builder()
                    .description(text(node, "description", "description"))
                    .sku(text(node, "sku", "sku"))
                    .quantity(decimal(node, "quantity", "quantity"))
                    .unitPrice(decimal(node, "unit_price", "unitPrice"))
                    .totalPrice(decimal(node, "total_price", "totalPrice"))
                    .build();
            if (item.hasAnyValue()) {
                items.add(item);
            }
        }
        return items;
    }

    private static JsonNode field(JsonNode node, String snakeCase, String camelCase) {
        JsonNode value = node.get(snakeCase);
        if (value == null || value.isNull()) {
            value = node.get(camelCase);
        }
        return value == null || value.isNull() ? null : value;
    }

    private static String text(JsonNode node, String snakeCase, String camelCase) {
        return asText(field(node, snakeCase, camelCase));
    }

    private static String asText(JsonNode value) {
        if (value == null || !value.isValueNode()) {
            return null;
        }
        String text = value.asText().strip();
        return text.isEmpty() ? null : text;
    }

    private static BigDecimal decimal(JsonNode node, String snakeCase, String camelCase) {
        JsonNode value = field(node, snakeCase, camelCase);
        if (value == null) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        String text = asText(value);
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text.replace(",", ""));
        } catch (NumberFormatException e) {
            log.warn("Discarding invalid numeric value for {}: {}", snakeCase, text);
            return null;
        }
    }
}
