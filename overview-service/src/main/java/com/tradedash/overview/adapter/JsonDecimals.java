package com.tradedash.overview.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradedash.overview.exception.PayloadShapeException;

import java.math.BigDecimal;

/** Reads decimals that the back-end sends either as JSON numbers or as strings. */
final class JsonDecimals {

    private JsonDecimals() {}

    /** @return the decimal, or null when the node is absent, null or an empty string */
    static BigDecimal read(JsonNode node, String endpoint, String field) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new PayloadShapeException(endpoint, "field '" + field + "' is not a number: " + text, e);
            }
        }
        throw new PayloadShapeException(endpoint, "field '" + field + "' is not a number: " + node.getNodeType());
    }
}
