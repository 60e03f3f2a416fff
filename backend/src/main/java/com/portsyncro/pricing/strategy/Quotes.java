package com.portsyncro.pricing.strategy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Parsing helpers shared by the strategies.
 */
@Slf4j
final class Quotes {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private Quotes() {}

    static Optional<JsonNode> readTree(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readTree(json));
        } catch (Exception e) {
            log.debug("Upstream body is not JSON: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /** Positive numeric value of the node, or empty. */
    static Optional<BigDecimal> positive(JsonNode node) {
        if (node == null || node.isMissingNode() || !node.isNumber()) {
            return Optional.empty();
        }
        BigDecimal value = node.decimalValue();
        return value.signum() > 0 ? Optional.of(value) : Optional.empty();
    }

    static Optional<BigDecimal> number(JsonNode node) {
        if (node == null || node.isMissingNode() || !node.isNumber()) {
            return Optional.empty();
        }
        return Optional.of(node.decimalValue());
    }

    /**
     * Parses a displayed amount such as {@code Rp5,250.00}, {@code $189.20} or {@code 5,250}.
     * Commas are thousands separators.
     */
    static Optional<BigDecimal> displayedNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String cleaned = text.replaceAll("[^0-9.,\\-]", "").replace(",", "");
        if (cleaned.isEmpty() || cleaned.equals("-") || cleaned.equals(".")) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(cleaned));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a whole-rupiah amount where both '.' and ',' are grouping separators, e.g. {@code 1.000.000} or {@code 1,000,000}.
     */
    static Optional<BigDecimal> rupiah(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String digits = text.replaceAll("[^0-9]", "");
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(digits));
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
