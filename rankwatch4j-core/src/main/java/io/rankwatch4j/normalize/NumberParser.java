package io.rankwatch4j.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Parses upstream count strings such as {@code "1.2万"}, {@code "3千"}, {@code "2亿"} or
 * {@code "247,737(章均)"} into whole numbers.
 *
 * <p>Total over its input: anything outside the grammar resolves to the caller's default.
 */
public final class NumberParser {
    private static final Logger log = LoggerFactory.getLogger(NumberParser.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_ANNOTATION = Pattern.compile("[(（][^)）]*[)）]$");
    private static final Pattern DECIMAL = Pattern.compile("^\\d+(\\.\\d+)?$");

    private static final BigDecimal TEN_THOUSAND = BigDecimal.valueOf(10_000L);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1_000L);
    private static final BigDecimal HUNDRED_MILLION = BigDecimal.valueOf(100_000_000L);

    private NumberParser() {
    }

    /**
     * @param raw          upstream text, may be null
     * @param defaultValue returned for blank, unparseable or out-of-range input
     * @return {@code round(number * multiplier)} for a valid input, otherwise {@code defaultValue}
     */
    public static long parse(String raw, long defaultValue) {
        if (raw == null) {
            return defaultValue;
        }

        String s = WHITESPACE.matcher(raw).replaceAll("");
        s = TRAILING_ANNOTATION.matcher(s).replaceFirst("");
        s = s.replace(",", "").replace("，", "");
        if (s.isEmpty()) {
            return defaultValue;
        }

        BigDecimal multiplier = multiplierFor(s.charAt(s.length() - 1));
        if (multiplier != null) {
            s = s.substring(0, s.length() - 1);
        } else {
            multiplier = BigDecimal.ONE;
        }
        // unsigned plain decimal
        if (!DECIMAL.matcher(s).matches()) {
            log.debug("Count '{}' is outside the number grammar, using default {}", raw, defaultValue);
            return defaultValue;
        }

        try {
            BigDecimal value = new BigDecimal(s)
                    .multiply(multiplier)
                    .setScale(0, RoundingMode.HALF_UP);
            return value.longValueExact();
        } catch (ArithmeticException e) {
            log.debug("Failed to parse count '{}', using default {}: {}", raw, defaultValue, e.getMessage());
            return defaultValue;
        }
    }

    private static BigDecimal multiplierFor(char suffix) {
        return switch (suffix) {
            case '万' -> TEN_THOUSAND;
            case '千' -> THOUSAND;
            case '亿' -> HUNDRED_MILLION;
            default -> null;
        };
    }

    /**
     * JSON variant: numeric nodes are taken as-is (rounded), textual nodes go through {@link #parse(String, long)}.
     */
    public static long parse(JsonNode node, long defaultValue) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return defaultValue;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return parse(node.decimalValue().toPlainString(), defaultValue);
        }
        if (node.isTextual()) {
            return parse(node.textValue(), defaultValue);
        }
        return defaultValue;
    }
}
