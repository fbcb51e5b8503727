package io.rankwatch4j.normalize;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NumberParserTest {

    @Test
    void shouldApplyChineseMagnitudeSuffixes() {
        assertEquals(12_000L, NumberParser.parse("1.2万", -1));
        assertEquals(3_000L, NumberParser.parse("3千", -1));
        assertEquals(200_000_000L, NumberParser.parse("2亿", -1));
        assertEquals(15_000L, NumberParser.parse("1.5 万", -1));
    }

    @Test
    void shouldStripSeparatorsWhitespaceAndTrailingAnnotation() {
        assertEquals(247_737L, NumberParser.parse("247,737(章均)", -1));
        assertEquals(1_234_567L, NumberParser.parse(" 1，234，567 ", -1));
        assertEquals(88L, NumberParser.parse("88（估）", -1));
    }

    @Test
    void shouldRoundHalfUp() {
        assertEquals(2L, NumberParser.parse("1.5", -1));
        assertEquals(12_346L, NumberParser.parse("1.23456万", -1));
    }

    @Test
    void shouldFallBackToDefaultOutsideTheGrammar() {
        assertEquals(7L, NumberParser.parse((String) null, 7));
        assertEquals(7L, NumberParser.parse("", 7));
        assertEquals(7L, NumberParser.parse("万", 7));
        assertEquals(7L, NumberParser.parse("n/a", 7));
        assertEquals(7L, NumberParser.parse("99999999999999999999亿", 7));
        assertEquals(7L, NumberParser.parse("1e5", 7));
        assertEquals(7L, NumberParser.parse("-3", 7));
        assertEquals(7L, NumberParser.parse("+12万", 7));
        assertEquals(7L, NumberParser.parse(".5万", 7));
        assertEquals(7L, NumberParser.parse("1.", 7));
    }

    @Test
    void jsonVariantShouldAcceptNumbersAndText() {
        JsonNodeFactory f = JsonNodeFactory.instance;
        assertEquals(42L, NumberParser.parse(f.numberNode(42), 0));
        assertEquals(3L, NumberParser.parse(f.numberNode(2.5), 0));
        assertEquals(12_000L, NumberParser.parse(f.textNode("1.2万"), 0));
        assertEquals(0L, NumberParser.parse(f.booleanNode(true), 0));
        assertEquals(0L, NumberParser.parse(f.nullNode(), 0));
    }
}
