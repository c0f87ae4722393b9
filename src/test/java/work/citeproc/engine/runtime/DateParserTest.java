package work.citeproc.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DateParserTest {
    @Test
    void parsesSingleDates() {
        var date = DateParser.parse("2020-05-12").orElseThrow();
        assertEquals(new DateValue.Parts(2020, 5, 12), date.start());
        assertNull(date.end());
        assertFalse(date.isRange());
        assertFalse(date.uncertain());
        assertTrue(date.start().hasDay());
    }

    @Test
    void parsesRangesAndSeasons() {
        var range = DateParser.parse("2020-05/2020-07").orElseThrow();
        assertTrue(range.isRange());
        assertEquals(7, range.end().month());

        var spring = DateParser.parse("2019-21").orElseThrow();
        assertTrue(spring.start().hasSeason());
        assertEquals(1, spring.start().season());
        assertFalse(spring.start().hasMonth());

        // months 13-16 are the alternative season encoding
        assertEquals(2, DateParser.parse("2019-14").orElseThrow().start().season());
    }

    @Test
    void flagsUncertainDates() {
        var circa = DateParser.parse("~1850").orElseThrow();
        assertTrue(circa.uncertain());
        assertEquals(1850, circa.start().year());
        assertTrue(DateParser.isUncertain("circa 1850"));
        assertFalse(DateParser.isUncertain("1850"));
    }

    @Test
    void keepsUnstructuredTextAsLiteral() {
        var literal = DateParser.parse("Spring term, 1999").orElseThrow();
        assertTrue(literal.isLiteral());
        assertEquals("Spring term, 1999", literal.literal());
        assertTrue(DateParser.parse("  ").isEmpty());
        assertTrue(DateParser.parse(null).isEmpty());
    }
}
