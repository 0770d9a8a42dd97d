package com.pagelens.core.extract.lexical;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class DummyNumberFilterTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "555-0100", "555-0199", "(555) 123-4567", "555 1234",
            "123-456-7890", "1234567", "000-000-0000", "0123456789", "9876543210",
            "111111111", "3333333333", "+1 222 222 2222", "+44 7777777 12", "765-4321", "",
            "call us"})
    void placeholder_or_test_numbers_are_dummy(String s) {
        assertTrue(DummyNumberFilter.isDummy(s), s);
    }

    @ParameterizedTest
    @ValueSource(strings = {"+1 212 736 5000", "+44 20 7946 0958", "+82 2 312 3456", "415 867 5309", "333 333 333"})
    void real_looking_numbers_pass(String s) {
        assertFalse(DummyNumberFilter.isDummy(s), s);
    }

    @ParameterizedTest
    @ValueSource(strings = {"(212) 736-5000"})
    void digits_only_strips_formatting(String s) {
        assertEquals("2127365000", DummyNumberFilter.digitsOnly(s));
    }
}
