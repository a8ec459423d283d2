package com.memflow.memflow_backend.executor.assign;

import com.memflow.memflow_backend.exception.OperatorTypeException;
import com.memflow.memflow_backend.model.config.AssignmentOperation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static com.memflow.memflow_backend.model.config.AssignmentOperation.*;
import static org.junit.jupiter.api.Assertions.*;

class AssignmentOperatorsTest {

    @Nested
    @DisplayName("numbers")
    class Numbers {

        @Test
        @DisplayName("adding 5 three times to 0 gives 15")
        void repeatedAdd() {
            Object count = 0L;
            for (int i = 0; i < 3; i++) {
                count = AssignmentOperators.apply(ADD, count, 5L);
            }
            assertEquals(15L, count);
        }

        @Test
        void arithmetic() {
            assertEquals(7L, AssignmentOperators.apply(SUBTRACT, 10L, 3L));
            assertEquals(30L, AssignmentOperators.apply(MULTIPLY, 10L, 3L));
            assertEquals(2.5, AssignmentOperators.apply(DIVIDE, 5L, 2L));
            assertEquals(1.5, AssignmentOperators.apply(ADD, 1L, 0.5));
            assertEquals(0L, AssignmentOperators.apply(CLEAR, 42L, null));
        }

        @Test
        void divisionByZeroRaises() {
            assertThrows(OperatorTypeException.class, () -> AssignmentOperators.apply(DIVIDE, 15L, 0L));
            assertThrows(OperatorTypeException.class, () -> AssignmentOperators.apply(DIVIDE, 15L, 0.0));
        }

        @Test
        void rejectsNonNumericValue() {
            assertThrows(OperatorTypeException.class, () -> AssignmentOperators.apply(ADD, 1L, "2"));
        }
    }

    @Nested
    @DisplayName("type safety")
    class TypeSafety {

        @ParameterizedTest
        @EnumSource(value = AssignmentOperation.class, names = {"ADD", "SUBTRACT", "MULTIPLY", "DIVIDE"})
        @DisplayName("number operators on a string variable raise")
        void numberOperatorOnString(AssignmentOperation operation) {
            assertThrows(OperatorTypeException.class, () -> AssignmentOperators.apply(operation, "text", 1L));
        }

        @ParameterizedTest
        @EnumSource(value = AssignmentOperation.class, names = {"ASSIGN"}, mode = EnumSource.Mode.EXCLUDE)
        @DisplayName("an empty slot only accepts assign")
        void emptySlotOnlyAssigns(AssignmentOperation operation) {
            assertThrows(OperatorTypeException.class, () -> AssignmentOperators.apply(operation, null, 1L));
        }

        @Test
        void assignToEmptySlotTakesAnyValue() {
            assertEquals(3L, AssignmentOperators.apply(ASSIGN, null, 3));
            assertEquals("x", AssignmentOperators.apply(ASSIGN, null, "x"));
        }

        @Test
        void assignMustKeepTheType() {
            assertThrows(OperatorTypeException.class, () -> AssignmentOperators.apply(ASSIGN, "text", 1L));
            assertEquals("new", AssignmentOperators.apply(ASSIGN, "old", "new"));
            assertEquals("", AssignmentOperators.apply(CLEAR, "old", null));
        }
    }

    @Nested
    @DisplayName("arrays")
    class Arrays {

        @Test
        @DisplayName("append then remove_last restores the empty array")
        void appendThenRemoveLast() {
            Object appended = AssignmentOperators.apply(APPEND, List.of(), "item");
            assertEquals(List.of("item"), appended);

            assertEquals(List.of(), AssignmentOperators.apply(REMOVE_LAST, appended, null));
        }

        @Test
        void extendAndRemoveFirst() {
            Object extended = AssignmentOperators.apply(EXTEND, List.of(1L), List.of(2L, 3L));
            assertEquals(List.of(1L, 2L, 3L), extended);
            assertEquals(List.of(2L, 3L), AssignmentOperators.apply(REMOVE_FIRST, extended, null));
        }

        @Test
        void removingFromEmptyArrayRaises() {
            assertThrows(OperatorTypeException.class, () -> AssignmentOperators.apply(REMOVE_FIRST, List.of(), null));
        }

        @Test
        void extendNeedsAnArray() {
            assertThrows(OperatorTypeException.class, () -> AssignmentOperators.apply(EXTEND, List.of(), "x"));
        }
    }

    @Test
    void objectAndBooleanFamilies() {
        assertEquals(Map.of("b", 2), AssignmentOperators.apply(ASSIGN, Map.of("a", 1), Map.of("b", 2)));
        assertEquals(Boolean.TRUE, AssignmentOperators.apply(ASSIGN, false, true));
        assertThrows(OperatorTypeException.class, () -> AssignmentOperators.apply(APPEND, Map.of(), "x"));
    }
}
