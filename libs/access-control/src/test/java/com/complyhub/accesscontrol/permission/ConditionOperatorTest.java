package com.complyhub.accesscontrol.permission;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConditionOperator")
class ConditionOperatorTest {

    @Nested
    @DisplayName("EQUALS / NOT_EQUALS")
    class Equality {

        @Test
        @DisplayName("numbers compare by value across boxed types")
        void numeric() {
            assertThat(ConditionOperator.EQUALS.test(5, 5L)).isTrue();
            assertThat(ConditionOperator.EQUALS.test(5.0, 5)).isTrue();
            assertThat(ConditionOperator.EQUALS.test(5, "5")).isFalse();
        }

        @Test
        @DisplayName("NOT_EQUALS holds when the context value is missing")
        void notEqualsMissing() {
            assertThat(ConditionOperator.NOT_EQUALS.test(null, "audit")).isTrue();
            assertThat(ConditionOperator.NOT_EQUALS.test("audit", "audit")).isFalse();
        }
    }

    @Nested
    @DisplayName("IN / NOT_IN")
    class Membership {

        @Test
        @DisplayName("IN matches collection members")
        void in() {
            assertThat(ConditionOperator.IN.test("tax", List.of("audit", "tax"))).isTrue();
            assertThat(ConditionOperator.IN.test(2L, Set.of(1, 2, 3))).isTrue();
            assertThat(ConditionOperator.IN.test("legal", Set.of("audit"))).isFalse();
        }

        @Test
        @DisplayName("a non-collection value never matches")
        void scalarExpected() {
            assertThat(ConditionOperator.IN.test("tax", "tax")).isFalse();
            assertThat(ConditionOperator.IN.test("tax", new String[] {"tax"})).isFalse();
            assertThat(ConditionOperator.NOT_IN.test("tax", "audit")).isFalse();
        }

        @Test
        @DisplayName("NOT_IN holds for values outside the collection")
        void notIn() {
            assertThat(ConditionOperator.NOT_IN.test("legal", List.of("audit", "tax"))).isTrue();
            assertThat(ConditionOperator.NOT_IN.test("tax", List.of("audit", "tax"))).isFalse();
        }
    }

    @Nested
    @DisplayName("CONTAINS")
    class Contains {

        @Test
        @DisplayName("checks substrings of strings")
        void substring() {
            assertThat(ConditionOperator.CONTAINS.test("north-west", "west")).isTrue();
            assertThat(ConditionOperator.CONTAINS.test("north", "west")).isFalse();
        }

        @Test
        @DisplayName("checks membership of collections")
        void collection() {
            assertThat(ConditionOperator.CONTAINS.test(List.of("gst", "tds"), "tds")).isTrue();
            assertThat(ConditionOperator.CONTAINS.test(List.of("gst"), "tds")).isFalse();
        }

        @Test
        @DisplayName("a missing value never matches")
        void nulls() {
            assertThat(ConditionOperator.CONTAINS.test(null, "x")).isFalse();
            assertThat(ConditionOperator.CONTAINS.test("x", null)).isFalse();
        }
    }

    @Test
    @DisplayName("UNKNOWN never matches")
    void unknown() {
        assertThat(ConditionOperator.UNKNOWN.test("a", "a")).isFalse();
    }

    @Test
    @DisplayName("a condition without an operator is read as UNKNOWN and never matches")
    void conditionWithoutOperator() {
        var condition = new PermissionCondition("department", null, "audit");
        assertThat(condition.operator()).isEqualTo(ConditionOperator.UNKNOWN);
        assertThat(condition.matches(PermissionContext.of(Map.of("department", "audit")))).isFalse();
    }
}
