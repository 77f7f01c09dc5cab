package com.ormcost.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FieldSet")
class FieldSetTest {

    @Test
    @DisplayName("minus should remove consumed fields")
    void minus_shouldSubtract() {
        FieldSet fetched = FieldSet.of("id", "name", "email");

        FieldSet over = fetched.minus(FieldSet.of("name"));

        assertThat(over.getFields()).containsExactly("email", "id");
    }

    @Test
    @DisplayName("minus should never invent fields that were not fetched")
    void minus_shouldStayWithinFetched() {
        FieldSet over = FieldSet.of("id").minus(FieldSet.of("name", "nickname"));

        assertThat(over.getFields()).containsExactly("id");
    }

    @Test
    @DisplayName("unknown should propagate through set operations")
    void unknown_shouldPropagate() {
        assertThat(FieldSet.UNKNOWN.minus(FieldSet.of("name"))).isSameAs(FieldSet.UNKNOWN);
        assertThat(FieldSet.of("id").union(FieldSet.UNKNOWN)).isSameAs(FieldSet.UNKNOWN);
        assertThat(FieldSet.UNKNOWN.isKnown()).isFalse();
        assertThat(FieldSet.UNKNOWN).hasToString("unknown");
    }

    @Test
    @DisplayName("unknown should differ from empty")
    void unknown_shouldNotEqualEmpty() {
        assertThat(FieldSet.UNKNOWN).isNotEqualTo(FieldSet.empty());
        assertThat(FieldSet.empty().isKnown()).isTrue();
        assertThat(FieldSet.empty().size()).isZero();
        assertThatThrownBy(FieldSet.UNKNOWN::getFields).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("union should merge and sort")
    void union_shouldMerge() {
        FieldSet merged = FieldSet.of("name").union(FieldSet.of("email", "name"));

        assertThat(merged.getFields()).containsExactly("email", "name");
        assertThat(merged).isEqualTo(FieldSet.of("name", "email"));
        assertThat(merged.contains("email")).isTrue();
    }
}
