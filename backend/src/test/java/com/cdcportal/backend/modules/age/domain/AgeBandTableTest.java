package com.cdcportal.backend.modules.age.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AgeBandTableTest {

    @Test
    @DisplayName("dotted, placeholder-as-point and placeholder-as-delimiter encodings agree")
    void encodingsAreEquivalent() {
        AgeRange dotted = AgeBandTable.parse("3.1-4.0");

        assertThat(dotted).isEqualTo(new AgeRange(37, 48));
        assertThat(AgeBandTable.parse("3?1-4?0")).isEqualTo(dotted);
        assertThat(AgeBandTable.parse("3.1?4.0")).isEqualTo(dotted);
        assertThat(AgeBandTable.parse("3.1\uFFFD4.0")).isEqualTo(dotted);
        assertThat(AgeBandTable.parse("3.1\u20134.0")).isEqualTo(dotted);
    }

    @Test
    @DisplayName("only the first token is read and whole years have no month part")
    void readsFirstTokenOnly() {
        assertThat(AgeBandTable.parse("  3.1-4.0 years old")).isEqualTo(new AgeRange(37, 48));
        assertThat(AgeBandTable.parse("3-4")).isEqualTo(new AgeRange(36, 48));
        assertThat(AgeBandTable.parse("5.1?5.11")).isEqualTo(new AgeRange(61, 71));
    }

    @Test
    @DisplayName("unrecognised text is unparseable")
    void rejectsGarbage() {
        assertThatThrownBy(() -> AgeBandTable.parse("not a range"))
                .isInstanceOf(UnparseableRangeException.class);
        assertThatThrownBy(() -> AgeBandTable.parse(""))
                .isInstanceOf(UnparseableRangeException.class);
        assertThatThrownBy(() -> AgeBandTable.parse(null))
                .isInstanceOf(UnparseableRangeException.class);
    }

    @Test
    @DisplayName("month components above eleven and inverted bounds are unparseable")
    void rejectsOutOfRangeComponents() {
        assertThatThrownBy(() -> AgeBandTable.parse("3.12-4.0"))
                .isInstanceOf(UnparseableRangeException.class);
        assertThatThrownBy(() -> AgeBandTable.parse("5.0-4.0"))
                .isInstanceOf(UnparseableRangeException.class);
        assertThatThrownBy(() -> AgeBandTable.parse("99999999999-99999999999"))
                .isInstanceOf(UnparseableRangeException.class);
    }

    @Test
    @DisplayName("boundary ages of contiguous bands classify to exactly one band")
    void contiguousBoundaries() {
        AgeBandTable table = AgeBandTable.canonical();

        assertThat(table.classify(47)).contains("3-4");
        assertThat(table.classify(48)).contains("4-5");
        assertThat(table.classify(59)).contains("4-5");
        assertThat(table.classify(60)).contains("5-6");
        assertThat(table.classify(71)).contains("5-6");
        assertThat(table.classify(72)).isEmpty();
        assertThat(table.classify(35)).isEmpty();
    }

    @Test
    @DisplayName("overlapping bands resolve to the first declared band")
    void overlappingBandsUseFirstMatch() {
        AgeBandTable table = AgeBandTable.builder()
                .add("1", AgeBandTable.parse("3.1-4.0"))
                .add("2", AgeBandTable.parse("4.0-5.0"))
                .build();

        assertThat(table.classify(48)).contains("1");
        assertThat(table.classify(49)).contains("2");
        assertThat(table.keys()).containsExactly("1", "2");
    }

    @Test
    @DisplayName("duplicate keys are rejected")
    void duplicateKeysRejected() {
        AgeBandTable.Builder builder = AgeBandTable.builder().add("3-4", new AgeRange(36, 47));

        assertThatThrownBy(() -> builder.add("3-4", new AgeRange(36, 47)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
