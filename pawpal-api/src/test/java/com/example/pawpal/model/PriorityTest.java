package com.example.pawpal.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PriorityTest {

    @Test
    void fromLabelIgnoresCaseAndWhitespace() {
        assertThat(Priority.fromLabel("high")).isEqualTo(Priority.HIGH);
        assertThat(Priority.fromLabel(" Medium ")).isEqualTo(Priority.MEDIUM);
        assertThat(Priority.fromLabel("LOW")).isEqualTo(Priority.LOW);
    }

    @Test
    void unrecognisedLabelsSinkToUnknown() {
        assertThat(Priority.fromLabel("urgent")).isEqualTo(Priority.UNKNOWN);
        assertThat(Priority.fromLabel("")).isEqualTo(Priority.UNKNOWN);
        assertThat(Priority.fromLabel(null)).isEqualTo(Priority.UNKNOWN);
        assertThat(Priority.UNKNOWN.getRank()).isGreaterThan(Priority.LOW.getRank());
    }

    @Test
    void ranksOrderHighBeforeMediumBeforeLow() {
        assertThat(Priority.HIGH.getRank()).isLessThan(Priority.MEDIUM.getRank());
        assertThat(Priority.MEDIUM.getRank()).isLessThan(Priority.LOW.getRank());
        assertThat(Priority.HIGH.label()).isEqualTo("high");
    }

    @Test
    void recurrenceParsesKnownLabelsOnly() {
        assertThat(Recurrence.fromLabel("daily")).isEqualTo(Recurrence.DAILY);
        assertThat(Recurrence.fromLabel("WEEKLY")).isEqualTo(Recurrence.WEEKLY);
        assertThat(Recurrence.fromLabel(null)).isEqualTo(Recurrence.NONE);
        assertThatThrownBy(() -> Recurrence.fromLabel("monthly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("monthly");
    }
}
