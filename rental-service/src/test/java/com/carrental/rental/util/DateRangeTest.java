package com.carrental.rental.util;

import com.carrental.rental.exception.InvalidRangeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DateRange Tests")
class DateRangeTest {

    private static LocalDate jan(int day) {
        return LocalDate.of(2025, 1, day);
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Should reject zero-duration range")
        void of_SameStartAndEnd_ThrowsInvalidRange() {
            assertThatThrownBy(() -> DateRange.of(jan(10), jan(10)))
                    .isInstanceOf(InvalidRangeException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_RANGE");
        }

        @Test
        @DisplayName("Should reject reversed range")
        void of_EndBeforeStart_ThrowsInvalidRange() {
            assertThatThrownBy(() -> DateRange.of(jan(10), jan(5)))
                    .isInstanceOf(InvalidRangeException.class);
        }

        @Test
        @DisplayName("Should reject missing dates")
        void of_MissingDates_ThrowsInvalidRange() {
            assertThatThrownBy(() -> DateRange.of(null, jan(5)))
                    .isInstanceOf(InvalidRangeException.class);
            assertThatThrownBy(() -> DateRange.of(jan(5), null))
                    .isInstanceOf(InvalidRangeException.class);
        }

        @Test
        @DisplayName("Should count days between start and return date")
        void durationDays_CountsNights() {
            assertThat(DateRange.of(jan(5), jan(10)).durationDays()).isEqualTo(5);
            assertThat(DateRange.of(jan(31), LocalDate.of(2025, 2, 1)).durationDays()).isEqualTo(1);
        }

        @Test
        @DisplayName("Range spanning more days than an int holds is an invalid range")
        void durationDays_Overflow_ThrowsInvalidRange() {
            DateRange huge = DateRange.of(LocalDate.MIN, LocalDate.MAX);

            assertThatThrownBy(huge::durationDays)
                    .isInstanceOf(InvalidRangeException.class)
                    .hasMessage("Date range is too long");
        }

        @Test
        @DisplayName("Unbounded range has no duration")
        void durationDays_Unbounded_Throws() {
            DateRange open = DateRange.from(jan(8));

            assertThat(open.isUnbounded()).isTrue();
            assertThatThrownBy(open::durationDays).isInstanceOf(InvalidRangeException.class);
        }

        @Test
        @DisplayName("Inclusive window covers its end date")
        void inclusive_ExtendsEndByOneDay() {
            DateRange window = DateRange.inclusive(jan(8), jan(8));

            assertThat(window.end()).isEqualTo(jan(9));
            assertThat(window.contains(jan(8))).isTrue();
            assertThat(window.contains(jan(9))).isFalse();
        }

        @Test
        @DisplayName("Inclusive window cannot end before it starts")
        void inclusive_EndBeforeStart_Throws() {
            assertThatThrownBy(() -> DateRange.inclusive(jan(8), jan(7)))
                    .isInstanceOf(InvalidRangeException.class);
        }
    }

    @Nested
    @DisplayName("Overlap")
    class OverlapTests {

        @Test
        @DisplayName("Ranges sharing a day overlap")
        void overlaps_SharedDays_True() {
            assertThat(DateRange.of(jan(5), jan(10)).overlaps(DateRange.of(jan(7), jan(12)))).isTrue();
            assertThat(DateRange.of(jan(7), jan(12)).overlaps(DateRange.of(jan(5), jan(10)))).isTrue();
        }

        @Test
        @DisplayName("Return day can be the next pick-up day")
        void overlaps_Adjacent_False() {
            DateRange first = DateRange.of(jan(5), jan(10));
            DateRange second = DateRange.of(jan(10), jan(12));

            assertThat(first.overlaps(second)).isFalse();
            assertThat(DateRange.overlaps(second, first)).isFalse();
        }

        @Test
        @DisplayName("Containment overlaps")
        void overlaps_Contained_True() {
            assertThat(DateRange.of(jan(1), jan(20)).overlaps(DateRange.of(jan(5), jan(6)))).isTrue();
        }

        @Test
        @DisplayName("Open range blocks everything from its start")
        void overlaps_Unbounded() {
            DateRange open = DateRange.from(jan(8));

            assertThat(open.overlaps(DateRange.of(jan(1), jan(4)))).isFalse();
            assertThat(open.overlaps(DateRange.of(jan(1), jan(9)))).isTrue();
            assertThat(open.overlaps(DateRange.of(LocalDate.of(2030, 6, 1), LocalDate.of(2030, 6, 3)))).isTrue();
            assertThat(open.overlaps(DateRange.from(jan(1)))).isTrue();
        }

        @Test
        @DisplayName("Overlap is symmetric")
        void overlaps_Symmetric() {
            DateRange a = DateRange.of(jan(3), jan(9));
            DateRange b = DateRange.of(jan(8), jan(15));
            DateRange c = DateRange.of(jan(9), jan(15));

            assertThat(a.overlaps(b)).isEqualTo(b.overlaps(a));
            assertThat(a.overlaps(c)).isEqualTo(c.overlaps(a));
        }
    }
}
