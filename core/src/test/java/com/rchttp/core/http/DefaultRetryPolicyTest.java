package com.rchttp.core.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultRetryPolicyTest {

    @Test
    void delay_is_two_to_the_n_times_base_minus_1_to_4_ms() {
        var p = new DefaultRetryPolicy(Duration.ofMillis(20));

        for (int i = 0; i < 50; i++) {
            for (int n = 1; n <= 10; n++) {
                long expected = (1L << n) * 20;
                assertThat(p.nextDelay(n).toMillis())
                        .as("attempt=%d", n)
                        .isBetween(expected - 4, expected - 1);
            }
        }
    }

    @Test
    void delay_grows_with_attempt_number() {
        var p = new DefaultRetryPolicy(Duration.ofMillis(20));
        long prev = 0;
        for (int n = 1; n <= 12; n++) {
            long d = p.nextDelay(n).toMillis();
            assertThat(d).isGreaterThanOrEqualTo(prev);
            prev = d;
        }
    }

    @Test
    void small_base_is_clamped_to_zero_not_negative() {
        var zero = new DefaultRetryPolicy(Duration.ZERO);
        var tiny = new DefaultRetryPolicy(Duration.ofMillis(1));
        for (int i = 0; i < 50; i++) {
            assertThat(zero.nextDelay(1)).isEqualTo(Duration.ZERO);
            assertThat(tiny.nextDelay(1).isNegative()).isFalse();
        }
    }

    @Test
    void large_attempt_numbers_do_not_overflow() {
        var p = new DefaultRetryPolicy(Duration.ofMillis(20));
        long capped = (1L << 30) * 20;
        assertThat(p.nextDelay(200).toMillis()).isBetween(capped - 4, capped - 1);
    }

    @Test
    void huge_base_delay_saturates_instead_of_throwing() {
        var p = new DefaultRetryPolicy(Duration.ofSeconds(Long.MAX_VALUE / 2));
        Duration d = p.nextDelay(5);
        assertThat(d).isLessThanOrEqualTo(DefaultRetryPolicy.MAX_DELAY);
        assertThat(d).isGreaterThan(DefaultRetryPolicy.MAX_DELAY.minusMillis(5));

        var days = new DefaultRetryPolicy(Duration.ofDays(365_000));
        assertThat(days.nextDelay(30)).isLessThanOrEqualTo(DefaultRetryPolicy.MAX_DELAY);
    }

    @Test
    void rejects_bad_input() {
        assertThatThrownBy(() -> new DefaultRetryPolicy(Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultRetryPolicy(Duration.ofMillis(20)).nextDelay(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
