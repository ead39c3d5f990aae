package com.nosota.mloan.service;

import com.nosota.mloan.error.ErrorCode;
import com.nosota.mloan.error.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollateralMathTest {

    @Test
    void ratioTruncates() {
        assertThat(CollateralMath.ratio(1499L, 1000L)).isEqualTo(149L);
        assertThat(CollateralMath.ratio(1500L, 1000L)).isEqualTo(150L);
        assertThat(CollateralMath.ratio(0L, 1000L)).isZero();
    }

    @Test
    void ratioSaturatesInsteadOfOverflowing() {
        assertThat(CollateralMath.ratio(Long.MAX_VALUE, 1L)).isEqualTo(Long.MAX_VALUE);
        assertThat(CollateralMath.ratio(Long.MAX_VALUE, 100L)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void ratioRequiresPositiveReferenceValue() {
        assertThatThrownBy(() -> CollateralMath.ratio(100L, 0L)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void percentOfTruncates() throws Exception {
        assertThat(CollateralMath.percentOf(999L, 150L)).isEqualTo(1498L);
        assertThat(CollateralMath.percentOf(2000L, 5L)).isEqualTo(100L);
    }

    @Test
    void overflowIsReported() {
        assertThatThrownBy(() -> CollateralMath.add(Long.MAX_VALUE, 1L))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ErrorCode.AMOUNT_OVERFLOW);
        assertThatThrownBy(() -> CollateralMath.value(Long.MAX_VALUE, 2L))
                .extracting("errorCode").isEqualTo(ErrorCode.AMOUNT_OVERFLOW);
        assertThatThrownBy(() -> CollateralMath.percentOf(Long.MAX_VALUE / 10, 150L))
                .extracting("errorCode").isEqualTo(ErrorCode.AMOUNT_OVERFLOW);
    }
}
