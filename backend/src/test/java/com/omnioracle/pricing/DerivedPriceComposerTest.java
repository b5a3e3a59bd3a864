package com.omnioracle.pricing;

import com.omnioracle.domain.RatioUnavailableException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DerivedPriceComposerTest {

    private static final BigInteger E18 = BigInteger.TEN.pow(18);

    private final DerivedPriceComposer composer = new DerivedPriceComposer();

    @Test
    void nativeAt2500_ratio2500_isOneDollar() {
        BigInteger native2500 = BigInteger.valueOf(2500).multiply(E18);

        assertThat(composer.compose(native2500, native2500)).isEqualTo(E18);
    }

    @Test
    void truncates() {
        assertThat(composer.compose(E18, BigInteger.valueOf(3).multiply(E18)))
                .isEqualTo(new BigInteger("333333333333333333"));
    }

    @Test
    void zeroRatio_throws() {
        assertThatThrownBy(() -> composer.compose(E18, BigInteger.ZERO))
                .isInstanceOf(RatioUnavailableException.class);
        assertThatThrownBy(() -> composer.compose(E18, null))
                .isInstanceOf(RatioUnavailableException.class);
    }

    @Test
    void zeroNativePrice_throws() {
        assertThatThrownBy(() -> composer.compose(BigInteger.ZERO, E18))
                .isInstanceOf(RatioUnavailableException.class);
    }
}
