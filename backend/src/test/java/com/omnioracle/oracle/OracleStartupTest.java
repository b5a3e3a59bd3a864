package com.omnioracle.oracle;

import com.omnioracle.domain.OracleMode;
import com.omnioracle.domain.OracleStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OracleStartupTest {

    @Mock
    OracleStatePersistence persistence;
    @Mock
    OmniPriceOracle oracle;

    @Test
    void restoresStateBeforeInitializingTwap() {
        when(oracle.status()).thenReturn(new OracleStatus(OracleMode.CONSUMER, false, false, false, 0, 2, 0,
                false, BigInteger.ZERO, 0L, List.of(), 0));

        new OracleStartup(persistence, oracle).onReady();

        InOrder order = inOrder(persistence, oracle);
        order.verify(persistence).restore();
        order.verify(oracle).initTwapIfNeeded();
    }
}
