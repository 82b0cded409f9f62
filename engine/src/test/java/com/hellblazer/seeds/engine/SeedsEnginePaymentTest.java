/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Seeds.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.seeds.engine;

import com.hellblazer.seeds.engine.config.EngineConfig;
import com.hellblazer.seeds.engine.event.SeedsEvent;
import com.hellblazer.seeds.engine.event.SeedsEventListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static com.hellblazer.seeds.engine.EngineFixture.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Payment settlement through the gateway and event delivery to listeners.
 *
 * @author hal.hildebrand
 */
public class SeedsEnginePaymentTest {

    private PaymentGateway gateway;
    private EngineFixture  f;

    @BeforeEach
    public void setup() {
        gateway = mock(PaymentGateway.class);
        var config = EngineConfig.testConfig()
                                 .toBuilder()
                                 .withBlessingCost(100)
                                 .withCommandmentCost(40)
                                 .withTreasury(TREASURY)
                                 .build();
        f = new EngineFixture(config, gateway, round -> 0L);
    }

    @Test
    public void testExcessPaymentIsRefunded() {
        var a = f.submit(1);
        f.engine.blessSeed(X, a, f.units(X), f.proof(X), 150);

        verify(gateway).deposit(TREASURY, 100);
        verify(gateway).refund(X, 50);
        verifyNoMoreInteractions(gateway);
    }

    @Test
    public void testExactPaymentHasNoRefund() {
        var a = f.submit(1);
        f.engine.submitCommandment(Y, a, handle(7), f.units(Y), f.proof(Y), 40);

        verify(gateway).deposit(TREASURY, 40);
        verify(gateway, never()).refund(anyString(), anyLong());
    }

    @Test
    public void testInsufficientPaymentChangesNothing() {
        var a = f.submit(1);
        var e = assertThrows(PaymentException.class, () -> f.engine.blessSeed(X, a, f.units(X), f.proof(X), 99));
        assertEquals(ErrorCode.INSUFFICIENT_PAYMENT, e.code());
        verifyNoInteractions(gateway);
        assertEquals(0, f.engine.getSeed(a).blessingScore());
        assertEquals(0, f.engine.getUserDailyBlessingCount(X));
    }

    @Test
    public void testIneligibleCallerIsNeverCharged() {
        var a = f.submit(1);
        assertThrows(EligibilityException.class,
                     () -> f.engine.blessSeed(OUTSIDER, a, new long[] { 1 }, f.proof(X), 1_000));
        verifyNoInteractions(gateway);
    }

    @Test
    public void testCostRequiresTreasury() {
        var noTreasury = new EngineFixture(EngineConfig.testConfig().toBuilder().withBlessingCost(1).build(), gateway,
                                           round -> 0L);
        var a = noTreasury.submit(1);
        var e = assertThrows(PaymentException.class, () -> noTreasury.engine.blessSeed(X, a, noTreasury.units(X),
                                                                                          noTreasury.proof(X), 1));
        assertEquals(ErrorCode.TREASURY_NOT_CONFIGURED, e.code());

        noTreasury.engine.setTreasury(ADMIN, TREASURY);
        noTreasury.engine.blessSeed(X, a, noTreasury.units(X), noTreasury.proof(X), 1);
        verify(gateway).deposit(TREASURY, 1);
    }

    @Test
    public void testStagedCostAppliesAtBoundary() {
        var a = f.submit(1);
        f.engine.setBlessingCost(ADMIN, 0);
        f.engine.blessSeed(X, a, f.units(X), f.proof(X), 100);
        verify(gateway).deposit(TREASURY, 100);

        f.endPeriod();
        f.engine.advance();
        var b = f.submit(2);
        f.engine.blessSeed(X, b, f.units(X), f.proof(X), 100);
        verify(gateway).refund(X, 100);
        verifyNoMoreInteractions(gateway);
    }

    @Test
    public void testListenersReceiveWinnerAndFailuresAreContained() {
        var failing = mock(SeedsEventListener.class);
        doThrow(new IllegalStateException("boom")).when(failing).onEvent(any());
        var listener = mock(SeedsEventListener.class);
        f.engine.addEventListener(failing);
        f.engine.addEventListener(listener);

        var a = f.submit(1);
        f.engine.blessSeed(X, a, f.units(X), f.proof(X), 100);
        f.endPeriod();
        f.engine.advance();

        var captor = ArgumentCaptor.forClass(SeedsEvent.class);
        verify(listener, atLeastOnce()).onEvent(captor.capture());
        var events = captor.getAllValues();
        assertTrue(events.get(0) instanceof SeedsEvent.SeedSubmitted);
        var blessing = (SeedsEvent.BlessingSubmitted) events.get(1);
        assertFalse(blessing.delegated());
        var winner = events.stream()
                           .filter(SeedsEvent.WinnerSelected.class::isInstance)
                           .map(SeedsEvent.WinnerSelected.class::cast)
                           .findFirst()
                           .orElseThrow();
        assertEquals(a, winner.winner().seedId());
        assertEquals(1, winner.round());
        assertFalse(winner.rewin());
        assertTrue(events.get(events.size() - 1) instanceof SeedsEvent.BlessingPeriodStarted);
        assertEquals(2, f.engine.currentRound());

        f.engine.removeEventListener(listener);
        f.submit(2);
        verify(listener, times(events.size())).onEvent(any());
    }
}
