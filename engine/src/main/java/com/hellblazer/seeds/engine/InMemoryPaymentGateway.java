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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ledger-only gateway: records treasury deposits and refunds without moving anything.
 *
 * @author hal.hildebrand
 */
public class InMemoryPaymentGateway implements PaymentGateway {
    private static final Logger log = LoggerFactory.getLogger(InMemoryPaymentGateway.class);

    private final Map<String, AtomicLong> deposits = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> refunds  = new ConcurrentHashMap<>();

    @Override
    public void deposit(String treasury, long amount) {
        deposits.computeIfAbsent(treasury, k -> new AtomicLong()).addAndGet(amount);
        log.debug("Deposited {} to {}", amount, treasury);
    }

    public long deposited(String treasury) {
        var total = deposits.get(treasury);
        return total == null ? 0 : total.get();
    }

    @Override
    public void refund(String payer, long amount) {
        refunds.computeIfAbsent(payer, k -> new AtomicLong()).addAndGet(amount);
        log.debug("Refunded {} to {}", amount, payer);
    }

    public long refunded(String payer) {
        var total = refunds.get(payer);
        return total == null ? 0 : total.get();
    }
}
