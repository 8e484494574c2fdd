/*
 * Copyright (C) 2025 Archelyst
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.archelyst.infrastructure.provider;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class YahooFinanceAdapterTest {
    @Test
    void cryptoTickersGetUsdPairs() {
        assertEquals("BTC-USD", YahooFinanceAdapter.toYahooSymbol("BTC"));
        assertEquals("ETH-USD", YahooFinanceAdapter.toYahooSymbol("ETH"));
        assertEquals("AAPL", YahooFinanceAdapter.toYahooSymbol("AAPL"));
    }

    @Test
    void chartRangeCoversRequestedDays() {
        assertEquals("5d", YahooFinanceAdapter.rangeForDays(5));
        assertEquals("1mo", YahooFinanceAdapter.rangeForDays(30));
        assertEquals("1y", YahooFinanceAdapter.rangeForDays(365));
        assertEquals("10y", YahooFinanceAdapter.rangeForDays(5_000));
    }
}
