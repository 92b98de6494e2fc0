package com.flagship.altyn_ledger.dividend;

import com.flagship.altyn_ledger.ledger.Wallet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DividendAllocatorTest {

    @Test
    @DisplayName("Exact shares are paid without residual")
    void exactSplit() {
        List<DividendShare> shares = DividendAllocator.allocate(
                new BigDecimal("1000.00"),
                List.of(holder("alice", "70"), holder("bob", "30")),
                new BigDecimal("100.0000"));

        assertEquals(2, shares.size());
        assertEquals(new BigDecimal("700.00"), shares.get(0).getAmount());
        assertEquals(new BigDecimal("300.00"), shares.get(1).getAmount());
        assertEquals(new BigDecimal("70.0000"), shares.get(0).getTokenPercentage());
    }

    @Test
    @DisplayName("Positive residual goes to the largest holder")
    void positiveResidualToLargestHolder() {
        List<DividendShare> shares = DividendAllocator.allocate(
                new BigDecimal("10.00"),
                List.of(holder("u1", "1"), holder("u2", "5"), holder("u3", "1")),
                new BigDecimal("7"));

        // 1.43 + 7.14 + 1.43, no residual
        assertEquals(new BigDecimal("10.00"), total(shares));
        assertEquals(new BigDecimal("7.14"), shares.get(1).getAmount());

        // 3.33 each, residual 0.01
        List<DividendShare> equal = DividendAllocator.allocate(
                new BigDecimal("10.00"),
                List.of(holder("u1", "1"), holder("u2", "1"), holder("u3", "1")),
                new BigDecimal("3"));

        assertEquals(new BigDecimal("3.34"), equal.get(0).getAmount(), "tie goes to the lowest user id");
        assertEquals(new BigDecimal("3.33"), equal.get(1).getAmount());
        assertEquals(new BigDecimal("3.33"), equal.get(2).getAmount());
        assertEquals(new BigDecimal("10.00"), total(equal));
    }

    @Test
    @DisplayName("Negative residual is taken from the largest holder")
    void negativeResidualFromLargestHolder() {
        // 0.05 * 1/2 = 0.025 -> 0.03 twice, sum 0.06, residual -0.01
        List<DividendShare> shares = DividendAllocator.allocate(
                new BigDecimal("0.05"),
                List.of(holder("u1", "1"), holder("u2", "1")),
                new BigDecimal("2"));

        assertEquals(new BigDecimal("0.02"), shares.get(0).getAmount());
        assertEquals(new BigDecimal("0.03"), shares.get(1).getAmount());
        assertEquals(new BigDecimal("0.05"), total(shares));
    }

    @Test
    @DisplayName("Negative residual never drives a payout below zero")
    void negativeResidualSpillsOver() {
        // 0.005 rounds to 0.01 twice, residual -0.01 against a 0.01 payout
        List<DividendShare> shares = DividendAllocator.allocate(
                new BigDecimal("0.01"),
                List.of(holder("u1", "1"), holder("u2", "1")),
                new BigDecimal("2"));

        assertEquals(new BigDecimal("0.00"), shares.get(0).getAmount());
        assertEquals(new BigDecimal("0.01"), shares.get(1).getAmount());
        assertFalse(shares.get(0).isPaid());
        assertTrue(shares.get(1).isPaid());
        shares.forEach(s -> assertTrue(s.getAmount().signum() >= 0));
    }

    @Test
    @DisplayName("Dust holders can receive a zero payout")
    void dustHolderGetsNothing() {
        List<DividendShare> shares = DividendAllocator.allocate(
                new BigDecimal("1.00"),
                List.of(holder("big", "10000"), holder("dust", "0.0001")),
                new BigDecimal("10000.0001"));

        assertEquals(new BigDecimal("1.00"), shares.get(0).getAmount());
        assertEquals(new BigDecimal("0.00"), shares.get(1).getAmount());
        assertFalse(shares.get(1).isPaid());
    }

    @Test
    @DisplayName("Allocation requires holders and a positive supply")
    void rejectsEmptyInput() {
        assertThrows(IllegalArgumentException.class,
                () -> DividendAllocator.allocate(new BigDecimal("1.00"), List.of(), BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class,
                () -> DividendAllocator.allocate(new BigDecimal("1.00"), List.of(holder("u1", "1")), BigDecimal.ZERO));
    }

    private static Wallet holder(String userId, String tokens) {
        return new Wallet(userId, new BigDecimal("0.00"), new BigDecimal(tokens).setScale(4), 1L);
    }

    private static BigDecimal total(List<DividendShare> shares) {
        return shares.stream().map(DividendShare::getAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
