package com.flagship.altyn_ledger.wallet;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ranked TOKEN holders: largest balance first, ties by user id.
 */
@Value
public class TokenHolderList {
    List<Holder> holders;
    BigDecimal totalSupply;
    long holdersCount;

    @Value
    public static class Holder {
        int rank;
        String userId;
        String userName;
        BigDecimal tokenBalance;
        BigDecimal percentage;
    }
}
