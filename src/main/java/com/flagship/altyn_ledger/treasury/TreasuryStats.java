package com.flagship.altyn_ledger.treasury;

import com.flagship.altyn_ledger.dividend.DividendPayout;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import lombok.Value;

import java.util.List;

@Value
public class TreasuryStats {
    Treasury treasury;
    List<LedgerTransaction> recentEmissions;
    List<DividendPayout> recentDividends;
}
