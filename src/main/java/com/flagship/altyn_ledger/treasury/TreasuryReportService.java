package com.flagship.altyn_ledger.treasury;

import com.flagship.altyn_ledger.dividend.DividendPayoutRepository;
import com.flagship.altyn_ledger.identity.AdminGuard;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.WalletLedger;
import com.flagship.altyn_ledger.transaction.TransactionLog;
import com.flagship.altyn_ledger.transaction.TransactionType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Admin read views over the treasury.
 */
@Service
@Slf4j
public class TreasuryReportService {

    private final TreasuryAccount treasuryAccount;
    private final WalletLedger walletLedger;
    private final TransactionLog transactionLog;
    private final DividendPayoutRepository payoutRepository;
    private final AdminGuard adminGuard;
    private final int recentLimit;

    public TreasuryReportService(TreasuryAccount treasuryAccount,
                                 WalletLedger walletLedger,
                                 TransactionLog transactionLog,
                                 DividendPayoutRepository payoutRepository,
                                 AdminGuard adminGuard,
                                 @Value("${altyn.treasury.recent-limit:10}") int recentLimit) {
        this.treasuryAccount = treasuryAccount;
        this.walletLedger = walletLedger;
        this.transactionLog = transactionLog;
        this.payoutRepository = payoutRepository;
        this.adminGuard = adminGuard;
        this.recentLimit = recentLimit;
    }

    @Transactional(readOnly = true)
    public TreasuryStats getStats(String callerId) {
        adminGuard.requireAdmin(callerId, "treasury stats");
        return new TreasuryStats(
                treasuryAccount.current(),
                transactionLog.findRecentByType(TransactionType.EMISSION, recentLimit),
                payoutRepository.findRecent(recentLimit));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ReconciliationReport reconcile(String callerId) {
        adminGuard.requireAdmin(callerId, "reconciliation");
        return reconcile();
    }

    /**
     * Runs every conservation check in one snapshot. Also backs the
     * ledgerConservation health indicator.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public ReconciliationReport reconcile() {
        Treasury treasury = treasuryAccount.current();
        ReconciliationReport report = ReconciliationReport.builder()
                .coinWalletTotal(walletLedger.sumBalances(AssetType.COIN))
                .collectedFees(treasury.getCollectedFees())
                .totalCoinsInCirculation(treasury.getTotalCoinsInCirculation())
                .coinsEmitted(transactionLog.sumByType(TransactionType.EMISSION, AssetType.COIN))
                .feesCharged(transactionLog.sumFees())
                .dividendsPaid(transactionLog.sumByType(TransactionType.DIVIDEND, AssetType.COIN))
                .tokenWalletTotal(walletLedger.sumBalances(AssetType.TOKEN))
                .totalTokenSupply(treasury.getTotalTokenSupply())
                .tokensIssued(transactionLog.sumByType(TransactionType.EMISSION, AssetType.TOKEN))
                .checkedAt(Instant.now())
                .build();

        if (!report.isBalanced()) {
            log.error("Ledger out of balance: coinDiscrepancy={}, tokenDiscrepancy={}, circulation={}, emitted={}",
                    report.getCoinDiscrepancy(), report.getTokenDiscrepancy(),
                    report.getTotalCoinsInCirculation(), report.getCoinsEmitted());
        }
        return report;
    }
}
