package com.flagship.altyn_ledger.dividend;

import com.flagship.altyn_ledger.error.LedgerException;
import com.flagship.altyn_ledger.error.NothingToDistributeException;
import com.flagship.altyn_ledger.event.DividendsDistributedEvent;
import com.flagship.altyn_ledger.event.TransactionRecordedEvent;
import com.flagship.altyn_ledger.identity.AdminGuard;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.Wallet;
import com.flagship.altyn_ledger.ledger.WalletLedger;
import com.flagship.altyn_ledger.observability.LedgerMetrics;
import com.flagship.altyn_ledger.outbox.OutboxService;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transaction.TransactionLog;
import com.flagship.altyn_ledger.treasury.Treasury;
import com.flagship.altyn_ledger.treasury.TreasuryAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Pays the treasury fee pool out to TOKEN holders in proportion to their holdings.
 *
 * The run holds the treasury lock from the fee snapshot to the final drain,
 * so no transfer can add fees in between and two runs cannot overlap.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DividendDistributor {

    private static final String OPERATION = "DIVIDEND_DISTRIBUTION";

    private final TreasuryAccount treasuryAccount;
    private final WalletLedger walletLedger;
    private final TransactionLog transactionLog;
    private final DividendPayoutRepository payoutRepository;
    private final AdminGuard adminGuard;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * @throws com.flagship.altyn_ledger.error.UnauthorizedException if the caller is not an admin
     * @throws NothingToDistributeException if the fee pool is empty or nobody holds TOKEN
     */
    @Transactional
    public DividendPayout distribute(String callerId) {
        try {
            return ledgerMetrics.time(OPERATION, () -> runDistribution(callerId));
        } catch (LedgerException e) {
            ledgerMetrics.recordRejection(OPERATION, e.getErrorCode());
            log.warn("Dividend distribution rejected: callerId={}, code={}, reason={}",
                    callerId, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private DividendPayout runDistribution(String callerId) {
        adminGuard.requireAdmin(callerId, "dividend distribution");

        Treasury treasury = treasuryAccount.lock();
        if (!treasury.hasFeesToDistribute()) {
            throw new NothingToDistributeException("Treasury has no collected fees to distribute");
        }

        List<Wallet> holders = walletLedger.findTokenHolders();
        if (holders.isEmpty()) {
            throw new NothingToDistributeException("No TOKEN holders to distribute to");
        }
        BigDecimal supply = treasury.getTotalTokenSupply();
        BigDecimal heldTotal = holders.stream()
                .map(Wallet::getTokenBalance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (heldTotal.compareTo(supply) != 0) {
            throw new IllegalStateException(String.format(
                    "TOKEN supply %s does not match holder balances %s",
                    supply.toPlainString(), heldTotal.toPlainString()));
        }

        BigDecimal pool = treasury.getCollectedFees();
        List<DividendShare> allocation = DividendAllocator.allocate(pool, holders, supply);

        UUID payoutId = UUID.randomUUID();
        String description = "Dividend payout " + payoutId;
        List<DividendShare> details = new ArrayList<>(allocation.size());
        BigDecimal distributed = BigDecimal.ZERO;
        for (DividendShare share : allocation) {
            if (!share.isPaid()) {
                details.add(share);
                continue;
            }
            walletLedger.credit(share.getUserId(), AssetType.COIN, share.getAmount());
            LedgerTransaction tx = transactionLog.append(
                    LedgerTransaction.dividend(share.getUserId(), share.getAmount(), description));
            outboxService.record(TransactionRecordedEvent.of(tx));
            details.add(share.withTransactionId(tx.getId()));
            distributed = distributed.add(share.getAmount());
        }

        treasuryAccount.drainFees(distributed);

        DividendPayout payout = new DividendPayout(
                payoutId, distributed, holders.size(), supply, callerId, Instant.now(), List.copyOf(details));
        payoutRepository.save(payout);
        outboxService.record(new DividendsDistributedEvent(
                UUID.randomUUID(), payoutId, distributed, holders.size(), supply, callerId, payout.getCreatedAt()));

        ledgerMetrics.recordDividendRun(distributed, holders.size());
        log.info("Dividends distributed: payoutId={}, total={}, holders={}, supply={}",
                payoutId, distributed, holders.size(), supply);
        return payout;
    }
}
