package com.flagship.altyn_ledger.treasury;

import com.flagship.altyn_ledger.error.LedgerException;
import com.flagship.altyn_ledger.event.TransactionRecordedEvent;
import com.flagship.altyn_ledger.identity.AdminGuard;
import com.flagship.altyn_ledger.identity.UserDirectory;
import com.flagship.altyn_ledger.identity.UserProfile;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import com.flagship.altyn_ledger.ledger.WalletLedger;
import com.flagship.altyn_ledger.observability.CorrelationContext;
import com.flagship.altyn_ledger.observability.LedgerMetrics;
import com.flagship.altyn_ledger.outbox.OutboxService;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transaction.TransactionLog;
import com.flagship.altyn_ledger.transaction.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Admin-only creation of new COIN and TOKEN.
 *
 * Minting COIN is the only way total_coins_in_circulation grows; issuing
 * TOKEN is the only way total_token_supply grows. Both are logged as
 * EMISSION transactions with no sender and no fee.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmissionService {

    private final WalletLedger walletLedger;
    private final TransactionLog transactionLog;
    private final TreasuryAccount treasuryAccount;
    private final UserDirectory userDirectory;
    private final AdminGuard adminGuard;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Mints {@code amount} COIN into the target wallet. A null target mints into
     * the caller's own wallet.
     *
     * @throws com.flagship.altyn_ledger.error.UnauthorizedException if the caller is not an admin
     * @throws com.flagship.altyn_ledger.error.InvalidAmountException if amount is not positive
     */
    @Transactional
    public LedgerTransaction emit(String callerId, String targetUserId, BigDecimal amount, String description) {
        return guarded("EMISSION", callerId, () -> {
            adminGuard.requireAdmin(callerId, "COIN emission");
            BigDecimal coins = LedgerAmounts.requirePositive(amount, AssetType.COIN);
            String target = resolveTarget(callerId, targetUserId);
            return mint(AssetType.COIN, target, coins, description);
        });
    }

    /**
     * Issues {@code amount} TOKEN to the target wallet.
     */
    @Transactional
    public LedgerTransaction issueTokens(String callerId, String targetUserId, BigDecimal amount, String description) {
        return guarded("TOKEN_ISSUANCE", callerId, () -> {
            adminGuard.requireAdmin(callerId, "TOKEN issuance");
            BigDecimal tokens = LedgerAmounts.requirePositive(amount, AssetType.TOKEN);
            String target = userDirectory.require(targetUserId).getUserId();
            return mint(AssetType.TOKEN, target, tokens, description);
        });
    }

    /**
     * Seeds a user's wallet by email: TOKEN always, COIN when a positive
     * coin amount is given. Both land in one database transaction.
     */
    @Transactional
    public WalletInitialization initializeWallet(String callerId, String userEmail,
                                                 BigDecimal tokenAmount, BigDecimal coinAmount) {
        return guarded("WALLET_INITIALIZATION", callerId, () -> {
            adminGuard.requireAdmin(callerId, "wallet initialization");
            BigDecimal tokens = LedgerAmounts.requirePositive(tokenAmount, AssetType.TOKEN);
            BigDecimal coins = coinAmount == null || coinAmount.signum() == 0
                    ? null
                    : LedgerAmounts.requirePositive(coinAmount, AssetType.COIN);
            UserProfile user = userDirectory.requireByEmail(userEmail);

            LedgerTransaction tokenTx = mint(AssetType.TOKEN, user.getUserId(), tokens, "Initial TOKEN allocation");
            LedgerTransaction coinTx = coins != null
                    ? mint(AssetType.COIN, user.getUserId(), coins, "Initial COIN allocation")
                    : null;
            return new WalletInitialization(user.getUserId(), user.getEmail(), tokenTx, coinTx);
        });
    }

    private LedgerTransaction mint(AssetType assetType, String targetUserId, BigDecimal amount, String description) {
        treasuryAccount.lock();

        walletLedger.credit(targetUserId, assetType, amount);
        if (assetType == AssetType.COIN) {
            treasuryAccount.increaseCirculation(amount);
        } else {
            treasuryAccount.increaseTokenSupply(amount);
        }

        LedgerTransaction tx = transactionLog.append(
                LedgerTransaction.emission(assetType, targetUserId, amount, description));
        outboxService.record(TransactionRecordedEvent.of(tx));

        ledgerMetrics.recordTransaction(TransactionType.EMISSION, assetType, amount, tx.getFee());
        CorrelationContext.setTransactionId(tx.getId());
        log.info("Emission settled: asset={}, target={}, amount={}, transactionId={}",
                assetType, targetUserId, amount, tx.getId());
        return tx;
    }

    private String resolveTarget(String callerId, String targetUserId) {
        String target = targetUserId == null || targetUserId.isBlank() ? callerId : targetUserId;
        return userDirectory.require(target).getUserId();
    }

    private <T> T guarded(String operation, String callerId, Supplier<T> work) {
        try {
            return ledgerMetrics.time(operation, work);
        } catch (LedgerException e) {
            ledgerMetrics.recordRejection(operation, e.getErrorCode());
            log.warn("{} rejected: callerId={}, code={}, reason={}",
                    operation, callerId, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    /**
     * Transactions written while seeding one wallet. {@code coinTransaction}
     * is null when no COIN was requested.
     */
    @Value
    public static class WalletInitialization {
        String userId;
        String email;
        LedgerTransaction tokenTransaction;
        LedgerTransaction coinTransaction;
    }
}
