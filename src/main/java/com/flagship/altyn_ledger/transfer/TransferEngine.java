package com.flagship.altyn_ledger.transfer;

import com.flagship.altyn_ledger.corporate.CorporateAccounts;
import com.flagship.altyn_ledger.corporate.CorporateWalletRepository;
import com.flagship.altyn_ledger.error.LedgerException;
import com.flagship.altyn_ledger.error.NotFoundException;
import com.flagship.altyn_ledger.error.SelfTransferNotAllowedException;
import com.flagship.altyn_ledger.event.TransactionRecordedEvent;
import com.flagship.altyn_ledger.identity.AdminGuard;
import com.flagship.altyn_ledger.identity.UserDirectory;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import com.flagship.altyn_ledger.ledger.WalletLedger;
import com.flagship.altyn_ledger.observability.CorrelationContext;
import com.flagship.altyn_ledger.observability.LedgerMetrics;
import com.flagship.altyn_ledger.outbox.OutboxService;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transaction.TransactionLog;
import com.flagship.altyn_ledger.transaction.TransactionType;
import com.flagship.altyn_ledger.treasury.TreasuryAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Moves one asset between two wallets and records the movement.
 *
 * The sender is debited the gross amount; the fee is carved out of what the
 * recipient receives and credited to the treasury. COIN movements carry
 * fee = round(amount * 0.001, 2); TOKEN movements carry no fee and may only
 * be initiated by an admin. Either party may be an organization's COIN
 * account ({@code org:<organizationId>}) once its corporate wallet is open.
 *
 * Every check that can reject the request runs before the first mutation.
 * After that the atomic debit is the last point of business failure, and the
 * debit, credit, fee credit, log append and outbox write share one database
 * transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferEngine {

    private final WalletLedger walletLedger;
    private final TransactionLog transactionLog;
    private final TreasuryAccount treasuryAccount;
    private final UserDirectory userDirectory;
    private final CorporateWalletRepository corporateWalletRepository;
    private final AdminGuard adminGuard;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Plain user-to-user transfer without an idempotency key.
     */
    @Transactional
    public LedgerTransaction transfer(String fromUserId, String toUserId, AssetType assetType,
                                      BigDecimal amount, String description) {
        return execute(TransferCommand.builder()
                .fromUserId(fromUserId)
                .toUserId(toUserId)
                .assetType(assetType)
                .amount(amount)
                .description(description)
                .build())
            .getTransaction();
    }

    /**
     * Settles a movement, or returns the original transaction when the
     * command's idempotency key was settled before.
     *
     * @throws com.flagship.altyn_ledger.error.InvalidAmountException if the amount is not positive or too precise
     * @throws SelfTransferNotAllowedException if sender and recipient are the same user
     * @throws com.flagship.altyn_ledger.error.UnauthorizedException if a non-admin moves TOKEN
     * @throws com.flagship.altyn_ledger.error.NotFoundException if either party is unknown or a corporate wallet was never opened
     * @throws com.flagship.altyn_ledger.error.InsufficientFundsException if the sender cannot cover the amount
     * @throws IllegalStateException if the idempotency key belongs to a different movement
     */
    @Transactional
    public TransferResult execute(TransferCommand command) {
        String operation = command.getType().name();
        try {
            return ledgerMetrics.time(operation, () -> settle(command));
        } catch (LedgerException e) {
            ledgerMetrics.recordRejection(operation, e.getErrorCode());
            log.warn("Transfer rejected: type={}, from={}, to={}, asset={}, amount={}, code={}, reason={}",
                    command.getType(), command.getFromUserId(), command.getToUserId(),
                    command.getAssetType(), command.getAmount(), e.getErrorCode(), e.getMessage());
            throw e;
        }
    }

    private TransferResult settle(TransferCommand command) {
        TransactionType type = command.getType();
        if (!type.isFeeBearing()) {
            throw new IllegalArgumentException(type + " cannot be executed as a transfer");
        }
        AssetType assetType = command.getAssetType();
        BigDecimal amount = LedgerAmounts.requirePositive(command.getAmount(), assetType);
        String fromUserId = command.getFromUserId();
        String toUserId = command.getToUserId();

        if (fromUserId != null && fromUserId.equals(toUserId)) {
            throw new SelfTransferNotAllowedException(fromUserId);
        }
        requireAccount(fromUserId);
        requireAccount(toUserId);
        if (assetType == AssetType.TOKEN
                && (CorporateAccounts.isCorporate(fromUserId) || CorporateAccounts.isCorporate(toUserId))) {
            throw new IllegalArgumentException("Corporate wallets hold COIN only");
        }
        if (assetType == AssetType.TOKEN) {
            adminGuard.requireAdmin(fromUserId, "TOKEN transfer");
        }

        treasuryAccount.lock();

        Optional<LedgerTransaction> previous = transactionLog.findByIdempotencyKey(command.getIdempotencyKey());
        if (previous.isPresent()) {
            return TransferResult.replayOf(verifyReplay(previous.get(), command));
        }

        BigDecimal fee = assetType == AssetType.COIN
                ? LedgerAmounts.feeFor(amount)
                : LedgerAmounts.zero(AssetType.COIN);
        BigDecimal netAmount = amount.subtract(fee);

        walletLedger.debit(fromUserId, assetType, amount);
        walletLedger.credit(toUserId, assetType, netAmount);
        treasuryAccount.creditFees(fee);

        LedgerTransaction tx = transactionLog.append(LedgerTransaction.movement(
                type, assetType, fromUserId, toUserId, amount, fee,
                command.getDescription(), command.getIdempotencyKey()));
        outboxService.record(TransactionRecordedEvent.of(tx));

        ledgerMetrics.recordTransaction(type, assetType, amount, fee);
        CorrelationContext.setTransactionId(tx.getId());
        log.info("Transfer settled: type={}, from={}, to={}, asset={}, amount={}, fee={}, net={}",
                type, fromUserId, toUserId, assetType, amount, fee, tx.getNetAmount());

        return TransferResult.settled(tx);
    }

    private void requireAccount(String accountId) {
        if (CorporateAccounts.isCorporate(accountId)) {
            if (!corporateWalletRepository.existsByAccountId(accountId)) {
                throw new NotFoundException("Corporate wallet not found: " + accountId);
            }
            return;
        }
        userDirectory.require(accountId);
    }

    private LedgerTransaction verifyReplay(LedgerTransaction previous, TransferCommand command) {
        requireSameMovement(previous, command);
        ledgerMetrics.recordIdempotencyHit();
        log.info("Replaying settled transfer: transactionId={}, idempotencyKey={}",
                previous.getId(), command.getIdempotencyKey());
        return previous;
    }

    /**
     * Checks that a request repeating a settled idempotency key asks for the
     * movement that key already settled.
     *
     * @return the settled transaction
     * @throws IllegalStateException if the key was used for a different movement
     */
    public LedgerTransaction requireSameMovement(LedgerTransaction previous, TransferCommand command) {
        if (!previous.isSameMovement(command.getType(), command.getAssetType(),
                command.getFromUserId(), command.getToUserId(), command.getAmount())) {
            throw new IllegalStateException(
                    "Idempotency key was already used for a different request: " + previous.getIdempotencyKey());
        }
        return previous;
    }
}
