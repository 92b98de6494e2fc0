package com.flagship.altyn_ledger.settlement;

import com.flagship.altyn_ledger.error.LedgerException;
import com.flagship.altyn_ledger.error.NotFoundException;
import com.flagship.altyn_ledger.error.UnauthorizedException;
import com.flagship.altyn_ledger.identity.AdminGuard;
import com.flagship.altyn_ledger.identity.UserDirectory;
import com.flagship.altyn_ledger.identity.UserProfile;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transfer.TransferCommand;
import com.flagship.altyn_ledger.transfer.TransferEngine;
import com.flagship.altyn_ledger.transfer.TransferResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Entry point for marketplace and service modules paying for a listing.
 *
 * The facade moves COIN from buyer to seller through {@link TransferEngine}
 * and issues a receipt in the same transaction. It never touches listing
 * state: the calling module flips its listing to sold only after it gets a
 * COMPLETED receipt back. A rejected payment leaves no receipt and no
 * balance change, and surfaces as {@link SettlementException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementFacade {

    private final TransferEngine transferEngine;
    private final UserDirectory userDirectory;
    private final ReceiptRepository receiptRepository;
    private final AdminGuard adminGuard;

    /**
     * @param idempotencyKey sender-scoped key, or null for a one-shot payment
     * @throws SettlementException wrapping the ledger error that rejected the payment
     */
    @Transactional
    public SettlementResult pay(String buyerId, String sellerId, BigDecimal amount,
                                PaymentType paymentType, String listingId, String idempotencyKey) {
        if (listingId == null || listingId.isBlank()) {
            throw new IllegalArgumentException("Listing reference is required for " + paymentType);
        }
        try {
            UserProfile buyer = userDirectory.require(buyerId);
            UserProfile seller = userDirectory.require(sellerId);

            TransferResult result = transferEngine.execute(TransferCommand.builder()
                    .type(paymentType.toTransactionType())
                    .fromUserId(buyer.getUserId())
                    .toUserId(seller.getUserId())
                    .assetType(AssetType.COIN)
                    .amount(amount)
                    .description(paymentType.describe(listingId))
                    .idempotencyKey(idempotencyKey)
                    .build());
            LedgerTransaction tx = result.getTransaction();

            if (result.isReplayed()) {
                return replay(tx, buyer.getUserId(), seller.getUserId(), amount, paymentType, listingId);
            }

            Receipt receipt = new Receipt(
                    UUID.randomUUID(),
                    tx.getId(),
                    Instant.now(),
                    paymentType,
                    listingId,
                    buyer.getUserId(),
                    buyer.getDisplayName(),
                    seller.getUserId(),
                    seller.getDisplayName(),
                    LedgerAmounts.coins(tx.getAmount()),
                    tx.getFee(),
                    ReceiptStatus.COMPLETED);
            receiptRepository.save(ReceiptEntity.fromDomain(receipt));

            log.info("Payment settled: type={}, listingId={}, receiptId={}, transactionId={}",
                    paymentType, listingId, receipt.getReceiptId(), tx.getId());
            return new SettlementResult(tx, receipt, false);

        } catch (LedgerException e) {
            log.warn("Payment rejected: type={}, listingId={}, buyerId={}, code={}",
                    paymentType, listingId, buyerId, e.getErrorCode());
            throw new SettlementException(e, listingId, paymentType);
        }
    }

    /**
     * Rebuilds the result of a payment that was already settled, for a
     * request that repeats its idempotency key. The request must name the
     * same buyer, seller, amount, payment type and listing.
     *
     * @throws IllegalStateException if the key settled a different payment or no payment at all
     */
    @Transactional(readOnly = true)
    public SettlementResult replay(LedgerTransaction settled, String buyerId, String sellerId, BigDecimal amount,
                                   PaymentType paymentType, String listingId) {
        Receipt original = receiptRepository.findByTransactionId(settled.getId())
                .map(ReceiptEntity::toDomain)
                .orElseThrow(() -> new IllegalStateException(
                        "Idempotency key belongs to a transaction without receipt: " + settled.getId()));
        boolean samePayment = settled.isSameMovement(paymentType.toTransactionType(), AssetType.COIN,
                        buyerId, sellerId, amount)
                && original.getListingId().equals(listingId);
        if (!samePayment) {
            throw new IllegalStateException(
                    "Idempotency key was already used for a different payment: " + settled.getIdempotencyKey());
        }
        return new SettlementResult(settled, original, true);
    }

    /**
     * Receipts are visible to their buyer, their seller and admins.
     */
    @Transactional(readOnly = true)
    public Receipt getReceipt(String callerId, UUID receiptId) {
        Receipt receipt = receiptRepository.findById(receiptId)
                .map(ReceiptEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Receipt not found: " + receiptId));
        if (!receipt.isVisibleTo(callerId) && !adminGuard.isAdmin(callerId)) {
            throw new UnauthorizedException("Receipt " + receiptId + " belongs to another user");
        }
        return receipt;
    }
}
