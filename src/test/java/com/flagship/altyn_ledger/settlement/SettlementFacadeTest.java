package com.flagship.altyn_ledger.settlement;

import com.flagship.altyn_ledger.error.ErrorCode;
import com.flagship.altyn_ledger.error.InsufficientFundsException;
import com.flagship.altyn_ledger.error.NotFoundException;
import com.flagship.altyn_ledger.error.UnauthorizedException;
import com.flagship.altyn_ledger.identity.AdminGuard;
import com.flagship.altyn_ledger.identity.UserDirectory;
import com.flagship.altyn_ledger.identity.UserProfile;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transaction.TransactionType;
import com.flagship.altyn_ledger.transfer.TransferCommand;
import com.flagship.altyn_ledger.transfer.TransferEngine;
import com.flagship.altyn_ledger.transfer.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SettlementFacadeTest {

    @Mock
    private TransferEngine transferEngine;
    @Mock
    private UserDirectory userDirectory;
    @Mock
    private ReceiptRepository receiptRepository;

    private SettlementFacade facade;

    @BeforeEach
    void setUp() {
        facade = new SettlementFacade(transferEngine, userDirectory, receiptRepository, new AdminGuard(userDirectory));

        givenUser("buyer", "Buyer", false);
        givenUser("seller", "Seller", false);
        givenUser("admin", "Admin", true);
        givenUser("other", "Other", false);
        when(userDirectory.require(anyString())).thenCallRealMethod();
        when(receiptRepository.save(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    @DisplayName("Marketplace purchase issues a COMPLETED receipt with fee and names")
    void purchaseIssuesReceipt() {
        LedgerTransaction tx = payment(TransactionType.MARKETPLACE_PURCHASE, "100.00", "0.10");
        when(transferEngine.execute(any())).thenReturn(new TransferResult(tx, false));

        SettlementResult result = facade.pay("buyer", "seller", new BigDecimal("100"),
                PaymentType.MARKETPLACE_PURCHASE, "listing-42", null);

        Receipt receipt = result.getReceipt();
        assertFalse(result.isReplayed());
        assertEquals(tx.getId(), receipt.getTransactionId());
        assertEquals(ReceiptStatus.COMPLETED, receipt.getStatus());
        assertEquals("listing-42", receipt.getListingId());
        assertEquals("Buyer", receipt.getBuyerName());
        assertEquals("Seller", receipt.getSellerName());
        assertEquals(new BigDecimal("100.00"), receipt.getTotalPaid());
        assertEquals(new BigDecimal("0.10"), receipt.getFeeAmount());

        ArgumentCaptor<TransferCommand> command = ArgumentCaptor.forClass(TransferCommand.class);
        verify(transferEngine).execute(command.capture());
        assertEquals(TransactionType.MARKETPLACE_PURCHASE, command.getValue().getType());
        assertEquals(AssetType.COIN, command.getValue().getAssetType());
        assertEquals("Marketplace purchase: listing-42", command.getValue().getDescription());
        verify(receiptRepository).save(any());
    }

    @Test
    @DisplayName("Rejected payment surfaces the ledger code with listing context and no receipt")
    void rejectedPaymentHasNoReceipt() {
        when(transferEngine.execute(any()))
                .thenThrow(new InsufficientFundsException("buyer", AssetType.COIN, new BigDecimal("100.00")));

        SettlementException e = assertThrows(SettlementException.class,
                () -> facade.pay("buyer", "seller", new BigDecimal("100"),
                        PaymentType.SERVICE_PAYMENT, "svc-7", null));

        assertEquals(ErrorCode.INSUFFICIENT_FUNDS, e.getErrorCode());
        assertEquals("svc-7", e.getListingId());
        assertEquals(PaymentType.SERVICE_PAYMENT, e.getPaymentType());
        assertTrue(e.getCause() instanceof InsufficientFundsException);
        verify(receiptRepository, never()).save(any());
    }

    @Test
    @DisplayName("Unknown seller is rejected before any funds move")
    void unknownSeller() {
        SettlementException e = assertThrows(SettlementException.class,
                () -> facade.pay("buyer", "ghost", BigDecimal.TEN, PaymentType.MARKETPLACE_PURCHASE, "l-1", null));

        assertEquals(ErrorCode.NOT_FOUND, e.getErrorCode());
        verifyNoInteractions(transferEngine);
    }

    @Test
    @DisplayName("Listing reference is required")
    void listingRequired() {
        assertThrows(IllegalArgumentException.class,
                () -> facade.pay("buyer", "seller", BigDecimal.TEN, PaymentType.MARKETPLACE_PURCHASE, " ", null));
        verifyNoInteractions(transferEngine);
    }

    @Test
    @DisplayName("Replayed payment returns the original receipt")
    void replayReturnsOriginalReceipt() {
        LedgerTransaction tx = payment(TransactionType.SERVICE_PAYMENT, "20.00", "0.02");
        Receipt original = receipt(tx.getId());
        when(transferEngine.execute(any())).thenReturn(new TransferResult(tx, true));
        when(receiptRepository.findByTransactionId(tx.getId()))
                .thenReturn(Optional.of(ReceiptEntity.fromDomain(original)));

        SettlementResult result = facade.pay("buyer", "seller", new BigDecimal("20"),
                PaymentType.SERVICE_PAYMENT, "svc-1", "buyer:k1");

        assertTrue(result.isReplayed());
        assertEquals(original.getReceiptId(), result.getReceipt().getReceiptId());
        verify(receiptRepository, never()).save(any());
    }

    @Test
    @DisplayName("Replay is refused when the key settled a different payment")
    void replayRejectsDifferentPayment() {
        LedgerTransaction tx = payment(TransactionType.SERVICE_PAYMENT, "20.00", "0.02");
        when(receiptRepository.findByTransactionId(tx.getId()))
                .thenReturn(Optional.of(ReceiptEntity.fromDomain(receipt(tx.getId()))));

        assertThrows(IllegalStateException.class, () -> facade.replay(tx, "buyer", "seller",
                new BigDecimal("20.00"), PaymentType.SERVICE_PAYMENT, "svc-2"));
        assertThrows(IllegalStateException.class, () -> facade.replay(tx, "buyer", "other",
                new BigDecimal("20.00"), PaymentType.SERVICE_PAYMENT, "svc-1"));
        assertThrows(IllegalStateException.class, () -> facade.replay(tx, "buyer", "seller",
                new BigDecimal("25.00"), PaymentType.SERVICE_PAYMENT, "svc-1"));
        assertThrows(IllegalStateException.class, () -> facade.replay(tx, "buyer", "seller",
                new BigDecimal("20.00"), PaymentType.MARKETPLACE_PURCHASE, "svc-1"));

        SettlementResult same = facade.replay(tx, "buyer", "seller",
                new BigDecimal("20"), PaymentType.SERVICE_PAYMENT, "svc-1");
        assertTrue(same.isReplayed());
    }

    @Test
    @DisplayName("Receipts are visible to buyer, seller and admins only")
    void receiptVisibility() {
        Receipt receipt = receipt(UUID.randomUUID());
        when(receiptRepository.findById(receipt.getReceiptId()))
                .thenReturn(Optional.of(ReceiptEntity.fromDomain(receipt)));

        assertEquals(receipt.getReceiptId(), facade.getReceipt("buyer", receipt.getReceiptId()).getReceiptId());
        assertNotNull(facade.getReceipt("seller", receipt.getReceiptId()));
        assertNotNull(facade.getReceipt("admin", receipt.getReceiptId()));
        assertThrows(UnauthorizedException.class, () -> facade.getReceipt("other", receipt.getReceiptId()));
        assertThrows(NotFoundException.class, () -> facade.getReceipt("buyer", UUID.randomUUID()));
    }

    private static LedgerTransaction payment(TransactionType type, String amount, String fee) {
        return LedgerTransaction.movement(type, AssetType.COIN, "buyer", "seller",
                new BigDecimal(amount), new BigDecimal(fee), null, null);
    }

    private static Receipt receipt(UUID transactionId) {
        return new Receipt(UUID.randomUUID(), transactionId, Instant.now(), PaymentType.SERVICE_PAYMENT,
                "svc-1", "buyer", "Buyer", "seller", "Seller",
                new BigDecimal("20.00"), new BigDecimal("0.02"), ReceiptStatus.COMPLETED);
    }

    private void givenUser(String userId, String name, boolean admin) {
        when(userDirectory.findById(userId))
                .thenReturn(Optional.of(new UserProfile(userId, name, userId + "@altyn.test", admin)));
    }
}
