package com.flagship.altyn_ledger.api;

import com.flagship.altyn_ledger.api.dto.PaymentRequest;
import com.flagship.altyn_ledger.api.dto.PaymentResponse;
import com.flagship.altyn_ledger.api.dto.ReceiptResponse;
import com.flagship.altyn_ledger.identity.UserProfile;
import com.flagship.altyn_ledger.idempotency.IdempotencyService;
import com.flagship.altyn_ledger.settlement.PaymentType;
import com.flagship.altyn_ledger.settlement.SettlementFacade;
import com.flagship.altyn_ledger.settlement.SettlementResult;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;
import java.util.UUID;

/**
 * Marketplace and service payments, and receipt lookup.
 */
@RestController
@RequestMapping("/api/finance")
@RequiredArgsConstructor
public class SettlementController {

    private final CallerResolver callerResolver;
    private final SettlementFacade settlementFacade;
    private final IdempotencyService idempotencyService;

    @PostMapping("/marketplace/pay")
    public ResponseEntity<PaymentResponse> payForProduct(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
            @RequestHeader(FinanceController.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody PaymentRequest request) {
        return pay(userId, idempotencyKey, request, PaymentType.MARKETPLACE_PURCHASE);
    }

    @PostMapping("/services/pay")
    public ResponseEntity<PaymentResponse> payForService(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
            @RequestHeader(FinanceController.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody PaymentRequest request) {
        return pay(userId, idempotencyKey, request, PaymentType.SERVICE_PAYMENT);
    }

    @GetMapping("/receipts/{id}")
    public ReceiptResponse getReceipt(@RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
                                      @PathVariable("id") UUID receiptId) {
        UserProfile caller = callerResolver.resolve(userId);
        return ReceiptResponse.from(settlementFacade.getReceipt(caller.getUserId(), receiptId));
    }

    private ResponseEntity<PaymentResponse> pay(String userId, String idempotencyKey,
                                                PaymentRequest request, PaymentType paymentType) {
        UserProfile buyer = callerResolver.resolve(userId);
        String scopedKey = IdempotencyService.scope(buyer.getUserId(), idempotencyKey);

        Optional<LedgerTransaction> settled = idempotencyService.findSettled(scopedKey);
        if (settled.isPresent()) {
            return ResponseEntity.ok(PaymentResponse.from(settlementFacade.replay(settled.get(),
                    buyer.getUserId(), request.getSellerId(), request.getAmount(), paymentType,
                    request.getListingId())));
        }

        SettlementResult result = settlementFacade.pay(
                buyer.getUserId(),
                request.getSellerId(),
                request.getAmount(),
                paymentType,
                request.getListingId(),
                scopedKey);
        idempotencyService.remember(scopedKey, result.getTransaction().getId());

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(PaymentResponse.from(result));
    }
}
