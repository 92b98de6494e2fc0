package com.flagship.altyn_ledger.api;

import com.flagship.altyn_ledger.api.dto.CorporateTransactionPageResponse;
import com.flagship.altyn_ledger.api.dto.CorporateTransferRequest;
import com.flagship.altyn_ledger.api.dto.CorporateWalletCreationResponse;
import com.flagship.altyn_ledger.api.dto.CorporateWalletListResponse;
import com.flagship.altyn_ledger.api.dto.CorporateWalletResponse;
import com.flagship.altyn_ledger.api.dto.TransactionResponse;
import com.flagship.altyn_ledger.corporate.CorporateTransferCommand;
import com.flagship.altyn_ledger.corporate.CorporateWalletCreation;
import com.flagship.altyn_ledger.corporate.CorporateWalletService;
import com.flagship.altyn_ledger.identity.UserDirectory;
import com.flagship.altyn_ledger.identity.UserProfile;
import com.flagship.altyn_ledger.idempotency.IdempotencyService;
import com.flagship.altyn_ledger.transfer.TransferResult;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Organization wallets: opening, reads and payouts by organization admins.
 */
@RestController
@RequestMapping("/api/finance")
@RequiredArgsConstructor
public class CorporateFinanceController {

    private final CallerResolver callerResolver;
    private final CorporateWalletService corporateWalletService;
    private final UserDirectory userDirectory;

    @PostMapping("/corporate-wallet")
    public ResponseEntity<CorporateWalletCreationResponse> openWallet(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
            @RequestParam("organization_id") String organizationId) {
        UserProfile caller = callerResolver.resolve(userId);
        CorporateWalletCreation creation = corporateWalletService.openWallet(caller.getUserId(), organizationId);
        HttpStatus status = creation.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(CorporateWalletCreationResponse.from(creation));
    }

    @GetMapping("/corporate/wallets")
    public CorporateWalletListResponse listWallets(@RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        UserProfile caller = callerResolver.resolve(userId);
        return CorporateWalletListResponse.from(corporateWalletService.listWallets(caller.getUserId()));
    }

    @GetMapping("/corporate/wallet/{organizationId}")
    public CorporateWalletResponse getWallet(@RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
                                             @PathVariable("organizationId") String organizationId) {
        UserProfile caller = callerResolver.resolve(userId);
        return CorporateWalletResponse.from(corporateWalletService.getWallet(caller.getUserId(), organizationId));
    }

    @PostMapping("/corporate/transfer")
    public ResponseEntity<TransactionResponse> transfer(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
            @RequestHeader(FinanceController.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody CorporateTransferRequest request) {
        UserProfile caller = callerResolver.resolve(userId);

        String toUserId = request.getToUserEmail() != null && !request.getToUserEmail().isBlank()
                ? userDirectory.requireByEmail(request.getToUserEmail()).getUserId()
                : request.getToUserId();
        TransferResult result = corporateWalletService.transfer(CorporateTransferCommand.builder()
                .callerId(caller.getUserId())
                .organizationId(request.getOrganizationId())
                .toUserId(toUserId)
                .toOrganizationId(request.getToOrganizationId())
                .amount(request.getAmount())
                .description(request.getDescription())
                .idempotencyKey(IdempotencyService.scope(caller.getUserId(), idempotencyKey))
                .build());

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TransactionResponse.from(result.getTransaction()));
    }

    @GetMapping("/corporate/transactions/{organizationId}")
    public CorporateTransactionPageResponse getTransactions(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
            @PathVariable("organizationId") String organizationId,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {
        UserProfile caller = callerResolver.resolve(userId);
        return CorporateTransactionPageResponse.from(
                corporateWalletService.getTransactions(caller.getUserId(), organizationId, limit, offset));
    }
}
