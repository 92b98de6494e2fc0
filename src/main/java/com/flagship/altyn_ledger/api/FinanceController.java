package com.flagship.altyn_ledger.api;

import com.flagship.altyn_ledger.api.dto.ExchangeRatesResponse;
import com.flagship.altyn_ledger.api.dto.PortfolioResponse;
import com.flagship.altyn_ledger.api.dto.TokenHoldersResponse;
import com.flagship.altyn_ledger.api.dto.TransactionPageResponse;
import com.flagship.altyn_ledger.api.dto.TransactionResponse;
import com.flagship.altyn_ledger.api.dto.TransferRequest;
import com.flagship.altyn_ledger.api.dto.WalletResponse;
import com.flagship.altyn_ledger.corporate.CorporateAccounts;
import com.flagship.altyn_ledger.exchange.ExchangeRateProvider;
import com.flagship.altyn_ledger.identity.UserDirectory;
import com.flagship.altyn_ledger.identity.UserProfile;
import com.flagship.altyn_ledger.idempotency.IdempotencyService;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transfer.TransferCommand;
import com.flagship.altyn_ledger.transfer.TransferEngine;
import com.flagship.altyn_ledger.transfer.TransferResult;
import com.flagship.altyn_ledger.wallet.WalletQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Wallet reads, exchange rates and transfers to users or corporate wallets.
 *
 * POST /transfer is idempotent: repeating a request with the same
 * Idempotency-Key returns the original transaction and moves nothing.
 */
@RestController
@RequestMapping("/api/finance")
@RequiredArgsConstructor
@Slf4j
public class FinanceController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CallerResolver callerResolver;
    private final WalletQueryService walletQueryService;
    private final ExchangeRateProvider exchangeRateProvider;
    private final TransferEngine transferEngine;
    private final IdempotencyService idempotencyService;
    private final UserDirectory userDirectory;

    @GetMapping("/exchange-rates")
    public ExchangeRatesResponse getExchangeRates() {
        return new ExchangeRatesResponse(ExchangeRateProvider.BASE_CURRENCY, exchangeRateProvider.getRates());
    }

    @GetMapping("/wallet")
    public WalletResponse getWallet(@RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        UserProfile caller = callerResolver.resolve(userId);
        return WalletResponse.from(walletQueryService.getWallet(caller.getUserId()));
    }

    @GetMapping("/portfolio")
    public PortfolioResponse getPortfolio(@RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        UserProfile caller = callerResolver.resolve(userId);
        return PortfolioResponse.from(walletQueryService.getPortfolio(caller.getUserId()));
    }

    @GetMapping("/transactions")
    public TransactionPageResponse getTransactions(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
            @RequestParam(name = "limit", defaultValue = "20") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {
        UserProfile caller = callerResolver.resolve(userId);
        return TransactionPageResponse.from(walletQueryService.getTransactions(caller.getUserId(), limit, offset));
    }

    @GetMapping("/token-holders")
    public TokenHoldersResponse getTokenHolders(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
            @RequestParam(name = "limit", defaultValue = "20") int limit) {
        callerResolver.resolve(userId);
        return TokenHoldersResponse.from(walletQueryService.getTokenHolders(limit));
    }

    @PostMapping("/transfer")
    public ResponseEntity<TransactionResponse> transfer(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody TransferRequest request) {

        UserProfile caller = callerResolver.resolve(userId);
        String scopedKey = IdempotencyService.scope(caller.getUserId(), idempotencyKey);

        String recipientId = recipientOf(request);
        TransferCommand command = TransferCommand.builder()
                .fromUserId(caller.getUserId())
                .toUserId(recipientId)
                .assetType(request.getAssetType())
                .amount(request.getAmount())
                .description(request.getDescription())
                .idempotencyKey(scopedKey)
                .build();

        Optional<LedgerTransaction> settled = idempotencyService.findSettled(scopedKey);
        if (settled.isPresent()) {
            LedgerTransaction original = transferEngine.requireSameMovement(settled.get(), command);
            log.info("Idempotency key already settled, returning original transfer: transactionId={}",
                    original.getId());
            return ResponseEntity.ok(TransactionResponse.from(original));
        }

        TransferResult result = transferEngine.execute(command);
        idempotencyService.remember(scopedKey, result.getTransaction().getId());

        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(TransactionResponse.from(result.getTransaction()));
    }

    private String recipientOf(TransferRequest request) {
        if (request.getToOrganizationId() != null && !request.getToOrganizationId().isBlank()) {
            return CorporateAccounts.accountId(request.getToOrganizationId());
        }
        if (request.getToUserId() != null && !request.getToUserId().isBlank()) {
            return request.getToUserId();
        }
        return userDirectory.requireByEmail(request.getToUserEmail()).getUserId();
    }
}
