package com.flagship.altyn_ledger.api;

import com.flagship.altyn_ledger.api.dto.DividendPayoutResponse;
import com.flagship.altyn_ledger.api.dto.EmissionRequest;
import com.flagship.altyn_ledger.api.dto.ReconciliationResponse;
import com.flagship.altyn_ledger.api.dto.TransactionResponse;
import com.flagship.altyn_ledger.api.dto.TreasuryResponse;
import com.flagship.altyn_ledger.api.dto.WalletInitializationResponse;
import com.flagship.altyn_ledger.dividend.DividendDistributor;
import com.flagship.altyn_ledger.identity.UserProfile;
import com.flagship.altyn_ledger.treasury.EmissionService;
import com.flagship.altyn_ledger.treasury.TreasuryReportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

/**
 * Treasury reads and admin-only minting and distribution.
 * The admin check itself lives in the services so every entry point gets it.
 */
@RestController
@RequestMapping("/api/finance")
@RequiredArgsConstructor
public class AdminFinanceController {

    private final CallerResolver callerResolver;
    private final TreasuryReportService treasuryReportService;
    private final EmissionService emissionService;
    private final DividendDistributor dividendDistributor;

    @GetMapping("/treasury")
    public TreasuryResponse getTreasury(@RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        UserProfile caller = callerResolver.resolve(userId);
        return TreasuryResponse.from(treasuryReportService.getStats(caller.getUserId()));
    }

    @PostMapping("/admin/emission")
    public ResponseEntity<TransactionResponse> emit(@RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
                                                    @Valid @RequestBody EmissionRequest request) {
        UserProfile caller = callerResolver.resolve(userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(
                emissionService.emit(caller.getUserId(), request.getTargetUserId(),
                        request.getAmount(), request.getDescription())));
    }

    @PostMapping("/admin/initialize-tokens")
    public ResponseEntity<WalletInitializationResponse> initializeTokens(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId,
            @RequestParam("user_email") String userEmail,
            @RequestParam("token_amount") BigDecimal tokenAmount,
            @RequestParam(name = "coin_amount", required = false) BigDecimal coinAmount) {
        UserProfile caller = callerResolver.resolve(userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(WalletInitializationResponse.from(
                emissionService.initializeWallet(caller.getUserId(), userEmail, tokenAmount, coinAmount)));
    }

    @PostMapping("/admin/distribute-dividends")
    public ResponseEntity<DividendPayoutResponse> distributeDividends(
            @RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        UserProfile caller = callerResolver.resolve(userId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(DividendPayoutResponse.from(dividendDistributor.distribute(caller.getUserId())));
    }

    @GetMapping("/admin/reconciliation")
    public ReconciliationResponse reconcile(@RequestHeader(CallerResolver.USER_ID_HEADER) String userId) {
        UserProfile caller = callerResolver.resolve(userId);
        return ReconciliationResponse.from(treasuryReportService.reconcile(caller.getUserId()));
    }
}
