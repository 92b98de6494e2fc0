package com.flagship.altyn_ledger.wallet;

import com.flagship.altyn_ledger.exchange.ExchangeRateProvider;
import com.flagship.altyn_ledger.identity.UserDirectory;
import com.flagship.altyn_ledger.identity.UserProfile;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import com.flagship.altyn_ledger.ledger.Wallet;
import com.flagship.altyn_ledger.ledger.WalletLedger;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transaction.TransactionLog;
import com.flagship.altyn_ledger.transaction.TransactionType;
import com.flagship.altyn_ledger.treasury.Treasury;
import com.flagship.altyn_ledger.treasury.TreasuryAccount;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only wallet views for UI and reporting callers.
 *
 * Reads hit the same primary database as the write path, so a view taken
 * after a settled transfer always reflects it. Each view is read in one
 * REPEATABLE_READ snapshot, so balances and treasury figures agree.
 */
@Service
public class WalletQueryService {

    private final WalletLedger walletLedger;
    private final TreasuryAccount treasuryAccount;
    private final TransactionLog transactionLog;
    private final UserDirectory userDirectory;
    private final ExchangeRateProvider exchangeRateProvider;
    private final int maxPageSize;

    public WalletQueryService(WalletLedger walletLedger,
                              TreasuryAccount treasuryAccount,
                              TransactionLog transactionLog,
                              UserDirectory userDirectory,
                              ExchangeRateProvider exchangeRateProvider,
                              @Value("${altyn.transactions.max-page-size:100}") int maxPageSize) {
        this.walletLedger = walletLedger;
        this.treasuryAccount = treasuryAccount;
        this.transactionLog = transactionLog;
        this.userDirectory = userDirectory;
        this.exchangeRateProvider = exchangeRateProvider;
        this.maxPageSize = maxPageSize;
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public WalletView getWallet(String userId) {
        Wallet wallet = walletLedger.getWallet(userId);
        Treasury treasury = treasuryAccount.current();
        return new WalletView(
                userId,
                displayName(userId),
                wallet.getCoinBalance(),
                wallet.getTokenBalance(),
                LedgerAmounts.percentage(wallet.getTokenBalance(), treasury.getTotalTokenSupply()),
                pendingDividends(wallet, treasury));
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public PortfolioView getPortfolio(String userId) {
        Wallet wallet = walletLedger.getWallet(userId);
        Treasury treasury = treasuryAccount.current();

        Map<String, BigDecimal> coinValues = new LinkedHashMap<>();
        for (String currency : exchangeRateProvider.getRates().keySet()) {
            coinValues.put(currency, exchangeRateProvider.convert(wallet.getCoinBalance(), currency));
        }

        return new PortfolioView(
                userId,
                displayName(userId),
                wallet.getCoinBalance(),
                coinValues,
                wallet.getTokenBalance(),
                LedgerAmounts.percentage(wallet.getTokenBalance(), treasury.getTotalTokenSupply()),
                transactionLog.sumReceived(userId, TransactionType.DIVIDEND, AssetType.COIN),
                pendingDividends(wallet, treasury));
    }

    /**
     * History where the user is sender or recipient, newest first.
     * {@code limit} is capped at the configured maximum page size.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public TransactionPage getTransactions(String userId, int limit, int offset) {
        int pageSize = pageSize(limit);
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }
        List<LedgerTransaction> transactions = transactionLog.findForUser(userId, pageSize, offset);
        return new TransactionPage(transactions, transactionLog.countForUser(userId), pageSize, offset);
    }

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public TokenHolderList getTokenHolders(int limit) {
        List<Wallet> top = walletLedger.findTopTokenHolders(pageSize(limit));
        BigDecimal supply = treasuryAccount.current().getTotalTokenSupply();
        Map<String, String> names = userDirectory.displayNames(top.stream().map(Wallet::getUserId).toList());

        List<TokenHolderList.Holder> holders = new ArrayList<>(top.size());
        int rank = 1;
        for (Wallet wallet : top) {
            holders.add(new TokenHolderList.Holder(
                    rank++,
                    wallet.getUserId(),
                    names.get(wallet.getUserId()),
                    wallet.getTokenBalance(),
                    LedgerAmounts.percentage(wallet.getTokenBalance(), supply)));
        }
        return new TokenHolderList(holders, supply, walletLedger.countTokenHolders());
    }

    // Projected share of the current fee pool if dividends were paid now.
    private static BigDecimal pendingDividends(Wallet wallet, Treasury treasury) {
        if (!wallet.holdsTokens()) {
            return LedgerAmounts.zero(AssetType.COIN);
        }
        return LedgerAmounts.proRata(treasury.getCollectedFees(), wallet.getTokenBalance(), treasury.getTotalTokenSupply());
    }

    private int pageSize(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        return Math.min(limit, maxPageSize);
    }

    private String displayName(String userId) {
        return userDirectory.findById(userId).map(UserProfile::getDisplayName).orElse(null);
    }
}
