package com.flagship.altyn_ledger.corporate;

import com.flagship.altyn_ledger.error.NotFoundException;
import com.flagship.altyn_ledger.error.UnauthorizedException;
import com.flagship.altyn_ledger.exchange.ExchangeRateProvider;
import com.flagship.altyn_ledger.identity.AdminGuard;
import com.flagship.altyn_ledger.identity.Organization;
import com.flagship.altyn_ledger.identity.OrganizationDirectory;
import com.flagship.altyn_ledger.identity.UserDirectory;
import com.flagship.altyn_ledger.idempotency.IdempotencyService;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.WalletLedger;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transaction.TransactionLog;
import com.flagship.altyn_ledger.transfer.TransferCommand;
import com.flagship.altyn_ledger.transfer.TransferEngine;
import com.flagship.altyn_ledger.transfer.TransferResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Wallets owned by organizations.
 *
 * Only an organization's admins open its wallet and move money out of it;
 * its admins and platform admins may read it. Anyone can pay into it with an
 * ordinary transfer. Corporate wallets hold COIN only, and outgoing transfers
 * go through {@link TransferEngine} with the usual fee.
 */
@Service
@Slf4j
public class CorporateWalletService {

    private final OrganizationDirectory organizationDirectory;
    private final CorporateWalletRepository corporateWalletRepository;
    private final WalletLedger walletLedger;
    private final TransactionLog transactionLog;
    private final UserDirectory userDirectory;
    private final AdminGuard adminGuard;
    private final TransferEngine transferEngine;
    private final IdempotencyService idempotencyService;
    private final ExchangeRateProvider exchangeRateProvider;
    private final int maxPageSize;

    public CorporateWalletService(OrganizationDirectory organizationDirectory,
                                  CorporateWalletRepository corporateWalletRepository,
                                  WalletLedger walletLedger,
                                  TransactionLog transactionLog,
                                  UserDirectory userDirectory,
                                  AdminGuard adminGuard,
                                  TransferEngine transferEngine,
                                  IdempotencyService idempotencyService,
                                  ExchangeRateProvider exchangeRateProvider,
                                  @Value("${altyn.transactions.max-page-size:100}") int maxPageSize) {
        this.organizationDirectory = organizationDirectory;
        this.corporateWalletRepository = corporateWalletRepository;
        this.walletLedger = walletLedger;
        this.transactionLog = transactionLog;
        this.userDirectory = userDirectory;
        this.adminGuard = adminGuard;
        this.transferEngine = transferEngine;
        this.idempotencyService = idempotencyService;
        this.exchangeRateProvider = exchangeRateProvider;
        this.maxPageSize = maxPageSize;
    }

    /**
     * Opens the organization's wallet. Opening it twice returns the existing
     * wallet with {@code created = false}.
     *
     * @throws NotFoundException if the organization is unknown
     * @throws UnauthorizedException if the caller does not administer the organization
     */
    @Transactional
    public CorporateWalletCreation openWallet(String callerId, String organizationId) {
        Organization organization = organizationDirectory.require(organizationId);
        requireOrganizationAdmin(organization, callerId, "open corporate wallet");

        boolean created = corporateWalletRepository.insertIfAbsent(
                CorporateWallet.open(organization.getOrganizationId(), callerId));
        CorporateWallet wallet = requireWallet(organization);
        if (created) {
            log.info("Corporate wallet opened: organizationId={}, accountId={}, openedBy={}",
                    organization.getOrganizationId(), wallet.getAccountId(), callerId);
        } else {
            log.info("Corporate wallet already exists: organizationId={}", organization.getOrganizationId());
        }
        return new CorporateWalletCreation(view(organization, wallet, callerId), created);
    }

    /**
     * Every organization the caller administers, with or without a wallet.
     * Empty for callers who administer none.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<CorporateWalletSummary> listWallets(String callerId) {
        List<Organization> organizations = organizationDirectory.findAdministeredBy(callerId);
        Map<String, CorporateWallet> wallets = corporateWalletRepository.findByOrganizationIds(
                organizations.stream().map(Organization::getOrganizationId).toList());

        List<CorporateWalletSummary> summaries = new ArrayList<>(organizations.size());
        for (Organization organization : organizations) {
            CorporateWallet wallet = wallets.get(organization.getOrganizationId());
            summaries.add(new CorporateWalletSummary(
                    organization.getOrganizationId(),
                    organization.getName(),
                    wallet != null,
                    wallet != null ? walletLedger.getBalance(wallet.getAccountId(), AssetType.COIN) : null));
        }
        return summaries;
    }

    /**
     * @throws NotFoundException if the organization or its wallet is unknown
     * @throws UnauthorizedException if the caller is neither an organization admin nor a platform admin
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public CorporateWalletView getWallet(String callerId, String organizationId) {
        Organization organization = organizationDirectory.require(organizationId);
        requireReader(organization, callerId);
        return view(organization, requireWallet(organization), callerId);
    }

    /**
     * Pays out of the organization's wallet. With an idempotency key, a
     * repeated request returns the original transaction, provided it asks for
     * the same movement.
     *
     * @throws NotFoundException if the organization, its wallet or the recipient is unknown
     * @throws UnauthorizedException if the caller does not administer the organization
     * @throws com.flagship.altyn_ledger.error.InsufficientFundsException if the wallet cannot cover the amount
     * @throws IllegalStateException if the idempotency key settled a different movement
     */
    public TransferResult transfer(CorporateTransferCommand command) {
        Organization organization = organizationDirectory.require(command.getOrganizationId());
        requireOrganizationAdmin(organization, command.getCallerId(), "corporate transfer");
        CorporateWallet wallet = requireWallet(organization);

        TransferCommand transfer = TransferCommand.builder()
                .fromUserId(wallet.getAccountId())
                .toUserId(recipientAccount(command))
                .assetType(AssetType.COIN)
                .amount(command.getAmount())
                .description(command.getDescription() != null && !command.getDescription().isBlank()
                        ? command.getDescription()
                        : "Corporate transfer from " + organization.getName())
                .idempotencyKey(command.getIdempotencyKey())
                .build();

        if (command.getIdempotencyKey() != null) {
            Optional<LedgerTransaction> settled = idempotencyService.findSettled(command.getIdempotencyKey());
            if (settled.isPresent()) {
                return new TransferResult(transferEngine.requireSameMovement(settled.get(), transfer), true);
            }
        }

        TransferResult result = transferEngine.execute(transfer);
        if (command.getIdempotencyKey() != null) {
            idempotencyService.remember(command.getIdempotencyKey(), result.getTransaction().getId());
        }
        log.info("Corporate transfer settled: organizationId={}, initiatedBy={}, to={}, amount={}, transactionId={}",
                organization.getOrganizationId(), command.getCallerId(), transfer.getToUserId(),
                result.getTransaction().getAmount(), result.getTransaction().getId());
        return result;
    }

    /**
     * Wallet history newest first, each entry tagged with direction and counterparty.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public CorporateTransactionPage getTransactions(String callerId, String organizationId, int limit, int offset) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }
        Organization organization = organizationDirectory.require(organizationId);
        requireReader(organization, callerId);
        String accountId = requireWallet(organization).getAccountId();

        int pageSize = Math.min(limit, maxPageSize);
        List<LedgerTransaction> entries = transactionLog.findForUser(accountId, pageSize, offset);

        Set<String> userIds = new HashSet<>();
        Set<String> organizationIds = new HashSet<>();
        for (LedgerTransaction tx : entries) {
            String counterparty = counterpartyOf(tx, accountId);
            if (CorporateAccounts.isCorporate(counterparty)) {
                organizationIds.add(CorporateAccounts.organizationId(counterparty));
            } else if (counterparty != null) {
                userIds.add(counterparty);
            }
        }
        Map<String, String> userNames = userDirectory.displayNames(userIds);
        Map<String, String> organizationNames = organizationDirectory.names(organizationIds);

        List<CorporateTransaction> transactions = new ArrayList<>(entries.size());
        for (LedgerTransaction tx : entries) {
            String counterparty = counterpartyOf(tx, accountId);
            CorporateTransaction.Direction direction = accountId.equals(tx.getFromUserId())
                    ? CorporateTransaction.Direction.OUTGOING
                    : CorporateTransaction.Direction.INCOMING;
            if (counterparty == null) {
                transactions.add(new CorporateTransaction(tx, direction, null, "Treasury",
                        CorporateTransaction.CounterpartyType.TREASURY));
            } else if (CorporateAccounts.isCorporate(counterparty)) {
                transactions.add(new CorporateTransaction(tx, direction, counterparty,
                        organizationNames.get(CorporateAccounts.organizationId(counterparty)),
                        CorporateTransaction.CounterpartyType.ORGANIZATION));
            } else {
                transactions.add(new CorporateTransaction(tx, direction, counterparty,
                        userNames.get(counterparty), CorporateTransaction.CounterpartyType.USER));
            }
        }
        return new CorporateTransactionPage(organization.getOrganizationId(), transactions,
                transactionLog.countForUser(accountId), pageSize, offset);
    }

    private CorporateWalletView view(Organization organization, CorporateWallet wallet, String callerId) {
        BigDecimal balance = walletLedger.getBalance(wallet.getAccountId(), AssetType.COIN);
        Map<String, BigDecimal> coinValues = new LinkedHashMap<>();
        for (String currency : exchangeRateProvider.getRates().keySet()) {
            coinValues.put(currency, exchangeRateProvider.convert(balance, currency));
        }
        return new CorporateWalletView(
                organization.getOrganizationId(),
                organization.getName(),
                wallet.getAccountId(),
                balance,
                coinValues,
                organizationDirectory.isAdmin(organization.getOrganizationId(), callerId),
                wallet.getCreatedBy(),
                wallet.getCreatedAt());
    }

    private String recipientAccount(CorporateTransferCommand command) {
        boolean toOrganization = command.getToOrganizationId() != null && !command.getToOrganizationId().isBlank();
        boolean toUser = command.getToUserId() != null && !command.getToUserId().isBlank();
        if (toOrganization == toUser) {
            throw new IllegalArgumentException("Exactly one of a user or an organization recipient is required");
        }
        return toOrganization ? CorporateAccounts.accountId(command.getToOrganizationId()) : command.getToUserId();
    }

    private CorporateWallet requireWallet(Organization organization) {
        return corporateWalletRepository.findByOrganizationId(organization.getOrganizationId())
                .orElseThrow(() -> new NotFoundException(
                        "Corporate wallet not found for organization: " + organization.getOrganizationId()));
    }

    private void requireOrganizationAdmin(Organization organization, String callerId, String operation) {
        if (!organizationDirectory.isAdmin(organization.getOrganizationId(), callerId)) {
            log.warn("Rejected corporate operation: operation={}, organizationId={}, callerId={}",
                    operation, organization.getOrganizationId(), callerId);
            throw new UnauthorizedException(
                    "Organization admin capability required for " + operation + ": " + organization.getOrganizationId());
        }
    }

    private void requireReader(Organization organization, String callerId) {
        if (!organizationDirectory.isAdmin(organization.getOrganizationId(), callerId) && !adminGuard.isAdmin(callerId)) {
            log.warn("Rejected corporate wallet read: organizationId={}, callerId={}",
                    organization.getOrganizationId(), callerId);
            throw new UnauthorizedException(
                    "Corporate wallet " + organization.getOrganizationId() + " is visible to its admins only");
        }
    }

    private static String counterpartyOf(LedgerTransaction tx, String accountId) {
        return accountId.equals(tx.getFromUserId()) ? tx.getToUserId() : tx.getFromUserId();
    }
}
