package com.flagship.altyn_ledger.corporate;

import com.flagship.altyn_ledger.LedgerFixtures;
import com.flagship.altyn_ledger.error.InsufficientFundsException;
import com.flagship.altyn_ledger.error.NotFoundException;
import com.flagship.altyn_ledger.error.UnauthorizedException;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.WalletLedger;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transfer.TransferEngine;
import com.flagship.altyn_ledger.transfer.TransferResult;
import com.flagship.altyn_ledger.treasury.EmissionService;
import com.flagship.altyn_ledger.treasury.TreasuryReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.List;

import static com.flagship.altyn_ledger.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Organization wallets against a real database: opening, funding, payouts
 * and the history seen by organization admins.
 */
@SpringBootTest
@Testcontainers
class CorporateWalletServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Autowired
    private CorporateWalletService corporateWalletService;

    @Autowired
    private EmissionService emissionService;

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private WalletLedger walletLedger;

    @Autowired
    private TreasuryReportService reportService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        LedgerFixtures fixtures = new LedgerFixtures(jdbcTemplate);
        fixtures.reset();
        fixtures.user("alice", "Alice");
        fixtures.user("bob", "Bob");
        fixtures.user("carol", "Carol");
        fixtures.organization("acme", "Acme", "alice");
        fixtures.organization("globex", "Globex", "carol");

        emissionService.emit(ADMIN, "bob", new BigDecimal("1000.00"), "seed");
    }

    @Test
    @DisplayName("Organization admin opens the wallet once; reopening returns it unchanged")
    void openWallet() {
        printTestHeader("Open corporate wallet");

        CorporateWalletCreation first = corporateWalletService.openWallet("alice", "acme");
        CorporateWalletCreation second = corporateWalletService.openWallet("alice", "acme");

        assertTrue(first.isCreated());
        assertFalse(second.isCreated());
        assertEquals("org:acme", first.getWallet().getAccountId());
        assertEquals("Acme", first.getWallet().getOrganizationName());
        assertEquals(new BigDecimal("0.00"), first.getWallet().getCoinBalance());
        assertTrue(first.getWallet().isCallerIsAdmin());
        assertEquals("alice", second.getWallet().getCreatedBy());
        printSuccess("Wallet opened once");
    }

    @Test
    @DisplayName("Only organization admins open wallets; unknown organizations are not found")
    void openRequiresOrganizationAdmin() {
        assertThrows(UnauthorizedException.class, () -> corporateWalletService.openWallet("bob", "acme"));
        assertThrows(UnauthorizedException.class, () -> corporateWalletService.openWallet(ADMIN, "acme"));
        assertThrows(NotFoundException.class, () -> corporateWalletService.openWallet("alice", "initech"));
        assertTrue(corporateWalletService.listWallets("alice").stream().noneMatch(CorporateWalletSummary::isHasWallet));
    }

    @Test
    @DisplayName("Users fund the wallet by transfer; admins pay out with the 0.1% fee")
    void fundAndPayOut() {
        printTestHeader("Corporate payout");
        corporateWalletService.openWallet("alice", "acme");

        transferEngine.transfer("bob", "org:acme", AssetType.COIN, new BigDecimal("500.00"), "funding");
        assertEquals(new BigDecimal("499.50"), walletLedger.getBalance("org:acme", AssetType.COIN));

        TransferResult result = corporateWalletService.transfer(command("alice", "acme")
                .toUserId("carol")
                .amount(new BigDecimal("100.00"))
                .build());
        LedgerTransaction tx = result.getTransaction();
        printOutput("Payout", tx);

        assertFalse(result.isReplayed());
        assertEquals("org:acme", tx.getFromUserId());
        assertEquals(new BigDecimal("0.10"), tx.getFee());
        assertEquals("Corporate transfer from Acme", tx.getDescription());
        assertEquals(new BigDecimal("399.50"), walletLedger.getBalance("org:acme", AssetType.COIN));
        assertEquals(new BigDecimal("99.90"), walletLedger.getBalance("carol", AssetType.COIN));
        assertTrue(reportService.reconcile(ADMIN).isBalanced());
        printSuccess("Corporate funds conserved");
    }

    @Test
    @DisplayName("Transfers reach other organizations only once their wallet is open")
    void transferToOrganization() {
        corporateWalletService.openWallet("alice", "acme");
        transferEngine.transfer("bob", "org:acme", AssetType.COIN, new BigDecimal("500.00"), null);

        assertThrows(NotFoundException.class, () -> corporateWalletService.transfer(command("alice", "acme")
                .toOrganizationId("globex")
                .amount(new BigDecimal("200.00"))
                .build()));

        corporateWalletService.openWallet("carol", "globex");
        corporateWalletService.transfer(command("alice", "acme")
                .toOrganizationId("globex")
                .amount(new BigDecimal("200.00"))
                .description("Invoice 7")
                .build());

        assertEquals(new BigDecimal("299.50"), walletLedger.getBalance("org:acme", AssetType.COIN));
        assertEquals(new BigDecimal("199.80"), walletLedger.getBalance("org:globex", AssetType.COIN));
        assertTrue(reportService.reconcile(ADMIN).isBalanced());
    }

    @Test
    @DisplayName("Payouts need an organization admin and a covering balance")
    void payoutRejections() {
        corporateWalletService.openWallet("alice", "acme");
        transferEngine.transfer("bob", "org:acme", AssetType.COIN, new BigDecimal("10.00"), null);

        assertThrows(UnauthorizedException.class, () -> corporateWalletService.transfer(command("bob", "acme")
                .toUserId("bob")
                .amount(new BigDecimal("1.00"))
                .build()));
        assertThrows(InsufficientFundsException.class, () -> corporateWalletService.transfer(command("alice", "acme")
                .toUserId("bob")
                .amount(new BigDecimal("10.00"))
                .build()));
        assertThrows(NotFoundException.class, () -> corporateWalletService.transfer(command("carol", "globex")
                .toUserId("bob")
                .amount(new BigDecimal("1.00"))
                .build()));
        assertThrows(IllegalArgumentException.class,
                () -> transferEngine.transfer(ADMIN, "org:acme", AssetType.TOKEN, BigDecimal.ONE, null));

        assertEquals(new BigDecimal("9.99"), walletLedger.getBalance("org:acme", AssetType.COIN));
    }

    @Test
    @DisplayName("Repeated idempotency key replays the payout; a different payout under it conflicts")
    void idempotentPayout() {
        corporateWalletService.openWallet("alice", "acme");
        transferEngine.transfer("bob", "org:acme", AssetType.COIN, new BigDecimal("100.00"), null);

        TransferResult first = corporateWalletService.transfer(command("alice", "acme")
                .toUserId("carol").amount(new BigDecimal("20.00")).idempotencyKey("alice:p1").build());
        TransferResult again = corporateWalletService.transfer(command("alice", "acme")
                .toUserId("carol").amount(new BigDecimal("20.00")).idempotencyKey("alice:p1").build());

        assertTrue(again.isReplayed());
        assertEquals(first.getTransaction().getId(), again.getTransaction().getId());
        assertThrows(IllegalStateException.class, () -> corporateWalletService.transfer(command("alice", "acme")
                .toUserId("carol").amount(new BigDecimal("25.00")).idempotencyKey("alice:p1").build()));
        assertEquals(new BigDecimal("79.90"), walletLedger.getBalance("org:acme", AssetType.COIN));
    }

    @Test
    @DisplayName("History tags direction and counterparty; outsiders cannot read it")
    void history() {
        printTestHeader("Corporate history");
        corporateWalletService.openWallet("alice", "acme");
        corporateWalletService.openWallet("carol", "globex");
        transferEngine.transfer("bob", "org:acme", AssetType.COIN, new BigDecimal("500.00"), null);
        corporateWalletService.transfer(command("alice", "acme")
                .toUserId("bob").amount(new BigDecimal("50.00")).build());
        corporateWalletService.transfer(command("alice", "acme")
                .toOrganizationId("globex").amount(new BigDecimal("30.00")).build());

        CorporateTransactionPage page = corporateWalletService.getTransactions("alice", "acme", 10, 0);
        List<CorporateTransaction> entries = page.getTransactions();
        printOutput("Entries", entries.size());

        assertEquals(3, page.getTotal());
        assertEquals(CorporateTransaction.Direction.OUTGOING, entries.get(0).getDirection());
        assertEquals(CorporateTransaction.CounterpartyType.ORGANIZATION, entries.get(0).getCounterpartyType());
        assertEquals("Globex", entries.get(0).getCounterpartyName());
        assertEquals("Bob", entries.get(1).getCounterpartyName());
        assertEquals(CorporateTransaction.CounterpartyType.USER, entries.get(1).getCounterpartyType());
        assertEquals(CorporateTransaction.Direction.INCOMING, entries.get(2).getDirection());

        CorporateTransactionPage globex = corporateWalletService.getTransactions("carol", "globex", 10, 0);
        assertEquals(CorporateTransaction.Direction.INCOMING, globex.getTransactions().get(0).getDirection());
        assertEquals("Acme", globex.getTransactions().get(0).getCounterpartyName());

        assertThrows(UnauthorizedException.class, () -> corporateWalletService.getTransactions("bob", "acme", 10, 0));
        assertEquals(3, corporateWalletService.getTransactions(ADMIN, "acme", 10, 0).getTotal());
        assertFalse(corporateWalletService.getWallet(ADMIN, "acme").isCallerIsAdmin());
        printSuccess("History attributed");
    }

    @Test
    @DisplayName("Listing shows administered organizations only, with or without a wallet")
    void listWallets() {
        corporateWalletService.openWallet("alice", "acme");
        transferEngine.transfer("bob", "org:acme", AssetType.COIN, new BigDecimal("100.00"), null);

        List<CorporateWalletSummary> alice = corporateWalletService.listWallets("alice");
        List<CorporateWalletSummary> carol = corporateWalletService.listWallets("carol");

        assertEquals(1, alice.size());
        assertTrue(alice.get(0).isHasWallet());
        assertEquals(new BigDecimal("99.90"), alice.get(0).getCoinBalance());
        assertEquals("globex", carol.get(0).getOrganizationId());
        assertFalse(carol.get(0).isHasWallet());
        assertNull(carol.get(0).getCoinBalance());
        assertTrue(corporateWalletService.listWallets("bob").isEmpty());
        assertThrows(NotFoundException.class, () -> corporateWalletService.getWallet("carol", "globex"));
    }

    private static CorporateTransferCommand.CorporateTransferCommandBuilder command(String callerId,
                                                                                  String organizationId) {
        return CorporateTransferCommand.builder()
                .callerId(callerId)
                .organizationId(organizationId);
    }
}
