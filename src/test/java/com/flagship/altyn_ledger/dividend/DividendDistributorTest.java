package com.flagship.altyn_ledger.dividend;

import com.flagship.altyn_ledger.LedgerFixtures;
import com.flagship.altyn_ledger.error.ErrorCode;
import com.flagship.altyn_ledger.error.NothingToDistributeException;
import com.flagship.altyn_ledger.error.UnauthorizedException;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.WalletLedger;
import com.flagship.altyn_ledger.outbox.OutboxService;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import com.flagship.altyn_ledger.transaction.TransactionLog;
import com.flagship.altyn_ledger.transaction.TransactionType;
import com.flagship.altyn_ledger.transfer.TransferEngine;
import com.flagship.altyn_ledger.treasury.EmissionService;
import com.flagship.altyn_ledger.treasury.TreasuryAccount;
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
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.flagship.altyn_ledger.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers
class DividendDistributorTest {

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
    private DividendDistributor distributor;

    @Autowired
    private DividendPayoutRepository payoutRepository;

    @Autowired
    private EmissionService emissionService;

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private WalletLedger walletLedger;

    @Autowired
    private TreasuryAccount treasuryAccount;

    @Autowired
    private TransactionLog transactionLog;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private TreasuryReportService reportService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        LedgerFixtures fixtures = new LedgerFixtures(jdbcTemplate);
        fixtures.reset();
        fixtures.user("payer", "Payer");
        fixtures.user("payee", "Payee");
        fixtures.user("holder1", "Holder One");
        fixtures.user("holder2", "Holder Two");
    }

    @Test
    @DisplayName("1000.00 in fees split 70/30 pays 700.00 and 300.00 and empties the pool")
    void distributesProRata() {
        printTestHeader("Pro-rata dividend distribution");

        // Given: 1,000,000.00 COIN moved once, leaving 1000.00 in fees
        emissionService.emit(ADMIN, "payer", new BigDecimal("1000000.00"), "seed");
        transferEngine.transfer("payer", "payee", AssetType.COIN, new BigDecimal("1000000.00"), null);
        emissionService.issueTokens(ADMIN, "holder1", new BigDecimal("70"), "equity");
        emissionService.issueTokens(ADMIN, "holder2", new BigDecimal("30"), "equity");
        printInput("Collected fees", treasuryAccount.current().getCollectedFees());

        // When
        DividendPayout payout = distributor.distribute(ADMIN);
        printOutput("Payout", payout);

        // Then
        assertEquals(new BigDecimal("1000.00"), payout.getTotalDistributed());
        assertEquals(2, payout.getHoldersCount());
        assertEquals(new BigDecimal("700.00"), walletLedger.getBalance("holder1", AssetType.COIN));
        assertEquals(new BigDecimal("300.00"), walletLedger.getBalance("holder2", AssetType.COIN));
        assertEquals(new BigDecimal("0.00"), treasuryAccount.current().getCollectedFees());

        List<LedgerTransaction> dividends = transactionLog.findRecentByType(TransactionType.DIVIDEND, 10);
        assertEquals(2, dividends.size());
        dividends.forEach(tx -> {
            assertNull(tx.getFromUserId());
            assertEquals(0, tx.getFee().signum());
        });
        assertEquals(1, outboxService.eventsFor(payout.getId()).size());

        DividendPayout stored = payoutRepository.findById(payout.getId()).orElseThrow();
        assertEquals(2, stored.getDistributionDetails().size());
        assertEquals("holder1", stored.getDistributionDetails().get(0).getUserId());
        assertNotNull(stored.getDistributionDetails().get(0).getTransactionId());
        assertTrue(reportService.reconcile(ADMIN).isBalanced());
        printSuccess("Pool distributed exactly and treasury emptied");
    }

    @Test
    @DisplayName("Empty fee pool is nothing to distribute")
    void emptyPoolIsRejected() {
        emissionService.issueTokens(ADMIN, "holder1", new BigDecimal("10"), "equity");

        NothingToDistributeException e = assertThrows(NothingToDistributeException.class,
                () -> distributor.distribute(ADMIN));

        assertEquals(ErrorCode.NOTHING_TO_DISTRIBUTE, e.getErrorCode());
        assertEquals(0, payoutRepository.count());
        assertEquals(new BigDecimal("0.00"), walletLedger.getBalance("holder1", AssetType.COIN));
    }

    @Test
    @DisplayName("Fees without TOKEN holders are nothing to distribute")
    void noHoldersIsRejected() {
        emissionService.emit(ADMIN, "payer", new BigDecimal("100.00"), "seed");
        transferEngine.transfer("payer", "payee", AssetType.COIN, new BigDecimal("100.00"), null);

        assertThrows(NothingToDistributeException.class, () -> distributor.distribute(ADMIN));
        assertEquals(new BigDecimal("0.10"), treasuryAccount.current().getCollectedFees());
    }

    @Test
    @DisplayName("Only admins distribute dividends")
    void nonAdminIsUnauthorized() {
        emissionService.emit(ADMIN, "payer", new BigDecimal("100.00"), "seed");
        transferEngine.transfer("payer", "payee", AssetType.COIN, new BigDecimal("100.00"), null);
        emissionService.issueTokens(ADMIN, "holder1", new BigDecimal("1"), "equity");

        assertThrows(UnauthorizedException.class, () -> distributor.distribute("holder1"));
        assertEquals(new BigDecimal("0.10"), treasuryAccount.current().getCollectedFees());
        assertEquals(0, payoutRepository.count());
    }

    @Test
    @DisplayName("Uneven split hands the rounding residual to the largest holder")
    void roundingResidualGoesToLargestHolder() {
        // 10.00 fee pool, three equal holders
        emissionService.emit(ADMIN, "payer", new BigDecimal("10000.00"), "seed");
        transferEngine.transfer("payer", "payee", AssetType.COIN, new BigDecimal("10000.00"), null);
        emissionService.issueTokens(ADMIN, "holder1", new BigDecimal("1"), "equity");
        emissionService.issueTokens(ADMIN, "holder2", new BigDecimal("1"), "equity");
        emissionService.issueTokens(ADMIN, "payer", new BigDecimal("1"), "equity");

        DividendPayout payout = distributor.distribute(ADMIN);

        assertEquals(new BigDecimal("10.00"), payout.getTotalDistributed());
        assertEquals(new BigDecimal("3.34"), walletLedger.getBalance("holder1", AssetType.COIN));
        assertEquals(new BigDecimal("3.33"), walletLedger.getBalance("holder2", AssetType.COIN));
        assertEquals(new BigDecimal("3.33"), walletLedger.getBalance("payer", AssetType.COIN));
        assertEquals(new BigDecimal("0.00"), treasuryAccount.current().getCollectedFees());
        assertTrue(reportService.reconcile(ADMIN).isBalanced());
    }

    @Test
    @DisplayName("Distribution serializes with concurrent transfers: every fee is paid out or left in the pool")
    void distributionSerializesWithConcurrentTransfers() throws Exception {
        printTestHeader("Dividend run during concurrent transfers");

        // Given: 1.00 in fees, a single holder, and 999.00 COIN for the payee to send back
        emissionService.emit(ADMIN, "payer", new BigDecimal("1000.00"), "seed");
        transferEngine.transfer("payer", "payee", AssetType.COIN, new BigDecimal("1000.00"), null);
        emissionService.issueTokens(ADMIN, "holder1", new BigDecimal("1"), "equity");

        int transferCount = 10;
        ExecutorService executor = Executors.newFixedThreadPool(transferCount + 1);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LedgerTransaction>> transfers = new ArrayList<>();

        // When: ten 10.00 transfers (0.01 fee each) race one dividend run
        for (int i = 0; i < transferCount; i++) {
            transfers.add(executor.submit(() -> {
                start.await();
                return transferEngine.transfer("payee", "payer", AssetType.COIN, new BigDecimal("10.00"), null);
            }));
        }
        Future<DividendPayout> run = executor.submit(() -> {
            start.await();
            return distributor.distribute(ADMIN);
        });
        start.countDown();

        DividendPayout payout = run.get(30, TimeUnit.SECONDS);
        for (Future<LedgerTransaction> transfer : transfers) {
            transfer.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        // Then: the payout holds exactly the fees committed before it, the pool exactly the ones after
        long dividendSequence = transactionLog.findRecentByType(TransactionType.DIVIDEND, 10).get(0).getSequenceNumber();
        long settledBefore = transactionLog.findRecentByType(TransactionType.TRANSFER, 20).stream()
                .filter(tx -> tx.getFromUserId().equals("payee"))
                .filter(tx -> tx.getSequenceNumber() < dividendSequence)
                .count();
        printOutput("Transfers settled before the run", settledBefore);
        printOutput("Payout", payout.getTotalDistributed());

        BigDecimal feePerTransfer = new BigDecimal("0.01");
        assertEquals(new BigDecimal("1.00").add(feePerTransfer.multiply(BigDecimal.valueOf(settledBefore))),
                payout.getTotalDistributed());
        assertEquals(feePerTransfer.multiply(BigDecimal.valueOf(transferCount - settledBefore)),
                treasuryAccount.current().getCollectedFees());
        assertEquals(payout.getTotalDistributed(), walletLedger.getBalance("holder1", AssetType.COIN));
        assertEquals(new BigDecimal("899.00"), walletLedger.getBalance("payee", AssetType.COIN));
        assertTrue(reportService.reconcile(ADMIN).isBalanced());
        printSuccess("No fee lost or paid twice under contention");
    }
}
