package com.flagship.altyn_ledger.wallet;

import com.flagship.altyn_ledger.LedgerFixtures;
import com.flagship.altyn_ledger.dividend.DividendDistributor;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.WalletLedger;
import com.flagship.altyn_ledger.transaction.TransactionType;
import com.flagship.altyn_ledger.transfer.TransferEngine;
import com.flagship.altyn_ledger.treasury.EmissionService;
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

import static com.flagship.altyn_ledger.LedgerFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers
class WalletQueryServiceTest {

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
    private WalletQueryService walletQueryService;

    @Autowired
    private EmissionService emissionService;

    @Autowired
    private TransferEngine transferEngine;

    @Autowired
    private DividendDistributor dividendDistributor;

    @Autowired
    private WalletLedger walletLedger;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        LedgerFixtures fixtures = new LedgerFixtures(jdbcTemplate);
        fixtures.reset();
        fixtures.user("alice", "Alice");
        fixtures.user("bob", "Bob");

        // 1.00 in fees, TOKEN split 3:1
        emissionService.emit(ADMIN, "alice", new BigDecimal("1000.00"), "seed");
        transferEngine.transfer("alice", "bob", AssetType.COIN, new BigDecimal("1000.00"), null);
        emissionService.issueTokens(ADMIN, "alice", new BigDecimal("3"), "equity");
        emissionService.issueTokens(ADMIN, "bob", new BigDecimal("1"), "equity");
    }

    @Test
    @DisplayName("Wallet shows equity share and projected dividend")
    void walletView() {
        WalletView wallet = walletQueryService.getWallet("alice");

        assertEquals("Alice", wallet.getUserName());
        assertEquals(new BigDecimal("0.00"), wallet.getCoinBalance());
        assertEquals(new BigDecimal("3.0000"), wallet.getTokenBalance());
        assertEquals(new BigDecimal("75.0000"), wallet.getTokenPercentage());
        assertEquals(new BigDecimal("0.75"), wallet.getPendingDividends());
    }

    @Test
    @DisplayName("Repeated reads without a mutation in between return identical results")
    void readsAreRepeatable() {
        WalletView first = walletQueryService.getWallet("bob");
        BigDecimal firstCoin = walletLedger.getBalance("bob", AssetType.COIN);
        BigDecimal firstToken = walletLedger.getBalance("bob", AssetType.TOKEN);
        PortfolioView firstPortfolio = walletQueryService.getPortfolio("bob");

        WalletView second = walletQueryService.getWallet("bob");

        assertEquals(first, second);
        assertEquals(firstCoin, walletLedger.getBalance("bob", AssetType.COIN));
        assertEquals(firstToken, walletLedger.getBalance("bob", AssetType.TOKEN));
        assertEquals(firstPortfolio, walletQueryService.getPortfolio("bob"));
        assertEquals(new BigDecimal("999.00"), firstCoin);

        transferEngine.transfer("bob", "alice", AssetType.COIN, new BigDecimal("100.00"), null);

        assertNotEquals(first, walletQueryService.getWallet("bob"));
        assertEquals(new BigDecimal("899.00"), walletLedger.getBalance("bob", AssetType.COIN));
    }

    @Test
    @DisplayName("Portfolio converts COIN and tracks dividends received")
    void portfolioView() {
        printTestHeader("Portfolio after dividend run");

        dividendDistributor.distribute(ADMIN);
        PortfolioView portfolio = walletQueryService.getPortfolio("bob");
        printOutput("Portfolio", portfolio);

        assertEquals(new BigDecimal("999.25"), portfolio.getCoinBalance());
        assertEquals(new BigDecimal("999.25"), portfolio.getCoinValues().get("USD"));
        assertEquals(new BigDecimal("92430.63"), portfolio.getCoinValues().get("RUB"));
        assertEquals(new BigDecimal("0.25"), portfolio.getDividendsReceived());
        assertEquals(new BigDecimal("0.00"), portfolio.getPendingDividends());
        printSuccess("Portfolio reflects the payout immediately");
    }

    @Test
    @DisplayName("History is newest first and paginated")
    void transactionHistory() {
        dividendDistributor.distribute(ADMIN);

        TransactionPage page = walletQueryService.getTransactions("alice", 2, 0);

        assertEquals(4, page.getTotal());
        assertEquals(2, page.getTransactions().size());
        assertEquals(TransactionType.DIVIDEND, page.getTransactions().get(0).getType());

        TransactionPage rest = walletQueryService.getTransactions("alice", 2, 2);
        assertEquals(2, rest.getTransactions().size());
        assertEquals(TransactionType.EMISSION, rest.getTransactions().get(1).getType());

        assertEquals(100, walletQueryService.getTransactions("alice", 1000, 0).getLimit());
        assertThrows(IllegalArgumentException.class, () -> walletQueryService.getTransactions("alice", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> walletQueryService.getTransactions("alice", 10, -1));
    }

    @Test
    @DisplayName("Token holders are ranked by balance")
    void tokenHolders() {
        TokenHolderList list = walletQueryService.getTokenHolders(10);

        assertEquals(2, list.getHoldersCount());
        assertEquals(new BigDecimal("4.0000"), list.getTotalSupply());
        TokenHolderList.Holder top = list.getHolders().get(0);
        assertEquals(1, top.getRank());
        assertEquals("alice", top.getUserId());
        assertEquals("Alice", top.getUserName());
        assertEquals(new BigDecimal("75.0000"), top.getPercentage());
        assertEquals("bob", list.getHolders().get(1).getUserId());
    }
}
