package ru.perminov.ledger.service;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import ru.perminov.ledger.LedgerTestSupport;
import ru.perminov.ledger.dto.CashTransactionDto;
import ru.perminov.ledger.dto.CashTransactionRequest;
import ru.perminov.ledger.dto.HoldingDto;
import ru.perminov.ledger.dto.MovementRequest;
import ru.perminov.ledger.dto.UpdateAccountRequest;
import ru.perminov.ledger.exception.InsufficientFundsException;
import ru.perminov.ledger.exception.InsufficientQuantityException;
import ru.perminov.ledger.model.Holding;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Racing writers against one account must see each other's committed state, so the sufficiency
 * checks hold no matter how the requests interleave.
 */
class MovementConcurrencyTest extends LedgerTestSupport {

    private static final int THREADS = 8;

    @Autowired
    private HoldingMovementService movementService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    void testConcurrentBuysNeverOverspend() throws Exception {
        Long accountId = account(user("CB").getId(), "trading").getId();
        deposit(accountId, "1000");
        HoldingDto holding = holding(accountId, investment(baseCurrencyId(), "Sierra Steel").getId(), "0", "0");

        AtomicInteger rejected = new AtomicInteger();
        runConcurrently(() -> {
            try {
                movementService.process(holding.getId(), new MovementRequest("buy", "2024-01-02",
                        BigDecimal.TEN, new BigDecimal("150"), null, null));
            } catch (InsufficientFundsException e) {
                rejected.incrementAndGet();
            }
        });

        // 1000 covers six buys of 150
        assertEquals(THREADS - 6, rejected.get());
        assertEquals(1_000_000L, cashScaled(accountId));
        Holding stored = holdingRepository.findById(holding.getId()).orElseThrow();
        assertEquals(600_000L, stored.getQuantity());
        assertEquals(150_000L, stored.getAverageCost());
        assertEquals(6, movementRepository.countByHoldingId(holding.getId()));
        assertEquals(7, cashTransactionRepository.countByAccountId(accountId));
    }

    @Test
    void testConcurrentSellsNeverOversell() throws Exception {
        Long accountId = account(user("CS").getId(), "trading").getId();
        HoldingDto holding = holding(accountId, investment(baseCurrencyId(), "Tango Textiles").getId(), "30", "1");

        AtomicInteger rejected = new AtomicInteger();
        runConcurrently(() -> {
            try {
                movementService.process(holding.getId(), new MovementRequest("sell", "2024-01-02",
                        BigDecimal.TEN, BigDecimal.TEN, null, null));
            } catch (InsufficientQuantityException e) {
                rejected.incrementAndGet();
            }
        });

        assertEquals(THREADS - 3, rejected.get());
        assertEquals(0L, holdingRepository.findById(holding.getId()).orElseThrow().getQuantity());
        assertEquals(300_000L, cashScaled(accountId));
    }

    @Test
    void testCashEntriesAndMovementsSerializeOnTheAccount() throws Exception {
        Long accountId = account(user("CM").getId(), "trading").getId();
        deposit(accountId, "400");
        HoldingDto holding = holding(accountId, investment(baseCurrencyId(), "Uniform Group").getId(), "0", "0");

        AtomicInteger next = new AtomicInteger();
        runConcurrently(() -> {
            if (next.getAndIncrement() % 2 == 0) {
                movementService.process(holding.getId(), new MovementRequest("buy", "2024-01-02",
                        BigDecimal.ONE, new BigDecimal("50"), null, null));
            } else {
                cashLedgerService.record(accountId, new CashTransactionRequest("withdrawal", "2024-01-02",
                        new BigDecimal("50"), null));
            }
        });

        assertEquals(0L, cashScaled(accountId));
        assertEquals(40_000L, holdingRepository.findById(holding.getId()).orElseThrow().getQuantity());
        assertEquals(1 + THREADS, cashTransactionRepository.countByAccountId(accountId));
    }

    @Test
    void testAccountUpdateKeepsConcurrentDeposit() throws Exception {
        Long accountId = account(user("AU").getId(), "trading").getId();
        deposit(accountId, "100");

        ExecutorService executor = Executors.newSingleThreadExecutor();
        AtomicReference<Future<?>> concurrentDeposit = new AtomicReference<>();
        try {
            new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
                accountService.update(accountId, new UpdateAccountRequest("RENAMED", new BigDecimal("25")));
                concurrentDeposit.set(executor.submit(() -> deposit(accountId, "50")));
                try {
                    // let the deposit reach the account row before this transaction commits
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            concurrentDeposit.get().get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1_500_000L, cashScaled(accountId));
        CashTransactionDto latest = cashLedgerService.history(accountId, 1, 0).get(0);
        assertAmount("150", latest.getBalanceAfter());
        assertEquals("RENAMED", accountService.get(accountId).getAccountRef());
    }

    private static void runConcurrently(Runnable task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    task.run();
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
