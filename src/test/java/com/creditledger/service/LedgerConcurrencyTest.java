package com.creditledger.service;

import com.creditledger.config.LendingProperties;
import com.creditledger.model.LedgerStats;
import com.creditledger.repository.BorrowerProfileRepository;
import com.creditledger.repository.LedgerStatsRepository;
import com.creditledger.repository.LoanApplicationRepository;
import com.creditledger.repository.OutboxEventRepository;
import com.creditledger.result.LendingResult;
import com.creditledger.security.Caller;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Concurrent writers against a freshly started ledger.
 *
 * Not transactional: every call commits on its own thread, so the test
 * removes what it wrote and resets the counters afterwards.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Ledger Concurrency Integration Tests")
class LedgerConcurrencyTest {

    private static final int WRITERS = 8;

    @Autowired
    private ProfileService profileService;

    @Autowired
    private LoanLifecycleService lifecycleService;

    @Autowired
    private LedgerStatsRepository ledgerStatsRepository;

    @Autowired
    private BorrowerProfileRepository profileRepository;

    @Autowired
    private LoanApplicationRepository applicationRepository;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private LendingProperties lendingProperties;

    @AfterEach
    void tearDown() {
        outboxEventRepository.deleteAll();
        applicationRepository.deleteAll();
        profileRepository.deleteAll();
        ledgerStatsRepository.save(LedgerStats.initial(lendingProperties.getModelVersion()));
    }

    @Test
    @DisplayName("Should have the stats row in place before the first request")
    void shouldSeedStatsAtStartup() {
        assertThat(ledgerStatsRepository.findById(LedgerStats.SINGLETON_ID)).isPresent();
        assertThat(ledgerStatsRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should accept simultaneous first profile registrations")
    void shouldAcceptConcurrentFirstWriters() throws Exception {
        List<LendingResult<?>> results = runConcurrently(i -> () -> profileService.registerProfile(
                Caller.borrower("racer-" + i), new ProfileCommand(720, 100_000, 20_000, 5, 0, 18, 20)));

        assertThat(results).allSatisfy(result -> assertThat(result.isOk()).isTrue());
        assertThat(profileRepository.count()).isEqualTo(WRITERS);
        assertThat(ledgerStatsRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should hand out distinct consecutive ids to simultaneous applications")
    void shouldSerializeConcurrentApplications() throws Exception {
        for (int i = 0; i < WRITERS; i++) {
            profileService.registerProfile(Caller.borrower("racer-" + i),
                    new ProfileCommand(720, 100_000, 20_000, 5, 0, 18, 20)).getOrThrow();
        }
        long before = ledgerStatsRepository.findById(LedgerStats.SINGLETON_ID).orElseThrow().getLastApplicationId();

        List<LendingResult<?>> results = runConcurrently(i -> () -> lifecycleService.apply(
                Caller.borrower("racer-" + i), 10_000, "Car", 12));

        assertThat(results).allSatisfy(result -> assertThat(result.isOk()).isTrue());
        List<Long> ids = results.stream().map(result -> (Long) result.value()).sorted().toList();
        assertThat(ids).containsExactlyElementsOf(
                IntStream.rangeClosed(1, WRITERS).mapToObj(n -> before + n).toList());
        assertThat(ledgerStatsRepository.findById(LedgerStats.SINGLETON_ID).orElseThrow().getLastApplicationId())
                .isEqualTo(before + WRITERS);
    }

    private List<LendingResult<?>> runConcurrently(WriterFactory factory) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(WRITERS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<LendingResult<?>>> futures = new ArrayList<>();
            for (int i = 0; i < WRITERS; i++) {
                Callable<LendingResult<?>> writer = factory.writer(i);
                Callable<LendingResult<?>> gated = () -> {
                    start.await();
                    return writer.call();
                };
                futures.add(executor.submit(gated));
            }
            start.countDown();

            List<LendingResult<?>> results = new ArrayList<>();
            for (Future<LendingResult<?>> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface WriterFactory {
        Callable<LendingResult<?>> writer(int index);
    }
}
