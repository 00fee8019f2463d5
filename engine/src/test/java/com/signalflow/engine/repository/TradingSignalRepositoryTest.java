package com.signalflow.engine.repository;

import com.signalflow.engine.model.SignalStatus;
import com.signalflow.engine.model.TradingSignal;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
class TradingSignalRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-05T15:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private TradingSignalRepository signalRepository;

    private TradingSignal persist(String id, Instant generatedAt, SignalStatus status) {
        return entityManager.persistAndFlush(TradingSignal.builder()
                .id(id)
                .symbol("BTCUSDT")
                .direction(TradingSignal.Direction.BUY)
                .confidence(0.8)
                .generatedAt(generatedAt)
                .status(status)
                .build());
    }

    @Test
    void activeSignalsComeBackOldestFirst() {
        persist("repo-b", NOW, SignalStatus.ACTIVE);
        persist("repo-a", NOW.minusSeconds(120), SignalStatus.ACTIVE);
        persist("repo-c", NOW.minusSeconds(600), SignalStatus.REJECTED);

        assertThat(signalRepository.findByStatusOrderByGeneratedAtAsc(SignalStatus.ACTIVE))
                .extracting(TradingSignal::getId)
                .containsExactly("repo-a", "repo-b");
    }

    @Test
    void transitionOnlyLeavesActiveOnce() {
        persist("repo-t", NOW, SignalStatus.ACTIVE);

        int first = signalRepository.transition("repo-t", SignalStatus.ACTIVE, SignalStatus.REJECTED,
                "confidence_too_low", "0.30 below 0.60", NOW);
        int second = signalRepository.transition("repo-t", SignalStatus.ACTIVE, SignalStatus.FAILED,
                "execution_failed", "late", NOW.plusSeconds(5));

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        TradingSignal stored = signalRepository.findById("repo-t").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(SignalStatus.REJECTED);
        assertThat(stored.getRejectionReason()).isEqualTo("confidence_too_low");
        assertThat(stored.getProcessedAt()).isEqualTo(NOW);
    }

    @Test
    void staleQueryUsesCutoff() {
        persist("repo-old", NOW.minusSeconds(90_000), SignalStatus.ACTIVE);
        persist("repo-new", NOW.minusSeconds(60), SignalStatus.ACTIVE);

        assertThat(signalRepository.findByStatusAndGeneratedAtBefore(SignalStatus.ACTIVE, NOW.minusSeconds(86_400)))
                .extracting(TradingSignal::getId)
                .containsExactly("repo-old");
    }
}
