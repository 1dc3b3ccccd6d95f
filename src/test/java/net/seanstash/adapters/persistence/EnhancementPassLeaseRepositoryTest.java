package net.seanstash.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class EnhancementPassLeaseRepositoryTest extends AbstractPostgresRepositoryTest {

    @Autowired
    private EnhancementPassLeaseRepository leaseRepository;

    @Test
    void should_ExcludeOtherHolders_When_LeaseActive() {
        assertThat(leaseRepository.tryAcquire("enhancer-a", Duration.ofMinutes(10))).isTrue();

        assertThat(leaseRepository.tryAcquire("enhancer-b", Duration.ofMinutes(10))).isFalse();
        assertThat(leaseRepository.tryAcquire("enhancer-a", Duration.ofMinutes(10))).isTrue();
    }

    @Test
    void should_AllowTakeover_When_LeaseReleased() {
        leaseRepository.tryAcquire("enhancer-a", Duration.ofMinutes(10));

        leaseRepository.release("enhancer-a");

        assertThat(leaseRepository.tryAcquire("enhancer-b", Duration.ofMinutes(10))).isTrue();
    }

    @Test
    void should_AllowTakeover_When_LeaseExpired() {
        leaseRepository.tryAcquire("enhancer-a", Duration.ofMinutes(10));
        jdbcTemplate.update("UPDATE enhancement_pass_lease SET expires_at = NOW() - INTERVAL '1 second'");

        assertThat(leaseRepository.tryAcquire("enhancer-b", Duration.ofMinutes(10))).isTrue();
    }

    @Test
    void should_IgnoreRelease_When_CallerIsNotHolder() {
        leaseRepository.tryAcquire("enhancer-a", Duration.ofMinutes(10));

        leaseRepository.release("enhancer-b");

        assertThat(leaseRepository.tryAcquire("enhancer-b", Duration.ofMinutes(10))).isFalse();
    }
}
