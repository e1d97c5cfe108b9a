package vpnmanager.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import vpnmanager.core.model.certificate.Certificate;
import vpnmanager.core.model.certificate.CertificateFilter;
import vpnmanager.core.model.certificate.CertificateType;
import vpnmanager.core.model.certificate.PageRequest;
import vpnmanager.core.model.certificate.RevocationReason;
import vpnmanager.core.model.certificate.TransparencyEvent;
import vpnmanager.fixtures.Fixtures;

@DisplayName("InMemoryCertificateRepository")
class InMemoryCertificateRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private InMemoryCertificateRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryCertificateRepository();
    }

    @Nested
    @DisplayName("recordIssuance()")
    class RecordIssuanceTests {

        @Test
        @DisplayName("should assign increasing sequence numbers")
        void shouldAssignSequenceNumbers() {
            var first = repository.recordIssuance(Fixtures.certificate("a", "alice")).await().atMost(TIMEOUT);
            var second = repository.recordIssuance(Fixtures.certificate("b", "alice")).await().atMost(TIMEOUT);

            assertEquals(1, first.sequence());
            assertEquals(2, second.sequence());
            assertEquals(TransparencyEvent.ISSUED, first.event());
        }

        @Test
        @DisplayName("should reject a duplicate fingerprint")
        void shouldRejectDuplicateFingerprint() {
            repository.recordIssuance(Fixtures.certificate("a", "alice")).await().atMost(TIMEOUT);

            assertThrows(IllegalStateException.class,
                    () -> repository.recordIssuance(Fixtures.certificate("a", "alice")).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should log the issuance time rather than the backdated validity start")
        void shouldLogIssuanceTime() {
            var issuedAt = T0.plusSeconds(120);
            var certificate = issuedJustAfterMidnight("late", issuedAt);

            var entry = repository.recordIssuance(certificate).await().atMost(TIMEOUT);

            assertEquals(issuedAt, entry.occurredAt());
        }
    }

    @Nested
    @DisplayName("markRevoked()")
    class MarkRevokedTests {

        @Test
        @DisplayName("should revoke once and log once")
        void shouldRevokeOnce() {
            var certificate = Fixtures.certificate("a", "alice");
            repository.recordIssuance(certificate).await().atMost(TIMEOUT);

            var first = repository.markRevoked(certificate.fingerprint(), T0, RevocationReason.KEY_COMPROMISE, "alice")
                    .await().atMost(TIMEOUT);
            var second = repository.markRevoked(certificate.fingerprint(), T0, RevocationReason.SUPERSEDED, "root")
                    .await().atMost(TIMEOUT);

            assertTrue(first);
            assertFalse(second);
            var stored = repository.findByFingerprint(certificate.fingerprint()).await().atMost(TIMEOUT).orElseThrow();
            assertTrue(stored.isRevoked());
            assertEquals(RevocationReason.KEY_COMPROMISE, stored.revocationReason());
            assertEquals(2, repository.events(new PageRequest(1, 10)).await().atMost(TIMEOUT).totalItems());
        }

        @Test
        @DisplayName("should return false for an unknown fingerprint")
        void shouldReturnFalseForUnknown() {
            var result = repository.markRevoked(Fixtures.fingerprint("nope"), T0, RevocationReason.UNSPECIFIED, "x")
                    .await().atMost(TIMEOUT);

            assertFalse(result);
        }
    }

    @Nested
    @DisplayName("query()")
    class QueryTests {

        @BeforeEach
        void seed() {
            repository.recordIssuance(Fixtures.certificate("alice-1", CertificateType.CLIENT, "alice", T0))
                    .await().atMost(TIMEOUT);
            repository.recordIssuance(Fixtures.certificate("bob-1", CertificateType.CLIENT, "bob", T0.plusSeconds(60)))
                    .await().atMost(TIMEOUT);
            repository.recordIssuance(Fixtures.certificate("gw", CertificateType.SERVER, null, T0.plusSeconds(120)))
                    .await().atMost(TIMEOUT);
        }

        @Test
        @DisplayName("should return newest first")
        void shouldReturnNewestFirst() {
            var page = repository.query(CertificateFilter.none(), new PageRequest(1, 10)).await().atMost(TIMEOUT);

            assertEquals(List.of("gw", "bob-1", "alice-1"),
                    page.items().stream().map(c -> c.commonName()).toList());
        }

        @Test
        @DisplayName("should apply the filter before paging")
        void shouldFilterBeforePaging() {
            var filter = CertificateFilter.ownedBy("alice");

            var page = repository.query(filter, new PageRequest(1, 1)).await().atMost(TIMEOUT);

            assertEquals(1, page.totalItems());
            assertEquals("alice-1", page.items().get(0).commonName());
        }

        @Test
        @DisplayName("should filter dates on the issuance day, not the validity start")
        void shouldFilterDatesOnIssuanceDay() {
            repository.recordIssuance(issuedJustAfterMidnight("late", T0.plusSeconds(120))).await().atMost(TIMEOUT);
            var issuanceDay = LocalDate.of(2024, 3, 1);
            var fromIssuanceDay = new CertificateFilter(
                    Optional.empty(), Optional.of("late"), Optional.of(issuanceDay), Optional.empty(), true,
                    Optional.empty());
            var untilDayBefore = new CertificateFilter(
                    Optional.empty(), Optional.of("late"), Optional.empty(), Optional.of(issuanceDay.minusDays(1)),
                    true, Optional.empty());

            assertEquals(1, repository.query(fromIssuanceDay, new PageRequest(1, 10)).await().atMost(TIMEOUT)
                    .totalItems());
            assertEquals(0, repository.query(untilDayBefore, new PageRequest(1, 10)).await().atMost(TIMEOUT)
                    .totalItems());
        }

        @Test
        @DisplayName("should page through results")
        void shouldPageThroughResults() {
            var page = repository.query(CertificateFilter.none(), new PageRequest(2, 2)).await().atMost(TIMEOUT);

            assertEquals(3, page.totalItems());
            assertEquals(1, page.items().size());
            assertFalse(page.hasNext());
        }
    }

    /** Validity starts five minutes before issuance, on the previous UTC day. */
    private static Certificate issuedJustAfterMidnight(String seed, Instant issuedAt) {
        var base = Fixtures.certificate(seed, CertificateType.CLIENT, "carol", issuedAt);
        return new Certificate(
                base.fingerprint(),
                base.type(),
                base.subjectDn(),
                base.issuerDn(),
                base.commonName(),
                base.ownerSubject(),
                base.serialNumber(),
                issuedAt.minus(Duration.ofMinutes(5)),
                base.notAfter(),
                base.issuedBy(),
                issuedAt,
                null,
                null);
    }
}
