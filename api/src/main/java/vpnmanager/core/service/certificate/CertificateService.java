package vpnmanager.core.service.certificate;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import vpnmanager.core.config.CertificateConfig;
import vpnmanager.core.exception.AccessDeniedException;
import vpnmanager.core.exception.DuplicateSubmissionException;
import vpnmanager.core.exception.PskException;
import vpnmanager.core.exception.ResourceNotFoundException;
import vpnmanager.core.exception.UpstreamException;
import vpnmanager.core.exception.ValidationException;
import vpnmanager.core.exception.VpnManagerException;
import vpnmanager.core.model.auth.Action;
import vpnmanager.core.model.auth.DenyReason;
import vpnmanager.core.model.certificate.Certificate;
import vpnmanager.core.model.certificate.CertificateType;
import vpnmanager.core.model.certificate.IssuanceAuthorization;
import vpnmanager.core.model.certificate.IssuanceRequest;
import vpnmanager.core.model.certificate.IssuedCertificate;
import vpnmanager.core.model.certificate.RevocationReason;
import vpnmanager.core.model.certificate.SignedCertificate;
import vpnmanager.core.model.common.ValidationResult;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.in.CertificateManagement;
import vpnmanager.core.port.out.CertificateAuthority;
import vpnmanager.core.port.out.CertificateRepository;
import vpnmanager.core.port.out.SecurityMetrics;
import vpnmanager.core.service.auth.AccessControlService;
import vpnmanager.core.util.Fingerprints;

/**
 * Certificate issuance, lookup and revocation.
 *
 * <p>Issuance signs through the {@link CertificateAuthority} port with a bounded wait
 * and is never retried. The certificate row and its transparency log entry are
 * written in one repository call. Revocation is a conditional update so concurrent
 * revocations produce exactly one log entry.
 */
@ApplicationScoped
public class CertificateService implements CertificateManagement {

    private static final Logger LOG = Logger.getLogger(CertificateService.class);
    private static final String CA_NAME = "certificate authority";

    private final CertificateAuthority authority;
    private final CertificateRepository repository;
    private final AccessControlService accessControl;
    private final DuplicateSubmissionGuard guard;
    private final SecurityMetrics metrics;
    private final CertificateConfig config;

    @Inject
    public CertificateService(
            CertificateAuthority authority,
            CertificateRepository repository,
            AccessControlService accessControl,
            DuplicateSubmissionGuard guard,
            SecurityMetrics metrics,
            CertificateConfig config) {
        this.authority = authority;
        this.repository = repository;
        this.accessControl = accessControl;
        this.guard = guard;
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public Uni<IssuedCertificate> issue(IssuanceRequest request, IssuanceAuthorization authorization) {
        try {
            checkCredentials(request, authorization);
            requireValid(SubjectValidator.validateCommonName(request.commonName()));
            requireValid(SubjectValidator.validateEmail(request.email()));
        } catch (VpnManagerException e) {
            return Uni.createFrom().failure(e);
        }

        final var principal = authorization.principal();
        final var guardKey = principal + "|" + request.type() + "|" + request.commonName().toLowerCase(Locale.ROOT);
        if (!guard.tryAcquire(guardKey)) {
            LOG.warnf("Rejected duplicate %s issuance for %s", request.type(), principal);
            metrics.recordDuplicateSubmission();
            return Uni.createFrom().failure(new DuplicateSubmissionException());
        }

        final var timeout = config.signingTimeout();
        return authority
                .sign(request, validityFor(request.type()))
                .ifNoItem()
                .after(timeout)
                .failWith(() -> UpstreamException.timeout(CA_NAME))
                .onFailure(e -> !(e instanceof VpnManagerException))
                .transform(e -> {
                    LOG.errorf(e, "Signing failed for %s certificate", request.type());
                    return UpstreamException.rejected(CA_NAME, "The certificate authority could not sign the request");
                })
                .flatMap(signed -> record(signed, request, authorization))
                .onTermination()
                .invoke(() -> guard.release(guardKey));
    }

    private Uni<IssuedCertificate> record(
            SignedCertificate signed, IssuanceRequest request, IssuanceAuthorization authorization) {
        final var certificate = new Certificate(
                Fingerprints.of(signed.der()),
                request.type(),
                signed.subjectDn(),
                signed.issuerDn(),
                request.commonName(),
                authorization.session().map(Session::subject).orElse(null),
                signed.serialNumber(),
                signed.notBefore(),
                signed.notAfter(),
                authorization.principal(),
                Instant.now(),
                null,
                null);

        return repository.recordIssuance(certificate).map(entry -> {
            LOG.infof(
                    "Issued %s certificate %s for %s (log #%d)",
                    certificate.type(),
                    Fingerprints.abbreviate(certificate.fingerprint()),
                    authorization.principal(),
                    entry.sequence());
            metrics.recordIssuance(certificate.type());
            return new IssuedCertificate(
                    certificate, signed.certificatePem(), signed.privateKeyPem(), authority.caCertificatePem());
        });
    }

    @Override
    public Uni<Certificate> get(String fingerprint, Session session) {
        return lookup(fingerprint).map(certificate -> {
            accessControl.require(session, Action.READ_CERTIFICATE, certificate);
            return certificate;
        });
    }

    @Override
    public Uni<Certificate> revoke(String fingerprint, RevocationReason reason, Session session) {
        return lookup(fingerprint).flatMap(certificate -> {
            accessControl.require(session, Action.REVOKE_CERTIFICATE, certificate);
            if (certificate.isRevoked()) {
                LOG.debugf("Certificate %s already revoked", Fingerprints.abbreviate(certificate.fingerprint()));
                return Uni.createFrom().item(certificate);
            }
            final var effectiveReason = reason == null ? RevocationReason.UNSPECIFIED : reason;
            return repository
                    .markRevoked(certificate.fingerprint(), Instant.now(), effectiveReason, session.subject())
                    .flatMap(changed -> {
                        if (changed) {
                            LOG.infof(
                                    "Revoked %s certificate %s by %s (%s)",
                                    certificate.type(),
                                    Fingerprints.abbreviate(certificate.fingerprint()),
                                    session.subject(),
                                    effectiveReason);
                            metrics.recordRevocation(certificate.type());
                        }
                        return lookup(certificate.fingerprint());
                    });
        });
    }

    private Uni<Certificate> lookup(String fingerprint) {
        final var parsed = Fingerprints.parse(fingerprint);
        if (parsed.isEmpty()) {
            return Uni.createFrom().failure(ResourceNotFoundException.malformedCertificateId());
        }
        return repository.findByFingerprint(parsed.get()).map(opt -> opt.orElseThrow(
                ResourceNotFoundException::certificate));
    }

    private void checkCredentials(IssuanceRequest request, IssuanceAuthorization authorization) {
        final var session = authorization.session();
        final var psk = authorization.psk();
        if (session.isPresent() == psk.isPresent()) {
            throw ValidationException.malformed("authorization", "Exactly one authentication mode is required");
        }
        if (session.isPresent()) {
            if (request.type() != CertificateType.CLIENT) {
                throw new AccessDeniedException(DenyReason.INSUFFICIENT_ROLE);
            }
            accessControl.require(session.get(), Action.ISSUE_CLIENT_CERTIFICATE);
            return;
        }
        final var key = psk.get();
        if (key.revoked()) {
            throw new PskException(PskException.Reason.INVALID);
        }
        if (key.isExpired(Instant.now())) {
            throw new PskException(PskException.Reason.EXPIRED);
        }
        if (key.pskType().certificateType() != request.type()) {
            throw new PskException(PskException.Reason.WRONG_TYPE);
        }
    }

    private static void requireValid(ValidationResult result) {
        if (result instanceof ValidationResult.Invalid invalid) {
            throw ValidationException.from(invalid);
        }
    }

    private Duration validityFor(CertificateType type) {
        return switch (type) {
            case CLIENT -> config.validity().client();
            case SERVER -> config.validity().server();
            case COMPUTER -> config.validity().computer();
        };
    }
}
