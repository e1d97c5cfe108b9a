package vpnmanager.core.service.psk;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import vpnmanager.core.config.PskConfig;
import vpnmanager.core.exception.PskException;
import vpnmanager.core.exception.ResourceNotFoundException;
import vpnmanager.core.exception.ValidationException;
import vpnmanager.core.model.auth.Action;
import vpnmanager.core.model.psk.Psk;
import vpnmanager.core.model.psk.PskCreateResult;
import vpnmanager.core.model.psk.PskType;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.in.PskManagement;
import vpnmanager.core.port.out.PskRepository;
import vpnmanager.core.port.out.SecurityMetrics;
import vpnmanager.core.service.auth.AccessControlService;
import vpnmanager.core.service.auth.SecureTokenGenerator;
import vpnmanager.core.util.SecureHash;

/**
 * Service for managing pre-shared keys used by unattended CLI clients.
 *
 * <p>Handles key generation, hashing, validation, and revocation. Keys are
 * stored as SHA-256 hashes; the plaintext is only returned once at creation
 * and never written to logs.
 */
@ApplicationScoped
public class PskService implements PskManagement {

    private static final Logger LOG = Logger.getLogger(PskService.class);
    private static final int MAX_DESCRIPTION_LENGTH = 255;
    private static final int MAX_TEMPLATE_SET_LENGTH = 64;
    private static final int MAX_CANDIDATE_LENGTH = 256;

    private final PskRepository repository;
    private final AccessControlService accessControl;
    private final SecureTokenGenerator tokens;
    private final SecurityMetrics metrics;
    private final PskConfig config;

    @Inject
    public PskService(
            PskRepository repository,
            AccessControlService accessControl,
            SecureTokenGenerator tokens,
            SecurityMetrics metrics,
            PskConfig config) {
        this.repository = repository;
        this.accessControl = accessControl;
        this.tokens = tokens;
        this.metrics = metrics;
        this.config = config;
    }

    @Override
    public Uni<PskCreateResult> create(
            String description, PskType type, String templateSet, Duration ttl, Session admin) {
        accessControl.require(admin, Action.MANAGE_PSK);
        validateDescription(description);
        if (type == null) {
            throw ValidationException.malformed("psk_type", "PSK type must be 'server' or 'computer'");
        }
        if (templateSet != null && templateSet.length() > MAX_TEMPLATE_SET_LENGTH) {
            throw new ValidationException(
                    ValidationException.Reason.TOO_LONG, "template_set", "Template set name is too long");
        }
        validateTtl(ttl);

        final var plaintext = tokens.secret();
        final var now = Instant.now();
        final var psk = Psk.builder(tokens.shortId(), SecureHash.sha256Hex(plaintext))
                .description(description.trim())
                .pskType(type)
                .templateSet(templateSet == null || templateSet.isBlank() ? config.defaultTemplateSet() : templateSet)
                .createdBy(admin.subject())
                .createdAt(now)
                .expiresAt(ttl != null ? now.plus(ttl) : null)
                .revoked(false)
                .build();

        return repository.save(psk).map(v -> {
            LOG.infof("PSK %s (%s) created by %s", psk.id(), type.wireName(), admin.subject());
            return new PskCreateResult(psk, plaintext);
        });
    }

    @Override
    public Uni<List<Psk>> list(Session admin) {
        accessControl.require(admin, Action.MANAGE_PSK);
        return repository.findAll().map(keys -> keys.stream()
                .sorted(Comparator.comparing(Psk::createdAt).reversed())
                .map(Psk::redacted)
                .toList());
    }

    @Override
    public Uni<Psk> get(String id, Session admin) {
        accessControl.require(admin, Action.MANAGE_PSK);
        return find(id).map(Psk::redacted);
    }

    @Override
    public Uni<Psk> revoke(String id, Session admin) {
        accessControl.require(admin, Action.MANAGE_PSK);
        return find(id).flatMap(existing -> {
            if (existing.revoked()) {
                return Uni.createFrom().item(existing.redacted());
            }
            return repository.markRevoked(id).map(stored -> {
                final var revoked = stored.orElseThrow(() -> new ResourceNotFoundException(
                        ResourceNotFoundException.Reason.NO_SUCH_RESOURCE, "PSK"));
                LOG.infof("PSK %s revoked by %s", id, admin.subject());
                return revoked.redacted();
            });
        });
    }

    @Override
    public Uni<Psk> validate(String candidate, PskType requiredType) {
        if (candidate == null || candidate.isBlank() || candidate.length() > MAX_CANDIDATE_LENGTH) {
            return reject(PskException.Reason.INVALID, null);
        }
        final var candidateHash = SecureHash.sha256Hex(candidate.trim());
        return repository.findByHash(candidateHash).flatMap(found -> {
            if (found.isEmpty() || !SecureHash.constantTimeEquals(found.get().keyHash(), candidateHash)) {
                return reject(PskException.Reason.INVALID, null);
            }
            final var psk = found.get();
            final var now = Instant.now();
            if (psk.revoked()) {
                return reject(PskException.Reason.INVALID, psk);
            }
            if (psk.isExpired(now)) {
                return reject(PskException.Reason.EXPIRED, psk);
            }
            if (psk.pskType() != requiredType) {
                return reject(PskException.Reason.WRONG_TYPE, psk);
            }
            return repository.touchLastUsed(psk.id(), now).flatMap(stored -> {
                // Revoked or deleted after the lookup above.
                if (stored.isEmpty() || stored.get().revoked()) {
                    return reject(PskException.Reason.INVALID, psk);
                }
                return Uni.createFrom().item(stored.get());
            });
        });
    }

    private Uni<Psk> find(String id) {
        if (id == null || id.isBlank() || id.length() > 64) {
            return Uni.createFrom()
                    .failure(new ResourceNotFoundException(ResourceNotFoundException.Reason.INVALID_IDENTIFIER, "PSK"));
        }
        return repository.findById(id).map(opt -> opt.orElseThrow(
                () -> new ResourceNotFoundException(ResourceNotFoundException.Reason.NO_SUCH_RESOURCE, "PSK")));
    }

    private Uni<Psk> reject(PskException.Reason reason, Psk psk) {
        if (psk == null) {
            LOG.warnf("PSK rejected: %s", reason);
        } else {
            LOG.warnf("PSK %s rejected: %s", psk.id(), reason);
        }
        metrics.recordPskRejection(reason.name().toLowerCase());
        return Uni.createFrom().failure(new PskException(reason));
    }

    private void validateDescription(String description) {
        if (description == null || description.isBlank()) {
            throw ValidationException.malformed("description", "Description is required");
        }
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException(
                    ValidationException.Reason.TOO_LONG, "description", "Description is too long");
        }
    }

    /**
     * Validates the requested TTL against the configured maximum.
     *
     * @param ttl the requested TTL (may be null for no expiration)
     * @throws ValidationException if TTL is invalid or exceeds the configured maximum
     */
    private void validateTtl(Duration ttl) {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw ValidationException.malformed("ttl", "TTL must be positive");
        }
        config.maxTtl().ifPresent(maxTtl -> {
            if (ttl == null) {
                throw ValidationException.malformed("ttl", "TTL is required. Maximum allowed: " + formatDuration(maxTtl));
            }
            if (ttl.compareTo(maxTtl) > 0) {
                throw ValidationException.malformed(
                        "ttl",
                        "TTL exceeds maximum allowed. Requested: " + formatDuration(ttl) + ", Maximum: "
                                + formatDuration(maxTtl));
            }
        });
    }

    private String formatDuration(Duration duration) {
        long days = duration.toDays();
        if (days > 0) {
            return days + " days";
        }
        long hours = duration.toHours();
        if (hours > 0) {
            return hours + " hours";
        }
        return duration.toMinutes() + " minutes";
    }
}
