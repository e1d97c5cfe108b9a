package vpnmanager.adapter.in.dto;

import java.time.Instant;

import vpnmanager.core.model.psk.Psk;

/**
 * DTO for stored pre-shared keys. Neither the secret nor its hash is included.
 */
public record PskDto(
        String id,
        String description,
        String type,
        String templateSet,
        String createdBy,
        Instant createdAt,
        Instant expiresAt,
        boolean revoked,
        Instant lastUsedAt) {

    public static PskDto fromModel(Psk model) {
        return new PskDto(
                model.id(),
                model.description(),
                model.pskType().wireName(),
                model.templateSet(),
                model.createdBy(),
                model.createdAt(),
                model.expiresAt(),
                model.revoked(),
                model.lastUsedAt());
    }
}
