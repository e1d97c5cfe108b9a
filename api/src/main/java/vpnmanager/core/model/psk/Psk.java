package vpnmanager.core.model.psk;

import java.time.Instant;

/**
 * A stored pre-shared key for unattended profile issuance.
 *
 * <p>The secret itself is never stored; only its SHA-256 hash is persisted.
 *
 * @param id          short identifier for display and revocation
 * @param keyHash     SHA-256 hash of the secret (never store plaintext)
 * @param description what the key is for; used as the hostname of server certificates
 * @param pskType     certificate type this key may mint
 * @param templateSet name of the profile template set used for issued configs
 * @param createdBy   subject of the admin who created the key
 * @param createdAt   when the key was created
 * @param expiresAt   when the key expires (null = never)
 * @param revoked     whether the key has been revoked
 * @param lastUsedAt  last successful use (null = never used)
 */
public record Psk(
        String id,
        String keyHash,
        String description,
        PskType pskType,
        String templateSet,
        String createdBy,
        Instant createdAt,
        Instant expiresAt,
        boolean revoked,
        Instant lastUsedAt) {

    public static final String REDACTED = "[REDACTED]";

    public Psk {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("PSK ID cannot be null or blank");
        }
        if (keyHash == null || keyHash.isBlank()) {
            throw new IllegalArgumentException("PSK hash cannot be null or blank");
        }
        if (pskType == null) {
            throw new IllegalArgumentException("PSK type is required");
        }
        if (description == null) {
            description = "";
        }
        if (templateSet == null || templateSet.isBlank()) {
            templateSet = "Default";
        }
        if (createdBy == null) {
            createdBy = "unknown";
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    /**
     * Checks if this key can be used (not revoked and not expired).
     */
    public boolean isValid(Instant now) {
        return !revoked && !isExpired(now);
    }

    /**
     * Creates a copy of this key with the hash redacted for display purposes.
     */
    public Psk redacted() {
        return new Psk(
                id, REDACTED, description, pskType, templateSet, createdBy, createdAt, expiresAt, revoked, lastUsedAt);
    }

    /**
     * Creates a revoked copy of this key.
     */
    public Psk revoke() {
        return new Psk(id, keyHash, description, pskType, templateSet, createdBy, createdAt, expiresAt, true, lastUsedAt);
    }

    public Psk withLastUsedAt(Instant at) {
        return new Psk(id, keyHash, description, pskType, templateSet, createdBy, createdAt, expiresAt, revoked, at);
    }

    public static Builder builder(String id, String keyHash) {
        return new Builder(id, keyHash);
    }

    public static class Builder {
        private final String id;
        private final String keyHash;
        private String description;
        private PskType pskType;
        private String templateSet;
        private String createdBy;
        private Instant createdAt = Instant.now();
        private Instant expiresAt;
        private boolean revoked;

        private Builder(String id, String keyHash) {
            this.id = id;
            this.keyHash = keyHash;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder pskType(PskType pskType) {
            this.pskType = pskType;
            return this;
        }

        public Builder templateSet(String templateSet) {
            this.templateSet = templateSet;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder expiresAt(Instant expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder revoked(boolean revoked) {
            this.revoked = revoked;
            return this;
        }

        public Psk build() {
            return new Psk(
                    id, keyHash, description, pskType, templateSet, createdBy, createdAt, expiresAt, revoked, null);
        }
    }
}
