package vpnmanager.core.model.psk;

/**
 * Result of creating a pre-shared key.
 *
 * <p>The plaintext secret is only available here, immediately after creation.
 *
 * @param psk       the stored record (hash only)
 * @param plaintext the secret to hand to the operator once
 */
public record PskCreateResult(Psk psk, String plaintext) {

    @Override
    public String toString() {
        return "PskCreateResult[id=" + psk.id() + "]";
    }
}
