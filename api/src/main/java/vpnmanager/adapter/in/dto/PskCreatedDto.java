package vpnmanager.adapter.in.dto;

import vpnmanager.core.model.psk.PskCreateResult;

/**
 * DTO returned once, when a pre-shared key is created.
 *
 * @param key the plaintext secret; it cannot be retrieved again
 * @param psk the stored metadata
 */
public record PskCreatedDto(String key, PskDto psk) {

    public static PskCreatedDto fromModel(PskCreateResult result) {
        return new PskCreatedDto(result.plaintext(), PskDto.fromModel(result.psk()));
    }
}
