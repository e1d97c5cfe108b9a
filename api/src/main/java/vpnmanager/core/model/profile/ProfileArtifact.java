package vpnmanager.core.model.profile;

/**
 * A downloadable file produced by profile issuance.
 *
 * @param fileName suggested file name for the attachment
 * @param contentType MIME type
 * @param content file bytes
 * @param fingerprint fingerprint of the certificate embedded in the artifact
 */
public record ProfileArtifact(String fileName, String contentType, byte[] content, String fingerprint) {

    public static final String OVPN_CONTENT_TYPE = "application/x-openvpn-profile";
    public static final String ZIP_CONTENT_TYPE = "application/zip";
}
