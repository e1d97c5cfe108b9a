package vpnmanager.adapter.in.http;

import jakarta.ws.rs.core.Response;

import vpnmanager.core.model.profile.ProfileArtifact;

/**
 * Builds attachment responses for generated profiles.
 */
final class Downloads {

    private Downloads() {}

    static Response attachment(ProfileArtifact artifact) {
        final var fileName = artifact.fileName().replaceAll("[^A-Za-z0-9._@-]", "_");
        return Response.ok(artifact.content())
                .type(artifact.contentType())
                .header("Content-Disposition", "attachment; filename=\"" + fileName + "\"")
                .header("X-Certificate-Fingerprint", artifact.fingerprint())
                .build();
    }
}
