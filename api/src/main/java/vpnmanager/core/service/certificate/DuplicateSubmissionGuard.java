package vpnmanager.core.service.certificate;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import vpnmanager.core.config.CertificateConfig;

/**
 * Tracks issuance requests that are currently being signed.
 *
 * <p>A key is held from acquisition until the request finishes, successfully or not.
 * When disabled every acquisition succeeds and identical concurrent requests each
 * produce their own certificate.
 */
@ApplicationScoped
public class DuplicateSubmissionGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final boolean enabled;

    @Inject
    public DuplicateSubmissionGuard(CertificateConfig config) {
        this(config.duplicateGuard().enabled());
    }

    public DuplicateSubmissionGuard(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return true if the caller may proceed and must later {@link #release}
     */
    public boolean tryAcquire(String key) {
        return !enabled || inFlight.add(key);
    }

    public void release(String key) {
        if (enabled) {
            inFlight.remove(key);
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }
}
