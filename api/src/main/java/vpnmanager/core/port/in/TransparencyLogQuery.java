package vpnmanager.core.port.in;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.model.certificate.Certificate;
import vpnmanager.core.model.certificate.CertificateFilter;
import vpnmanager.core.model.certificate.Page;
import vpnmanager.core.model.certificate.TransparencyLogEntry;
import vpnmanager.core.model.session.Session;

/**
 * Inbound port for querying issued certificates and the transparency log.
 *
 * <p>Page numbers and sizes are raw user input and are clamped, never rejected.
 */
public interface TransparencyLogQuery {

    /**
     * Lists certificates owned by the session's identity.
     */
    Uni<Page<Certificate>> listOwn(Session session, int page, int size);

    /**
     * Lists certificates across owners. Admins see everything the filter matches;
     * other identities are restricted to their own certificates.
     */
    Uni<Page<Certificate>> search(CertificateFilter filter, int page, int size, Session session);

    /**
     * Lists raw transparency log entries. Admin only.
     */
    Uni<Page<TransparencyLogEntry>> events(int page, int size, Session session);
}
