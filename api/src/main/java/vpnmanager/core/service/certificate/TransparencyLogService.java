package vpnmanager.core.service.certificate;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;

import vpnmanager.core.config.TransparencyConfig;
import vpnmanager.core.model.auth.Action;
import vpnmanager.core.model.certificate.Certificate;
import vpnmanager.core.model.certificate.CertificateFilter;
import vpnmanager.core.model.certificate.Page;
import vpnmanager.core.model.certificate.PageRequest;
import vpnmanager.core.model.certificate.TransparencyLogEntry;
import vpnmanager.core.model.session.Session;
import vpnmanager.core.port.in.TransparencyLogQuery;
import vpnmanager.core.port.out.CertificateRepository;
import vpnmanager.core.service.auth.AccessControlService;

/**
 * Read side of the certificate store and transparency log.
 *
 * <p>Page numbers below 1 become 1 and sizes are clamped to the configured range.
 * A page past the end is served empty with correct totals.
 */
@ApplicationScoped
public class TransparencyLogService implements TransparencyLogQuery {

    private final CertificateRepository repository;
    private final AccessControlService accessControl;
    private final TransparencyConfig config;

    @Inject
    public TransparencyLogService(
            CertificateRepository repository, AccessControlService accessControl, TransparencyConfig config) {
        this.repository = repository;
        this.accessControl = accessControl;
        this.config = config;
    }

    @Override
    public Uni<Page<Certificate>> listOwn(Session session, int page, int size) {
        accessControl.require(session, Action.VIEW_OWN_CERTIFICATES);
        return repository.query(CertificateFilter.ownedBy(session.subject()), pageRequest(page, size));
    }

    @Override
    public Uni<Page<Certificate>> search(CertificateFilter filter, int page, int size, Session session) {
        final var unrestricted = accessControl
                .authorize(session, Action.SEARCH_ALL_CERTIFICATES)
                .isAllowed();
        if (unrestricted) {
            return repository.query(filter, pageRequest(page, size));
        }
        accessControl.require(session, Action.VIEW_TRANSPARENCY_LOG);
        return repository.query(filter.withOwner(session.subject()), pageRequest(page, size));
    }

    @Override
    public Uni<Page<TransparencyLogEntry>> events(int page, int size, Session session) {
        accessControl.require(session, Action.SEARCH_ALL_CERTIFICATES);
        return repository.events(pageRequest(page, size));
    }

    private PageRequest pageRequest(int page, int size) {
        return PageRequest.of(page, size, config.defaultPageSize(), config.maxPageSize());
    }
}
