package org.ncdyndns.sync;

import org.ncdyndns.api.ApiException;
import org.ncdyndns.api.ApiSession;
import org.ncdyndns.api.ApiSessionFactory;
import org.ncdyndns.api.TransportException;
import org.ncdyndns.config.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One complete sync pass: login, read, merge, optional writes, logout.
 * The session is released on every exit path.
 */
public class DynDnsUpdater {

    private static final Logger log = LoggerFactory.getLogger(DynDnsUpdater.class);

    private final ApiSessionFactory sessions;

    public DynDnsUpdater(Settings settings) {
        this(() -> ApiSession.open(settings));
    }

    public DynDnsUpdater(ApiSessionFactory sessions) {
        this.sessions = sessions;
    }

    public SyncReport run(DesiredState desired, boolean update) throws ApiException, TransportException {
        log.info("Syncing {} ({} desired records, update={})",
                desired.getDomain(), desired.getRecords().size(), update);

        try (ApiSession session = sessions.open()) {
            SyncEngine engine = new SyncEngine(session);
            ReconcileResult result = engine.reconcile(desired.getDomain(), desired.getRecords(), desired.getTtl());
            CommitResult commit = engine.commit(result, update);
            return new SyncReport(result, commit, update);
        }
    }
}
