package com.schoolsync.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.schoolsync.api.LookupResult;
import com.schoolsync.config.SyncConfig;
import com.schoolsync.identity.ExternalIdentity;
import com.schoolsync.identity.IdentityKind;
import com.schoolsync.identity.IdentityResolver;
import com.schoolsync.model.DirectoryPerson;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Best-effort identity lookup for the reconciliation services. An unresolved
 * identity never blocks a record: every outcome other than a hit becomes
 * {@code null}.
 */
@ApplicationScoped
public class IdentityEnricher {

    private static final Logger log = LoggerFactory.getLogger(IdentityEnricher.class);

    private final IdentityResolver resolver;
    private final int maxRetries;

    @Inject
    public IdentityEnricher(IdentityResolver resolver, SyncConfig config) {
        this(resolver, config.getIdentityMaxRetries());
    }

    public IdentityEnricher(IdentityResolver resolver, int maxRetries) {
        this.resolver = resolver;
        this.maxRetries = maxRetries;
    }

    public ExternalIdentity lookup(IdentityKind kind, Long id) throws InterruptedException {
        if (id == null) {
            return null;
        }
        try {
            LookupResult<ExternalIdentity> result = resolver.resolve(kind, id, maxRetries);
            if (result.isFound()) {
                return result.getValue();
            }
            log.debug("No external identity for {}={}: {}", kind.getQueryParameter(), id, result.getReason());
        } catch (RuntimeException e) {
            log.warn("External identity lookup for {}={} failed: {}", kind.getQueryParameter(), id, e.toString());
        }
        return null;
    }

    static void apply(DirectoryPerson row, ExternalIdentity identity) {
        if (identity != null) {
            row.setExternalId(identity.getExternalId());
            row.setExternalLink(identity.getExternalLink());
        }
    }
}
