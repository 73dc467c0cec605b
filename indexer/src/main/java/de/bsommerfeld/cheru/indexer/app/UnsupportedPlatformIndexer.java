package de.bsommerfeld.cheru.indexer.app;

import de.bsommerfeld.cheru.core.domain.EntryKind;
import de.bsommerfeld.cheru.core.domain.Index;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback for hosts without a supported discovery mechanism. Returns an empty
 * index: an unavailable catalog is not an error, the launcher still serves
 * folders, images and system actions.
 */
public final class UnsupportedPlatformIndexer implements ApplicationIndexer {

    private static final Logger LOG = LoggerFactory.getLogger(UnsupportedPlatformIndexer.class);

    private final String platformName;

    public UnsupportedPlatformIndexer(String platformName) {
        this.platformName = platformName;
    }

    @Override
    public Index buildIndex() {
        LOG.info("No application discovery available on {}, application index stays empty", platformName);
        return Index.empty(EntryKind.APPLICATION);
    }
}
