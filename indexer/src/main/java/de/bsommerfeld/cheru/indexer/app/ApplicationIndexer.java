package de.bsommerfeld.cheru.indexer.app;

import de.bsommerfeld.cheru.core.domain.Index;

/**
 * Discovers the launchable applications installed on the host.
 *
 * <p>
 * One implementation exists per discovery mechanism:
 * <ul>
 * <li>{@link DesktopEntryIndexer}: freedesktop {@code .desktop} manifests
 * (Linux, BSD desktops)</li>
 * <li>{@link AppBundleIndexer}: {@code .app} bundles (macOS)</li>
 * <li>{@link UnsupportedPlatformIndexer}: hosts without a supported
 * mechanism, always empty</li>
 * </ul>
 * The implementation is chosen once at wiring time; callers never branch on the
 * platform themselves.
 *
 * <p>
 * Implementations must return an {@link de.bsommerfeld.cheru.core.domain.EntryKind#APPLICATION}
 * index deduplicated by display name (first occurrence wins) and must never
 * fail as a whole because a single manifest or bundle is unreadable.
 */
public interface ApplicationIndexer {

    Index buildIndex();
}
