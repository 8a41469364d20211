package de.mirkosertic.doctree;

import de.mirkosertic.doctree.config.ApplicationConfig;
import de.mirkosertic.doctree.config.LoggingConfigurator;
import de.mirkosertic.doctree.store.RecordReader;
import de.mirkosertic.doctree.store.WatchSetupException;
import de.mirkosertic.doctree.watcher.ChangeWatcher;
import de.mirkosertic.doctree.watcher.DirectoryWatcherService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for doctree.
 * Builds the index over the configured store, keeps it up to date and hands it to whatever
 * front end serves it.
 */
public class DocTreeApplication {

    private static final Logger logger = LoggerFactory.getLogger(DocTreeApplication.class);

    private final ApplicationConfig config;
    private final IndexExecutorService indexExecutor;
    private final LiveIndex index;
    private final ChangeWatcher changeWatcher;

    public DocTreeApplication(final ApplicationConfig config) {
        this.config = config;

        // Initialize services in dependency order
        this.indexExecutor = new IndexExecutorService(config);

        this.index = new LiveIndex(config.getBasePath(), new RecordReader(), indexExecutor);

        // The change watcher owns the directory watcher and releases it on stop
        this.changeWatcher = new ChangeWatcher(config, index, new DirectoryWatcherService(config));
    }

    /**
     * Build the initial index and, if enabled, start watching for changes.
     * A watcher that cannot be set up is logged; the index still serves queries.
     */
    public void init() {
        logger.info("Initializing doctree for {}", config.getBasePath());

        index.rebuild();

        if (config.isWatchEnabled()) {
            try {
                changeWatcher.start();
            } catch (final WatchSetupException e) {
                logger.error("Live updates disabled, serving the index as built at startup", e);
            }
        } else {
            logger.info("Watching is disabled, the index is only refreshed on rebuild");
        }

        logger.info("doctree initialized with {} items", index.size());
    }

    public LiveIndex getIndex() {
        return index;
    }

    public ChangeWatcher getChangeWatcher() {
        return changeWatcher;
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down doctree...");

        // Shutdown in reverse order of initialization
        try {
            changeWatcher.stop();
        } catch (final Exception e) {
            logger.error("Error stopping change watcher", e);
        }

        try {
            indexExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down index executor", e);
        }

        logger.info("doctree shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean daemonMode = ApplicationConfig.isDaemonProfile();
            LoggingConfigurator.configure(daemonMode);

            final ApplicationConfig config = ApplicationConfig.load();

            final DocTreeApplication app = new DocTreeApplication(config);
            Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "shutdown-hook"));
            app.init();

            // Keep the application running, the watcher threads are daemons
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        } catch (final Exception e) {
            System.err.println("Failed to start doctree: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
