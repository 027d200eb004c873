package com.splitttr.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.splitttr.gateway.client.ContentsClient;
import com.splitttr.gateway.contents.ContentsStore;
import com.splitttr.gateway.contents.FileIdManager;
import com.splitttr.gateway.contents.FileSystemContentsStore;
import com.splitttr.gateway.contents.InMemoryFileIdManager;
import com.splitttr.gateway.contents.RemoteContentsStore;
import com.splitttr.gateway.event.CollaborationEventSink;
import com.splitttr.gateway.event.LoggingEventSink;
import com.splitttr.gateway.loader.FileLoaderRegistry;
import com.splitttr.gateway.room.RoomManager;
import com.splitttr.gateway.room.RoomRegistry;
import com.splitttr.gateway.scheduling.ExecutorTaskScheduler;
import com.splitttr.gateway.scheduling.TaskScheduler;
import com.splitttr.gateway.session.DocumentSessionService;
import com.splitttr.gateway.session.SessionIssuer;
import com.splitttr.gateway.ydoc.DocumentEngine;
import com.splitttr.gateway.ydoc.LwwDocumentEngine;
import com.splitttr.gateway.ystore.FileUpdateStoreFactory;
import com.splitttr.gateway.ystore.UpdateStoreFactory;
import io.quarkus.arc.DefaultBean;
import io.quarkus.arc.properties.IfBuildProperty;
import io.quarkus.runtime.ShutdownEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * CDI producer for the gateway beans.
 *
 * <p>Storage, document engine and event sink are default beans and can be replaced by
 * defining your own. Build with {@code collab.contents.backend=remote} to read and write
 * documents through the contents service instead of the local file system.
 */
@ApplicationScoped
public class GatewayProducer {

    private static final Logger LOG = Logger.getLogger(GatewayProducer.class);

    @Produces
    @Singleton
    @Named("collab-scheduler")
    public ScheduledExecutorService schedulerExecutor(GatewayConfig config) {
        return Executors.newScheduledThreadPool(config.schedulerThreads(), threads("collab-scheduler"));
    }

    void closeScheduler(@Disposes @Named("collab-scheduler") ScheduledExecutorService executor) {
        executor.shutdownNow();
    }

    /**
     * Runs one relay task per connected client.
     */
    @Produces
    @Singleton
    @Named("collab-relay")
    public ExecutorService relayExecutor() {
        return Executors.newCachedThreadPool(threads("collab-relay"));
    }

    void closeRelay(@Disposes @Named("collab-relay") ExecutorService executor) {
        executor.shutdownNow();
    }

    @Produces
    @Singleton
    public TaskScheduler taskScheduler(@Named("collab-scheduler") ScheduledExecutorService executor) {
        return new ExecutorTaskScheduler(executor);
    }

    @Produces
    @Singleton
    @DefaultBean
    public ContentsStore fileSystemContentsStore(GatewayConfig config) {
        Path root = Path.of(config.contents().root()).toAbsolutePath().normalize();
        LOG.infof("Serving documents from %s", root);
        return new FileSystemContentsStore(root);
    }

    @Produces
    @Singleton
    @IfBuildProperty(name = "collab.contents.backend", stringValue = "remote")
    public ContentsStore remoteContentsStore(@RestClient ContentsClient client) {
        LOG.info("Serving documents from the contents service");
        return new RemoteContentsStore(client);
    }

    @Produces
    @Singleton
    @DefaultBean
    public FileIdManager fileIdManager(ContentsStore contents) {
        return new InMemoryFileIdManager(contents);
    }

    @Produces
    @Singleton
    @DefaultBean
    public UpdateStoreFactory updateStoreFactory(GatewayConfig config) {
        String root = config.updateLog().root().orElse(config.contents().root());
        return new FileUpdateStoreFactory(Path.of(root).toAbsolutePath().normalize());
    }

    @Produces
    @Singleton
    @DefaultBean
    public DocumentEngine documentEngine() {
        return new LwwDocumentEngine();
    }

    @Produces
    @Singleton
    @DefaultBean
    public CollaborationEventSink eventSink(ObjectMapper mapper) {
        return new LoggingEventSink(mapper);
    }

    @Produces
    @Singleton
    public FileLoaderRegistry fileLoaderRegistry(FileIdManager fileIdManager,
                                                 ContentsStore contents,
                                                 TaskScheduler scheduler,
                                                 GatewayConfig config) {
        return new FileLoaderRegistry(
                fileIdManager,
                contents,
                scheduler,
                config.documentSaveDelay(),
                config.filePollInterval().orElse(null));
    }

    @Produces
    @Singleton
    public RoomRegistry roomRegistry() {
        return new RoomRegistry();
    }

    @Produces
    @Singleton
    public RoomManager roomManager(RoomRegistry registry,
                                   FileLoaderRegistry loaders,
                                   FileIdManager fileIdManager,
                                   UpdateStoreFactory updateStores,
                                   DocumentEngine engine,
                                   TaskScheduler scheduler,
                                   CollaborationEventSink events,
                                   GatewayConfig config) {
        return new RoomManager(
                registry,
                loaders,
                fileIdManager,
                updateStores,
                engine,
                scheduler,
                config.documentCleanupDelay().orElse(null),
                events);
    }

    @Produces
    @Singleton
    public SessionIssuer sessionIssuer() {
        SessionIssuer issuer = new SessionIssuer();
        LOG.infof("Document session id: %s", issuer.current());
        return issuer;
    }

    @Produces
    @Singleton
    public DocumentSessionService documentSessionService(FileIdManager fileIdManager, SessionIssuer issuer) {
        return new DocumentSessionService(fileIdManager, issuer);
    }

    void onShutdown(@Observes ShutdownEvent event, RoomManager roomManager) {
        LOG.info("Closing collaboration rooms");
        roomManager.shutdown();
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
