package com.splitttr.gateway.loader;

import com.splitttr.gateway.contents.ContentModel;
import com.splitttr.gateway.contents.FakeContentsStore;
import com.splitttr.gateway.contents.InMemoryFileIdManager;
import com.splitttr.gateway.scheduling.ManualTaskScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class FileLoaderRegistryTest {

    private static final Duration POLL = Duration.ofSeconds(1);

    private FakeContentsStore contents;
    private ManualTaskScheduler scheduler;
    private FileLoaderRegistry registry;
    private String fileId;

    @BeforeEach
    void setUp() {
        contents = new FakeContentsStore();
        contents.put("doc.txt", "initial");
        InMemoryFileIdManager ids = new InMemoryFileIdManager(contents);
        fileId = ids.index("doc.txt").orElseThrow();
        scheduler = new ManualTaskScheduler();
        registry = new FileLoaderRegistry(ids, contents, scheduler, Duration.ofSeconds(1), POLL);
    }

    @Test
    void concurrentAcquiresShareOneLoader() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Set<FileLoader> seen = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    seen.add(registry.acquire(fileId));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(seen).hasSize(1);
        assertThat(seen.iterator().next().subscriptionCount()).isEqualTo(threads);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void acquireAdoptsBaseline() {
        FileLoader loader = registry.acquire(fileId);

        assertThat(loader.lastModified()).isNotNull();
    }

    @Test
    void lastReleaseTearsLoaderDown() {
        FileLoader loader = registry.acquire(fileId);
        registry.acquire(fileId);

        registry.release(fileId);
        assertThat(registry.contains(fileId)).isTrue();
        assertThat(loader.isClosed()).isFalse();

        registry.release(fileId);
        assertThat(registry.contains(fileId)).isFalse();
        assertThat(loader.isClosed()).isTrue();
    }

    @Test
    void releaseFlushesPendingSave() {
        FileLoader loader = registry.acquire(fileId);
        loader.load("text", "file");
        loader.save(ContentModel.of("text", "file", "edited"));

        registry.release(fileId);

        assertThat(contents.savedContents()).containsExactly("edited");
    }

    @Test
    void noCallbacksAfterTeardown() {
        FileLoader loader = registry.acquire(fileId);
        List<String> changes = new ArrayList<>();
        loader.observe("room", model -> changes.add(model.content()));

        registry.release(fileId);
        contents.put("doc.txt", "external");
        scheduler.advance(POLL.multipliedBy(5));

        assertThat(changes).isEmpty();
        assertThat(scheduler.pendingTasks()).isZero();
    }

    @Test
    void acquireAfterTeardownCreatesFreshLoader() {
        FileLoader first = registry.acquire(fileId);
        registry.release(fileId);

        FileLoader second = registry.acquire(fileId);

        assertThat(second).isNotSameAs(first);
        assertThat(second.isClosed()).isFalse();
    }

    @Test
    void releasingUnknownIdIsIgnored() {
        registry.release("unknown");

        assertThat(registry.size()).isZero();
    }

    @Test
    void clearClosesEverything() {
        FileLoader loader = registry.acquire(fileId);

        registry.clear();

        assertThat(loader.isClosed()).isTrue();
        assertThat(registry.find(fileId)).isEmpty();
    }

    @Test
    void failingFlushStillForgetsLoader() {
        FileLoader loader = registry.acquire(fileId);
        loader.load("text", "file");
        loader.save(ContentModel.of("text", "file", "edited"));
        contents.failSavesWith(new IllegalStateException("boom"));

        registry.release(fileId);

        assertThat(registry.contains(fileId)).isFalse();
        assertThat(loader.isClosed()).isTrue();
        assertThat(registry.acquire(fileId)).isNotSameAs(loader);
    }
}
