package com.splitttr.gateway.room;

import com.splitttr.gateway.contents.ContentNotFoundException;
import com.splitttr.gateway.message.BinaryEncoder;
import com.splitttr.gateway.message.MessageFormatException;
import com.splitttr.gateway.message.SyncMessage;
import com.splitttr.gateway.message.YSyncType;
import com.splitttr.gateway.ydoc.LwwTextDocument;
import com.splitttr.gateway.ydoc.SharedDocument;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.splitttr.gateway.room.RoomFixture.CLEANUP_DELAY;
import static com.splitttr.gateway.room.RoomFixture.SAVE_DELAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

class DocumentRoomTest {

    private final RoomFixture fixture = new RoomFixture();

    @Test
    void initializeLoadsStoredContent() {
        DocumentRoom room = fixture.documentRoom();
        room.attach(new RecordingClient("a"));
        assertThat(room.phase()).isEqualTo(RoomPhase.UNINITIALIZED);

        room.initialize();

        assertThat(room.document().getSource()).isEqualTo("hello");
        assertThat(room.phase()).isEqualTo(RoomPhase.LIVE);
        assertThat(room.isReady()).isTrue();
        assertThat(fixture.events.count("load", "Content loaded from disk.")).isEqualTo(1);
        assertThat(fixture.events.count("initialize", "Room initialized")).isEqualTo(1);
        assertThat(fixture.updateStores.log("doc.txt", "file")).hasSize(1);
    }

    @Test
    void initializeRunsOnce() {
        DocumentRoom room = fixture.documentRoom();

        room.initialize();
        room.initialize();

        assertThat(fixture.events.count("initialize", "Room initialized")).isEqualTo(1);
    }

    @Test
    void matchingUpdateLogIsReplayed() {
        LwwTextDocument previous = new LwwTextDocument(5);
        fixture.updateStores.log("doc.txt", "file").add(previous.setSource("hello"));
        DocumentRoom room = fixture.documentRoom();

        room.initialize();

        assertThat(room.document().getSource()).isEqualTo("hello");
        assertThat(fixture.events.count("load", "Content loaded from disk.")).isZero();
        assertThat(fixture.updateStores.log("doc.txt", "file")).hasSize(1);
    }

    @Test
    void divergingUpdateLogYieldsToStoredContent() {
        LwwTextDocument previous = new LwwTextDocument(5);
        fixture.updateStores.log("doc.txt", "file").add(previous.setSource("stale"));
        DocumentRoom room = fixture.documentRoom();

        room.initialize();

        assertThat(room.document().getSource()).isEqualTo("hello");
        assertThat(fixture.events.count("initialize", "The file is out-of-sync with the ystore.")).isEqualTo(1);
        assertThat(fixture.events.count("load", "Content loaded from disk.")).isEqualTo(1);
    }

    @Test
    void failedInitializationCanBeRetried() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient client = new RecordingClient("a");
        room.attach(client);
        fixture.contents.remove("doc.txt");

        assertThatThrownBy(room::initialize).isInstanceOf(ContentNotFoundException.class);
        assertThat(room.phase()).isEqualTo(RoomPhase.UNINITIALIZED);

        fixture.contents.put("doc.txt", "back");
        room.initialize();
        assertThat(room.document().getSource()).isEqualTo("back");
    }

    @Test
    void roomWithFailedInitializationIsDiscardedOnceEmpty() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient client = new RecordingClient("a");
        room.attach(client);
        fixture.contents.remove("doc.txt");
        assertThatThrownBy(room::initialize).isInstanceOf(ContentNotFoundException.class);

        room.detach(client);

        assertThat(room.phase()).isEqualTo(RoomPhase.DESTROYED);
        assertThat(fixture.registry.roomExists(fixture.roomId)).isFalse();
        assertThat(fixture.loaders.contains(fixture.fileId)).isFalse();
    }

    @Test
    void serveStartsWithStep1() {
        DocumentRoom room = fixture.documentRoom();
        room.initialize();
        RecordingClient client = new RecordingClient("a");

        room.onServeStart(client);

        SyncMessage first = SyncMessage.decode(client.sent().get(0));
        assertThat(first.type()).isEqualTo(YSyncType.STEP1);
        assertThat(first.payload()).isEqualTo(room.document().encodeStateVector());
    }

    @Test
    void step1IsAnsweredWithStep2ToSenderOnly() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        RecordingClient b = new RecordingClient("b");
        room.attach(a);
        room.attach(b);
        room.initialize();

        room.handleMessage(a, SyncMessage.step1(new byte[]{0}).encode());

        assertThat(a.sent()).singleElement()
                .satisfies(frame -> assertThat(SyncMessage.decode(frame).type()).isEqualTo(YSyncType.STEP2));
        assertThat(b.sent()).isEmpty();
    }

    @Test
    void editIsBroadcastLoggedAndSaved() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        RecordingClient b = new RecordingClient("b");
        room.attach(a);
        room.attach(b);
        room.initialize();
        byte[] update = RoomFixture.edit(room, "hello world");

        room.handleMessage(a, SyncMessage.update(update).encode());

        assertThat(room.document().getSource()).isEqualTo("hello world");
        assertThat(a.sent()).isEmpty();
        assertThat(b.sent()).singleElement()
                .satisfies(frame -> assertThat(SyncMessage.decode(frame).payload()).isEqualTo(update));
        assertThat(fixture.updateStores.log("doc.txt", "file")).last().isEqualTo(update);

        assertThat(fixture.contents.savedContents()).isEmpty();
        fixture.scheduler.advance(SAVE_DELAY);
        assertThat(fixture.contents.content("doc.txt")).isEqualTo("hello world");
    }

    @Test
    void burstOfEditsIsSavedOnce() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        room.attach(a);
        room.initialize();

        room.handleMessage(a, RoomFixture.editFrame(room, "h"));
        room.handleMessage(a, RoomFixture.editFrame(room, "he"));
        room.handleMessage(a, RoomFixture.editFrame(room, "hey"));
        fixture.scheduler.advance(SAVE_DELAY);

        assertThat(fixture.contents.savedContents()).containsExactly("hey");
    }

    @Test
    void staleUpdateIsNeitherRelayedNorSaved() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        RecordingClient b = new RecordingClient("b");
        room.attach(a);
        room.attach(b);
        room.initialize();
        byte[] stale = new LwwTextDocument(1).setSource("old");

        room.handleMessage(a, SyncMessage.update(stale).encode());
        fixture.scheduler.advance(SAVE_DELAY);

        assertThat(b.sent()).isEmpty();
        assertThat(fixture.contents.savedContents()).isEmpty();
    }

    @Test
    void malformedSyncFrameIsRejected() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        room.attach(a);
        room.initialize();

        assertThatThrownBy(() -> room.handleMessage(a, new byte[]{0, 7, 0}))
                .isInstanceOf(MessageFormatException.class);
    }

    @Test
    void outOfBandChangeOverwritesRoom() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        room.attach(a);
        room.initialize();

        fixture.contents.put("doc.txt", "edited elsewhere");
        room.loader().notifyChanges();

        assertThat(room.document().getSource()).isEqualTo("edited elsewhere");
        assertThat(a.sent()).singleElement()
                .satisfies(frame -> assertThat(SyncMessage.decode(frame).type()).isEqualTo(YSyncType.UPDATE));
        assertThat(fixture.events.events()).anySatisfy(e -> assertThat(e.action()).isEqualTo("overwrite"));
        assertThat(room.loader().hasPendingSave()).isFalse();
    }

    @Test
    void emptyRoomIsDestroyedAfterGracePeriod() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        room.attach(a);
        room.initialize();

        room.detach(a);
        assertThat(room.phase()).isEqualTo(RoomPhase.CLEANUP_SCHEDULED);
        fixture.scheduler.advance(CLEANUP_DELAY.minusSeconds(1));
        assertThat(room.phase()).isEqualTo(RoomPhase.CLEANUP_SCHEDULED);

        fixture.scheduler.advance(Duration.ofSeconds(1));

        assertThat(room.phase()).isEqualTo(RoomPhase.DESTROYED);
        assertThat(fixture.registry.roomExists(fixture.roomId)).isFalse();
        assertThat(fixture.loaders.contains(fixture.fileId)).isFalse();
        assertThat(fixture.events.count("clean", "Room deleted.")).isEqualTo(1);
        assertThat(fixture.events.count("clean", "Loader deleted.")).isEqualTo(1);
    }

    @Test
    void roomNobodyJoinedIsCleanedUp() {
        DocumentRoom room = fixture.documentRoom();

        room.initialize();
        fixture.scheduler.advance(CLEANUP_DELAY);

        assertThat(room.phase()).isEqualTo(RoomPhase.DESTROYED);
    }

    @Test
    void reconnectWithinGracePeriodKeepsState() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        room.attach(a);
        room.initialize();
        room.handleMessage(a, RoomFixture.editFrame(room, "unsaved"));
        room.detach(a);

        fixture.scheduler.advance(CLEANUP_DELAY.dividedBy(2));
        RecordingClient b = new RecordingClient("b");
        assertThat(room.attach(b)).isTrue();
        assertThat(room.phase()).isEqualTo(RoomPhase.LIVE);
        fixture.scheduler.advance(CLEANUP_DELAY.multipliedBy(2));

        assertThat(room.phase()).isEqualTo(RoomPhase.LIVE);
        assertThat(fixture.manager.resolve(fixture.roomId)).isSameAs(room);
        assertThat(room.document().getSource()).isEqualTo("unsaved");
    }

    @Test
    void destroyFlushesPendingSave() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        room.attach(a);
        room.initialize();
        room.handleMessage(a, RoomFixture.editFrame(room, "last words"));

        room.close();

        assertThat(fixture.contents.content("doc.txt")).isEqualTo("last words");
    }

    @Test
    void destroyedRoomRefusesClients() {
        DocumentRoom room = fixture.documentRoom();
        room.close();

        assertThat(room.attach(new RecordingClient("a"))).isFalse();
        assertThat(fixture.manager.resolve(fixture.roomId)).isNotSameAs(room);
    }

    @Test
    void destroyedRoomIgnoresExternalChanges() {
        DocumentRoom room = fixture.documentRoom();
        room.initialize();
        room.close();

        assertThat(room.loader().isClosed()).isTrue();
        assertThat(room.document().getSource()).isEqualTo("hello");
    }

    @Test
    void disabledCleanupKeepsEmptyRoom() {
        RoomFixture noCleanup = new RoomFixture(null);
        DocumentRoom room = noCleanup.documentRoom();
        RecordingClient a = new RecordingClient("a");
        room.attach(a);
        room.initialize();

        room.detach(a);
        noCleanup.scheduler.advance(Duration.ofHours(1));

        assertThat(room.phase()).isEqualTo(RoomPhase.LIVE);
        assertThat(noCleanup.registry.roomExists(noCleanup.roomId)).isTrue();
    }

    @Test
    void cleanupTimerIsIgnoredOnceAClientIsBack() {
        DocumentRoom room = fixture.documentRoom();
        RecordingClient a = new RecordingClient("a");
        room.attach(a);
        room.initialize();
        room.detach(a);
        room.attach(a);

        room.destroyIfIdle();

        assertThat(room.phase()).isEqualTo(RoomPhase.LIVE);
    }

    @Test
    void concurrentEditsAreSavedInDocumentOrder() throws Exception {
        LwwTextDocument replica = new LwwTextDocument(0);
        PausingDocument document = new PausingDocument(replica);
        RoomManager manager = new RoomManager(new RoomRegistry(), fixture.loaders, fixture.ids, fixture.updateStores,
                fileType -> document, fixture.scheduler, CLEANUP_DELAY, fixture.events);
        DocumentRoom room = (DocumentRoom) manager.resolve(fixture.roomId);
        RecordingClient a = new RecordingClient("a");
        RecordingClient b = new RecordingClient("b");
        room.attach(a);
        room.attach(b);
        room.initialize();
        long clock = replica.clock();
        byte[] older = SyncMessage.update(update(clock + 1, "edit-1")).encode();
        byte[] newer = SyncMessage.update(update(clock + 2, "edit-2")).encode();

        Thread first = new Thread(() -> room.handleMessage(a, older));
        first.start();
        assertThat(document.applied.await(5, TimeUnit.SECONDS)).isTrue();
        Thread second = new Thread(() -> room.handleMessage(b, newer));
        second.start();
        awaitParked(second);
        document.resume.countDown();
        first.join(5_000);
        second.join(5_000);
        fixture.scheduler.advance(SAVE_DELAY);

        assertThat(replica.getSource()).isEqualTo("edit-2");
        assertThat(fixture.contents.content("doc.txt")).isEqualTo("edit-2");
    }

    private static byte[] update(long clock, String text) {
        return new BinaryEncoder()
                .writeVarUint(clock)
                .writeVarUint(1)
                .writeVarString(text)
                .toByteArray();
    }

    private static void awaitParked(Thread thread) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.BLOCKED && thread.getState() != Thread.State.TERMINATED) {
            if (System.nanoTime() > deadline) {
                fail("thread neither blocked nor finished within 5 seconds");
            }
            Thread.sleep(5);
        }
    }

    /**
     * Holds the first merged update until {@link #resume} opens, leaving the room mid-edit.
     */
    private static final class PausingDocument implements SharedDocument {

        private final SharedDocument delegate;
        private final AtomicBoolean paused = new AtomicBoolean();
        final CountDownLatch applied = new CountDownLatch(1);
        final CountDownLatch resume = new CountDownLatch(1);

        PausingDocument(SharedDocument delegate) {
            this.delegate = delegate;
        }

        @Override
        public String getSource() {
            return delegate.getSource();
        }

        @Override
        public byte[] setSource(String source) {
            return delegate.setSource(source);
        }

        @Override
        public boolean applyUpdate(byte[] update) {
            boolean changed = delegate.applyUpdate(update);
            if (paused.compareAndSet(false, true)) {
                applied.countDown();
                try {
                    resume.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return changed;
        }

        @Override
        public byte[] encodeStateVector() {
            return delegate.encodeStateVector();
        }

        @Override
        public byte[] encodeStateAsUpdate(byte[] stateVector) {
            return delegate.encodeStateAsUpdate(stateVector);
        }
    }
}
