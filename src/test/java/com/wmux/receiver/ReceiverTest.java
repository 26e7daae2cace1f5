package com.wmux.receiver;

import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.ReceiverId;
import com.wmux.shared.WatchEvent;
import com.wmux.shared.WatchFilter;
import com.wmux.shared.WatchResponse;
import io.etcd.jetcd.ByteSequence;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

import static org.junit.Assert.*;

public class ReceiverTest {

    private static final KeyRange RANGE = KeyRange.of("/a/", "/a0");

    private BlockingQueue<WatchResponse> queue;
    private CancelScope scope;
    private Receiver receiver;

    @Before
    public void setUp() {
        queue = new ArrayBlockingQueue<>(16);
        scope = CancelScope.root();
        receiver = new Receiver(new ReceiverId("conn", 42), RANGE, queue, scope, 20);
    }

    private static WatchEvent event(WatchEvent.Type type, String key, long rev) {
        return new WatchEvent(type, ByteSequence.from(key, StandardCharsets.UTF_8), ByteSequence.EMPTY, rev);
    }

    @Test
    public void testCreated_deliveredOnceWithOwnWatchId() {
        assertTrue(receiver.forward(WatchResponse.created(5, -1)));
        assertTrue(receiver.forward(WatchResponse.created(5, -1)));
        assertFalse(receiver.sendCreated(5));

        assertEquals(1, queue.size());
        WatchResponse created = queue.poll();
        assertTrue(created.isCreated());
        assertEquals(42, created.getWatchId());
        assertEquals(6, receiver.getNextRevision());
    }

    @Test
    public void testSyntheticCreated_blocksLaterForwardedCreated() {
        assertTrue(receiver.sendCreated(9));
        receiver.forward(WatchResponse.created(9, -1));
        assertEquals(1, queue.size());
        assertEquals(9, queue.poll().getRevision());
    }

    @Test
    public void testEventsBeforeCreated_heldUntilAcknowledged() {
        receiver.forward(WatchResponse.events(6, List.of(event(WatchEvent.Type.PUT, "/a/1", 6))));
        receiver.forward(WatchResponse.events(7, List.of(event(WatchEvent.Type.PUT, "/a/2", 7))));
        assertTrue(queue.isEmpty());

        receiver.sendCreated(6);
        assertTrue(queue.poll().isCreated());
        // revision 6 is covered by the acknowledgment
        WatchResponse next = queue.poll();
        assertEquals(7, next.getRevision());
        assertEquals(42, next.getWatchId());
        assertNull(queue.poll());
    }

    @Test
    public void testStaleEvents_dropped() {
        receiver.sendCreated(10);
        queue.clear();
        receiver.forward(WatchResponse.events(10, List.of(event(WatchEvent.Type.PUT, "/a/1", 10))));
        receiver.forward(WatchResponse.events(12, List.of(
                event(WatchEvent.Type.PUT, "/a/1", 11), event(WatchEvent.Type.PUT, "/a/2", 12))));
        receiver.forward(WatchResponse.events(12, List.of(event(WatchEvent.Type.PUT, "/a/2", 12))));

        assertEquals(1, queue.size());
        assertEquals(2, queue.poll().getEvents().size());
        assertEquals(13, receiver.getNextRevision());
    }

    @Test
    public void testFilters_removeEventsAndSkipEmptyResponses() {
        Receiver noDelete = new Receiver(new ReceiverId("conn", 1), RANGE, queue, scope, 20, 0, false,
                EnumSet.of(WatchFilter.NODELETE));
        noDelete.sendCreated(1);
        queue.clear();

        noDelete.forward(WatchResponse.events(3, List.of(
                event(WatchEvent.Type.PUT, "/a/1", 2), event(WatchEvent.Type.DELETE, "/a/1", 3))));
        noDelete.forward(WatchResponse.events(4, List.of(event(WatchEvent.Type.DELETE, "/a/2", 4))));

        assertEquals(1, queue.size());
        List<WatchEvent> events = queue.poll().getEvents();
        assertEquals(1, events.size());
        assertEquals(WatchEvent.Type.PUT, events.get(0).getType());
        assertEquals(5, noDelete.getNextRevision());
    }

    @Test
    public void testProgress_onlyWhenRequested() {
        receiver.sendCreated(1);
        receiver.forward(WatchResponse.progress(3));
        assertEquals(1, queue.size());
        assertEquals(4, receiver.getNextRevision());

        Receiver withProgress = new Receiver(new ReceiverId("conn", 2), RANGE, queue, scope, 20, 0, true,
                EnumSet.noneOf(WatchFilter.class));
        withProgress.sendCreated(5);
        withProgress.forward(WatchResponse.progress(4));
        withProgress.forward(WatchResponse.progress(7));
        queue.poll();
        queue.poll();
        WatchResponse progress = queue.poll();
        assertTrue(progress.isProgressNotify());
        assertEquals(7, progress.getRevision());
        assertEquals(2, progress.getWatchId());
        assertNull(queue.poll());
    }

    @Test
    public void testStartRevision_acceptsReplayBelowCreatedRevision() {
        Receiver replay = new Receiver(new ReceiverId("conn", 3), RANGE, queue, scope, 20, 2, false,
                EnumSet.noneOf(WatchFilter.class));
        replay.forward(WatchResponse.created(8, -1));
        replay.forward(WatchResponse.events(2, List.of(event(WatchEvent.Type.PUT, "/a/1", 2))));

        assertTrue(queue.poll().isCreated());
        assertEquals(2, queue.poll().getRevision());
        assertEquals(3, replay.getNextRevision());
    }

    @Test
    public void testFullQueue_evictsReceiver() {
        BlockingQueue<WatchResponse> tiny = new ArrayBlockingQueue<>(1);
        CancelScope own = CancelScope.root();
        Receiver slow = new Receiver(new ReceiverId("conn", 4), RANGE, tiny, own, 10);
        assertTrue(slow.sendCreated(1));

        assertFalse(slow.forward(WatchResponse.events(2, List.of(event(WatchEvent.Type.PUT, "/a/1", 2)))));
        assertTrue(slow.isCancelled());
        assertTrue(own.isCancelled());
        assertFalse(slow.forward(WatchResponse.events(3, List.of(event(WatchEvent.Type.PUT, "/a/1", 3)))));
        assertEquals(1, tiny.size());
    }

    @Test
    public void testCancelledReceiver_rejectsImmediately() {
        scope.cancel();
        assertFalse(receiver.sendCreated(1));
        assertFalse(receiver.forward(WatchResponse.created(1, -1)));
        assertTrue(queue.isEmpty());
    }
}
