package com.wmux.upstream;

import com.wmux.shared.CancelScope;
import com.wmux.shared.KeyRange;
import com.wmux.shared.WatchEvent;
import com.wmux.shared.WatchOptions;
import com.wmux.shared.WatchResponse;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.Assert.*;

public class InMemoryWatchSourceTest {

    private static final KeyRange ITEMS = KeyRange.of("/items/", "/items0");

    private InMemoryWatchSource source;
    private CancelScope scope;

    @Before
    public void setUp() {
        source = new InMemoryWatchSource();
        scope = CancelScope.root();
    }

    @After
    public void tearDown() {
        scope.cancel();
        source.close();
    }

    @Test
    public void testPutAndDelete_bumpRevision() {
        assertEquals(1, source.getRevision());
        assertEquals(2, source.put("/items/1", "a"));
        assertEquals("a", source.get("/items/1"));
        assertEquals(3, source.delete("/items/1"));
        assertNull(source.get("/items/1"));
        assertEquals(3, source.delete("/items/1"));
    }

    @Test
    public void testStream_createdThenMatchingEvents() throws Exception {
        source.put("/items/0", "z");
        WatchStream stream = source.open(scope, ITEMS, WatchOptions.grouped());

        source.put("/items/1", "a");
        source.put("/other", "b");
        source.delete("/items/1");

        WatchResponse created = stream.next();
        assertTrue(created.isCreated());
        assertEquals(2, created.getRevision());

        WatchResponse put = stream.next();
        assertEquals(3, put.getRevision());
        WatchEvent event = put.getEvents().get(0);
        assertEquals(WatchEvent.Type.PUT, event.getType());
        assertEquals("/items/1", event.getKey().toString(StandardCharsets.UTF_8));
        assertEquals("a", event.getValue().toString(StandardCharsets.UTF_8));

        WatchResponse delete = stream.next();
        assertEquals(5, delete.getRevision());
        assertEquals(WatchEvent.Type.DELETE, delete.getEvents().get(0).getType());
    }

    @Test
    public void testProgress_onlyForStreamsThatAsked() throws Exception {
        WatchStream quiet = source.open(scope, ITEMS, WatchOptions.builder().build());
        WatchStream chatty = source.open(scope, ITEMS, WatchOptions.builder().progressNotify(true).build());

        source.progress();
        source.put("/items/1", "a");

        WatchResponse progress = chatty.next();
        assertTrue(progress.isProgressNotify());
        assertEquals(1, progress.getRevision());
        assertEquals(2, quiet.next().getRevision());
    }

    @Test
    public void testStartRevision_replaysHistory() throws Exception {
        source.put("/items/1", "a");
        source.put("/items/2", "b");
        source.put("/other", "c");

        WatchStream stream = source.open(scope, ITEMS,
                WatchOptions.builder().createdNotify(true).startRevision(3).build());
        assertTrue(stream.next().isCreated());
        assertEquals(3, stream.next().getRevision());

        source.put("/items/3", "d");
        assertEquals(5, stream.next().getRevision());
    }

    @Test
    public void testCancel_endsStream() throws Exception {
        CancelScope child = scope.child();
        WatchStream stream = source.open(child, ITEMS, WatchOptions.builder().build());
        assertEquals(1, source.getActiveCount());

        child.cancel();
        assertNull(stream.next());
        assertTrue(stream.isEnded());
        assertEquals(0, source.getActiveCount());
        assertEquals(1, source.getOpenCount());
    }

    @Test(expected = WatchSourceException.class)
    public void testOpenAfterClose_fails() {
        source.close();
        source.open(scope, ITEMS, WatchOptions.grouped());
    }

    @Test
    public void testReplay_limitedToRetainedHistory() throws Exception {
        InMemoryWatchSource small = new InMemoryWatchSource(2);
        small.put("/items/1", "a");
        small.put("/items/2", "b");
        small.put("/items/3", "c");

        WatchStream stream = small.open(scope, ITEMS,
                WatchOptions.builder().createdNotify(true).startRevision(2).build());
        assertTrue(stream.next().isCreated());
        assertEquals(3, stream.next().getRevision());
        assertEquals(4, stream.next().getRevision());

        small.put("/items/4", "d");
        assertEquals(5, stream.next().getRevision());
        small.close();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testHistoryLimit_mustBePositive() {
        new InMemoryWatchSource(0);
    }
}
