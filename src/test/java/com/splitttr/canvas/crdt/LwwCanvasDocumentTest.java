package com.splitttr.canvas.crdt;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LwwCanvasDocumentTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    @Test
    void replicasConvergeRegardlessOfOrderAndDuplication() {
        var alice = new LwwCanvasDocument("alice");
        var bob = new LwwCanvasDocument("bob");

        List<byte[]> deltas = new ArrayList<>();
        deltas.add(alice.put("rect-1", node("{\"x\":10,\"y\":20}")));
        deltas.add(bob.put("rect-1", node("{\"x\":99}")));
        deltas.add(bob.put("text-1", node("{\"text\":\"hello\"}")));
        deltas.add(alice.put("frame-1", node("{\"children\":[\"rect-1\"]}")));
        deltas.add(alice.remove("text-1"));
        deltas.add(bob.put("rect-2", node("{\"fill\":\"#ef4444\"}")));

        var inOrder = new LwwCanvasDocument("server-1");
        deltas.forEach(inOrder::applyUpdate);

        List<byte[]> shuffled = new ArrayList<>(deltas);
        shuffled.addAll(deltas.subList(0, 3));
        Collections.shuffle(shuffled, new Random(42));
        var scrambled = new LwwCanvasDocument("server-2");
        shuffled.forEach(scrambled::applyUpdate);

        var reversed = new LwwCanvasDocument("server-3");
        for (int i = deltas.size() - 1; i >= 0; i--) {
            reversed.applyUpdate(deltas.get(i));
            reversed.applyUpdate(deltas.get(i));
        }

        assertArrayEquals(inOrder.encodeSnapshot(), scrambled.encodeSnapshot());
        assertArrayEquals(inOrder.encodeSnapshot(), reversed.encodeSnapshot());
        assertEquals(inOrder.values(), scrambled.values());
    }

    @Test
    void concurrentWritesResolveByClockThenReplica() {
        var alice = new LwwCanvasDocument("alice");
        var bob = new LwwCanvasDocument("bob");

        byte[] fromAlice = alice.put("rect-1", node("{\"x\":1}"));
        byte[] fromBob = bob.put("rect-1", node("{\"x\":2}"));

        var server = new LwwCanvasDocument("server");
        server.applyUpdate(fromBob);
        server.applyUpdate(fromAlice);

        // same clock, "bob" sorts after "alice"
        assertEquals(node("{\"x\":2}"), server.get("rect-1").orElseThrow());
    }

    @Test
    void localWriteAfterMergeWinsOverWhatItSaw() {
        var alice = new LwwCanvasDocument("alice");
        var zed = new LwwCanvasDocument("zed");

        zed.put("n", node("1"));
        zed.put("n", node("2"));
        byte[] fromZed = zed.put("n", node("3"));

        alice.applyUpdate(fromZed);
        byte[] fromAlice = alice.put("n", node("4"));

        zed.applyUpdate(fromAlice);
        assertEquals(node("4"), zed.get("n").orElseThrow());
    }

    @Test
    void removalIsATombstoneThatLaterWritesRevive() {
        var alice = new LwwCanvasDocument("alice");
        var bob = new LwwCanvasDocument("bob");

        bob.applyUpdate(alice.put("rect-1", node("{\"x\":1}")));
        byte[] removal = bob.remove("rect-1");
        alice.applyUpdate(removal);

        assertTrue(alice.get("rect-1").isEmpty());
        assertTrue(alice.values().isEmpty());
        assertFalse(alice.isEmpty());

        bob.applyUpdate(alice.put("rect-1", node("{\"x\":5}")));
        assertEquals(node("{\"x\":5}"), bob.get("rect-1").orElseThrow());
    }

    @Test
    void restoreRebuildsStateFromSnapshot() {
        var original = new LwwCanvasDocument("alice");
        original.put("a", node("{\"w\":100}"));
        original.put("b", node("[1,2,3]"));
        original.remove("b");

        var restored = new LwwCanvasDocument("server");
        restored.restore(original.encodeSnapshot());

        assertArrayEquals(original.encodeSnapshot(), restored.encodeSnapshot());
        assertEquals(Map.of("a", node("{\"w\":100}")), restored.values());
    }

    @Test
    void emptyDocumentSnapshotRestoresToEmpty() {
        var restored = new LwwCanvasDocument("server");
        restored.restore(new LwwCanvasDocument("other").encodeSnapshot());

        assertTrue(restored.isEmpty());
    }

    @Test
    void deltaAgainstPriorSnapshotCarriesOnlyNewerEntries() {
        var alice = new LwwCanvasDocument("alice");
        alice.put("a", node("1"));
        alice.put("b", node("2"));
        byte[] prior = alice.encodeSnapshot();

        alice.put("b", node("3"));
        alice.put("c", node("4"));
        byte[] delta = alice.encodeDelta(prior);

        var onlyDelta = new LwwCanvasDocument("probe");
        onlyDelta.applyUpdate(delta);
        assertEquals(Map.of("b", node("3"), "c", node("4")), onlyDelta.values());

        var caughtUp = new LwwCanvasDocument("bob");
        caughtUp.restore(prior);
        caughtUp.applyUpdate(delta);
        assertArrayEquals(alice.encodeSnapshot(), caughtUp.encodeSnapshot());
    }

    @Test
    void malformedUpdatesLeaveTheDocumentUntouched() throws Exception {
        var doc = new LwwCanvasDocument("server");
        doc.applyUpdate(new LwwCanvasDocument("alice").put("a", node("1")));
        byte[] before = doc.encodeSnapshot();

        var cbor = new CBORMapper();
        byte[] missingValue = cbor.writeValueAsBytes(Map.of("v", 1, "entries",
            List.of(Map.of("key", "b", "clock", 9, "replica", "x", "deleted", false))));
        byte[] futureVersion = cbor.writeValueAsBytes(Map.of("v", 2, "entries", List.of()));
        byte[] halfValid = cbor.writeValueAsBytes(Map.of("v", 1, "entries", List.of(
            Map.of("key", "c", "clock", 3, "replica", "x", "deleted", false, "value", 1),
            Map.of("key", "", "clock", 4, "replica", "x", "deleted", false, "value", 2))));

        assertThrows(MalformedUpdateException.class, () -> doc.applyUpdate(new byte[0]));
        assertThrows(MalformedUpdateException.class, () -> doc.applyUpdate(new byte[] {1, 2, 3}));
        assertThrows(MalformedUpdateException.class, () -> doc.applyUpdate(missingValue));
        assertThrows(MalformedUpdateException.class, () -> doc.applyUpdate(futureVersion));
        assertThrows(MalformedUpdateException.class, () -> doc.applyUpdate(halfValid));

        assertArrayEquals(before, doc.encodeSnapshot());
    }

    @Test
    void clocksAtTheTopOfTheRangeAreRejectedOrExhaustLocalWrites() {
        var doc = new LwwCanvasDocument("server");
        byte[] overflowing = DeltaCodec.encode(List.of(LwwEntry.write("a", Long.MAX_VALUE, "x", node("1"))));

        assertThrows(MalformedUpdateException.class, () -> doc.applyUpdate(overflowing));
        assertTrue(doc.isEmpty());

        doc.applyUpdate(DeltaCodec.encode(List.of(LwwEntry.write("a", LwwEntry.MAX_CLOCK, "x", node("1")))));

        assertThrows(IllegalStateException.class, () -> doc.put("b", node("2")));
        assertThrows(IllegalStateException.class, () -> doc.remove("a"));
        assertEquals(node("1"), doc.get("a").orElseThrow());
        assertTrue(doc.get("b").isEmpty());
    }

    @Test
    void writeAfterMergingANearMaximalClockStaysDecodable() {
        var doc = new LwwCanvasDocument("server");
        doc.applyUpdate(DeltaCodec.encode(List.of(LwwEntry.write("a", LwwEntry.MAX_CLOCK - 1, "x", node("1")))));

        byte[] delta = doc.put("a", node("2"));

        var replica = new LwwCanvasDocument("replica");
        replica.applyUpdate(delta);
        assertEquals(node("2"), replica.get("a").orElseThrow());
    }

    private static JsonNode node(String json) {
        try {
            return mapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(json, e);
        }
    }
}
