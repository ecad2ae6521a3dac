package me.golemcore.browser.capture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RingBufferTest {

    @Test
    void shouldKeepInsertionOrderBelowCapacity() {
        RingBuffer<String> buffer = new RingBuffer<>(3);
        buffer.append("a");
        buffer.append("b");

        assertEquals(List.of("a", "b"), buffer.snapshot());
        assertEquals(2, buffer.size());
    }

    @Test
    void shouldEvictOldestWhenFull() {
        RingBuffer<Integer> buffer = new RingBuffer<>(3);
        for (int i = 1; i <= 5; i++) {
            buffer.append(i);
        }

        assertEquals(List.of(3, 4, 5), buffer.snapshot());
        assertEquals(3, buffer.size());
        assertEquals(3, buffer.capacity());
    }

    @Test
    void shouldClearAtomicallyWithSnapshot() {
        RingBuffer<String> buffer = new RingBuffer<>(2);
        buffer.append("x");
        buffer.append("y");

        assertEquals(List.of("x", "y"), buffer.snapshotAndClear());
        assertTrue(buffer.snapshot().isEmpty());
    }

    @Test
    void snapshotShouldBeDetachedFromBuffer() {
        RingBuffer<String> buffer = new RingBuffer<>(2);
        buffer.append("x");
        List<String> snapshot = buffer.snapshot();
        buffer.append("y");

        assertEquals(List.of("x"), snapshot);
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, -1 })
    void shouldRejectNonPositiveCapacity(int capacity) {
        assertThrows(IllegalArgumentException.class, () -> new RingBuffer<>(capacity));
    }
}
