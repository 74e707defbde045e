package com.helpdesk.remoteservice.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.helpdesk.remoteservice.desktop.DesktopUnavailableException;

@DisplayName("FrameProducer")
class FrameProducerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    private FakeScreen screen;
    private ExecutorService executor;
    private FrameProducer producer;

    @BeforeEach
    void setUp() {
        screen = new FakeScreen();
        executor = Executors.newSingleThreadExecutor();
        producer = new FrameProducer(screen, new FrameEncoder(1920, 70, "jpg"), executor,
                Clock.fixed(NOW, ZoneOffset.UTC), 50, 70, Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        producer.shutdown();
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("reader set")
    class ReaderTests {

        @Test
        @DisplayName("first reader starts capture and frames appear")
        void firstReaderStarts() {
            assertFalse(producer.isRunning());
            assertTrue(producer.latestFrame().isEmpty());

            producer.addReader("c1");

            assertTrue(producer.isRunning());
            awaitTrue(() -> producer.latestFrame().isPresent());
            Frame frame = producer.latestFrame().orElseThrow();
            assertEquals(800, frame.width());
            assertEquals(600, frame.height());
            assertEquals(NOW, frame.capturedAt());
        }

        @Test
        @DisplayName("capture stops only when the last reader leaves")
        void lastReaderStops() {
            producer.addReader("c1");
            producer.addReader("c2");

            producer.removeReader("c1");
            assertTrue(producer.isRunning());

            producer.removeReader("c2");
            assertFalse(producer.isRunning());
            assertEquals(0, producer.readerCount());
        }

        @Test
        @DisplayName("adding the same reader twice is idempotent")
        void duplicateAdd() {
            producer.addReader("c1");
            producer.addReader("c1");

            assertEquals(1, producer.readerCount());
            producer.removeReader("c1");
            assertFalse(producer.isRunning());
        }

        @Test
        @DisplayName("removing an unknown reader is a no-op")
        void removeUnknown() {
            producer.addReader("c1");
            producer.removeReader("ghost");

            assertTrue(producer.isRunning());
            assertTrue(producer.hasReader("c1"));
            assertFalse(producer.hasReader("ghost"));
        }

        @Test
        @DisplayName("restart right after stop keeps capturing")
        void restartAfterStop() {
            producer.addReader("c1");
            producer.removeReader("c1");
            producer.addReader("c2");

            int before = screen.captures.get();
            awaitTrue(() -> screen.captures.get() > before + 2);
            assertTrue(producer.isRunning());
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("a failed capture keeps the previous frame")
        void failedCaptureKeepsFrame() throws IOException {
            producer.captureOnce();
            Frame first = producer.latestFrame().orElseThrow();

            screen.failNext = true;
            assertThrows(IllegalStateException.class, producer::captureOnce);

            assertEquals(first, producer.latestFrame().orElseThrow());
        }

        @Test
        @DisplayName("transient errors skip a cycle without stopping the loop")
        void transientErrorSkipped() {
            screen.failNext = true;
            producer.addReader("c1");

            awaitTrue(() -> producer.latestFrame().isPresent());
            assertTrue(producer.isRunning());
        }

        @Test
        @DisplayName("an unavailable desktop halts the loop")
        void desktopUnavailableHalts() {
            screen.unavailable = true;
            producer.addReader("c1");

            awaitTrue(() -> producer.stats().halted());
            assertFalse(producer.isRunning());
            assertTrue(producer.hasReader("c1"));

            screen.unavailable = false;
            producer.addReader("c2");
            assertTrue(producer.isRunning());
            assertFalse(producer.stats().halted());
        }
    }

    @Test
    @DisplayName("stats report configuration and readers")
    void stats() {
        producer.addReader("c1");

        CaptureStats stats = producer.stats();

        assertTrue(stats.running());
        assertEquals(1, stats.clients());
        assertEquals(50, stats.fps());
        assertEquals(70, stats.quality());
        assertFalse(stats.halted());
    }

    @Test
    @DisplayName("frames are immutable copies")
    void frameCopies() {
        byte[] bytes = {1, 2, 3};
        Frame frame = new Frame(bytes, 1, 1, NOW);
        bytes[0] = 9;
        frame.image()[1] = 9;

        assertEquals(1, frame.image()[0]);
        assertEquals(2, frame.image()[1]);
        assertEquals(3, frame.size());
    }

    @Test
    @DisplayName("frames compare by image content")
    void frameEquality() {
        Frame frame = new Frame(new byte[]{1, 2, 3}, 1, 1, NOW);
        Frame same = new Frame(new byte[]{1, 2, 3}, 1, 1, NOW);

        assertEquals(frame, same);
        assertEquals(frame.hashCode(), same.hashCode());
        assertNotEquals(frame, new Frame(new byte[]{1, 2, 4}, 1, 1, NOW));
        assertNotEquals(frame, new Frame(new byte[]{1, 2, 3}, 1, 1, NOW.plusMillis(1)));
    }

    private static void awaitTrue(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("interrupted", e);
            }
        }
    }

    private static final class FakeScreen implements ScreenSource {

        final AtomicInteger captures = new AtomicInteger();
        volatile boolean failNext;
        volatile boolean unavailable;

        @Override
        public BufferedImage capture() {
            captures.incrementAndGet();
            if (unavailable) {
                throw new DesktopUnavailableException("headless");
            }
            if (failNext) {
                failNext = false;
                throw new IllegalStateException("capture glitch");
            }
            return new BufferedImage(800, 600, BufferedImage.TYPE_INT_RGB);
        }
    }
}
