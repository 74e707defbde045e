package com.helpdesk.remoteservice.input;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.helpdesk.remoteservice.desktop.DesktopUnavailableException;

@DisplayName("InputAuthorizer")
class InputAuthorizerTest {

    private static final String CONN = "c1";

    private RecordingInputDevice device;
    private InputAuthorizer authorizer;

    @BeforeEach
    void setUp() {
        device = new RecordingInputDevice(1920, 1080);
        authorizer = new InputAuthorizer(device);
    }

    @Nested
    @DisplayName("authorization")
    class AuthorizationTests {

        @Test
        @DisplayName("every action is refused for an unknown connection without touching the device")
        void unauthorizedRefused() {
            assertFalse(authorizer.pointerMove(CONN, 10, 10, 100, 100));
            assertFalse(authorizer.pointerClick(CONN, 10, 10, 100, 100, PointerButton.LEFT, ClickKind.SINGLE));
            assertFalse(authorizer.pointerScroll(CONN, 10, 10, 100, 100, 3));
            assertFalse(authorizer.keyAction(CONN, "Enter", KeyAction.PRESS));
            assertFalse(authorizer.keyCombination(CONN, List.of("ctrl", "c")));
            assertFalse(authorizer.textInput(CONN, "hello"));

            assertTrue(device.calls().isEmpty());
        }

        @Test
        @DisplayName("revoked connections lose control")
        void revoke() {
            authorizer.authorize(CONN);
            assertTrue(authorizer.textInput(CONN, "a"));

            authorizer.revoke(CONN);

            assertFalse(authorizer.isAuthorized(CONN));
            assertFalse(authorizer.textInput(CONN, "b"));
            assertEquals(List.of("type a"), device.calls());
        }

        @Test
        @DisplayName("authorize is idempotent and revoke of unknown ids is a no-op")
        void idempotent() {
            authorizer.authorize(CONN);
            authorizer.authorize(CONN);
            authorizer.revoke("ghost");

            assertEquals(1, authorizer.authorizedCount());
        }

        @Test
        @DisplayName("blank connection ids cannot be authorized")
        void blankRejected() {
            assertThrows(IllegalArgumentException.class, () -> authorizer.authorize(" "));
        }
    }

    @Nested
    @DisplayName("coordinate remapping")
    class RemapTests {

        @BeforeEach
        void grant() {
            authorizer.authorize(CONN);
        }

        @Test
        @DisplayName("same-size source maps one to one")
        void identity() {
            assertTrue(authorizer.pointerMove(CONN, 640, 360, 1920, 1080));

            assertEquals("move 640,360", device.lastCall());
        }

        @Test
        @DisplayName("scales proportionally and rounds")
        void scales() {
            assertTrue(authorizer.pointerMove(CONN, 400, 300, 800, 600));
            assertEquals("move 960,540", device.lastCall());

            assertTrue(authorizer.pointerMove(CONN, 1, 1, 3, 3));
            assertEquals("move 640,360", device.lastCall());
        }

        @Test
        @DisplayName("clamps out-of-range coordinates into the screen")
        void clamps() {
            assertTrue(authorizer.pointerMove(CONN, -5, 1085, 1920, 1080));

            assertEquals("move 0,1079", device.lastCall());
            assertEquals(new PointerPosition(0, 1079), authorizer.lastPointer());
        }

        @Test
        @DisplayName("a zero-sized source fails the action")
        void zeroSource() {
            assertFalse(authorizer.pointerMove(CONN, 10, 10, 0, 600));
            assertFalse(authorizer.pointerMove(CONN, 10, 10, 800, Double.NaN));

            assertTrue(device.calls().isEmpty());
            assertNull(authorizer.lastPointer());
        }
    }

    @Nested
    @DisplayName("pointer actions")
    class PointerTests {

        @BeforeEach
        void grant() {
            authorizer.authorize(CONN);
        }

        @Test
        @DisplayName("click kinds map to the matching device calls")
        void clickKinds() {
            authorizer.pointerClick(CONN, 10, 20, 1920, 1080, PointerButton.LEFT, ClickKind.SINGLE);
            authorizer.pointerClick(CONN, 10, 20, 1920, 1080, PointerButton.RIGHT, ClickKind.DOUBLE);
            authorizer.pointerClick(CONN, 10, 20, 1920, 1080, PointerButton.LEFT, ClickKind.DOWN);
            authorizer.pointerClick(CONN, 30, 40, 1920, 1080, PointerButton.LEFT, ClickKind.UP);

            assertEquals(List.of(
                    "click LEFT 10,20",
                    "double RIGHT 10,20",
                    "down LEFT 10,20",
                    "up LEFT 30,40"), device.calls());
        }

        @Test
        @DisplayName("scroll passes the delta through at the remapped position")
        void scroll() {
            assertTrue(authorizer.pointerScroll(CONN, 100, 100, 1920, 1080, -3));

            assertEquals("scroll -3 100,100", device.lastCall());
        }

        @Test
        @DisplayName("a device failure is reported and the next action still works")
        void deviceFailure() {
            device.failNext(new DesktopUnavailableException("no display"));

            assertFalse(authorizer.pointerMove(CONN, 1, 1, 1920, 1080));
            assertTrue(authorizer.pointerMove(CONN, 2, 2, 1920, 1080));
            assertEquals(List.of("move 2,2"), device.calls());
        }
    }

    @Nested
    @DisplayName("keyboard")
    class KeyboardTests {

        @BeforeEach
        void grant() {
            authorizer.authorize(CONN);
        }

        @Test
        @DisplayName("browser key names are translated")
        void translatesNames() {
            authorizer.keyAction(CONN, "Enter", KeyAction.PRESS);
            authorizer.keyAction(CONN, "ArrowLeft", KeyAction.PRESS);
            authorizer.keyAction(CONN, "Escape", KeyAction.DOWN);
            authorizer.keyAction(CONN, "F5", KeyAction.UP);
            authorizer.keyAction(CONN, "a", KeyAction.PRESS);

            assertEquals(List.of(
                    "press enter",
                    "press left",
                    "keydown esc",
                    "keyup f5",
                    "press a"), device.calls());
        }

        @Test
        @DisplayName("unmapped keys are lower-cased, single characters included")
        void lowerCasesUnmappedKeys() {
            assertTrue(authorizer.keyAction(CONN, "A", KeyAction.PRESS));
            assertEquals("press a", device.lastCall());

            assertTrue(authorizer.keyAction(CONN, "CapsLock", KeyAction.PRESS));
            assertEquals("press capslock", device.lastCall());
        }

        @Test
        @DisplayName("combinations normalize modifier aliases")
        void combos() {
            assertTrue(authorizer.keyCombination(CONN, List.of("Control", "Shift", "Escape")));
            assertTrue(authorizer.keyCombination(CONN, List.of("cmd", "C")));

            assertEquals(List.of("hotkey ctrl+shift+esc", "hotkey win+c"), device.calls());
        }

        @Test
        @DisplayName("empty combinations and keys fail")
        void emptyInputs() {
            assertFalse(authorizer.keyCombination(CONN, List.of()));
            assertFalse(authorizer.keyAction(CONN, "", KeyAction.PRESS));

            assertTrue(device.calls().isEmpty());
        }

        @Test
        @DisplayName("text is typed verbatim; empty text succeeds without typing")
        void text() {
            assertTrue(authorizer.textInput(CONN, "Hello, World"));
            assertTrue(authorizer.textInput(CONN, ""));
            assertFalse(authorizer.textInput(CONN, null));

            assertEquals(List.of("type Hello, World"), device.calls());
        }

        @Test
        @DisplayName("long text is abbreviated for logging")
        void abbreviate() {
            String text = "x".repeat(80);

            assertEquals("x".repeat(50) + "...", InputAuthorizer.abbreviate(text));
            assertEquals("short", InputAuthorizer.abbreviate("short"));
            assertEquals("y".repeat(53), InputAuthorizer.abbreviate("y".repeat(53)));
        }
    }

    @Test
    @DisplayName("stats report screen size and authorized connections")
    void stats() {
        authorizer.authorize("c1");
        authorizer.authorize("c2");

        InputStats stats = authorizer.stats();

        assertEquals(1920, stats.screenWidth());
        assertEquals(1080, stats.screenHeight());
        assertEquals(2, stats.authorizedConnections());
        assertEquals(new PointerPosition(0, 0), stats.pointer());
    }

    @Nested
    @DisplayName("serialization")
    class SerializationTests {

        @Test
        @DisplayName("concurrent actions of every kind never reach the device at the same time")
        void actionsNeverOverlap() throws Exception {
            device.dwell(1);
            authorizer.authorize(CONN);
            List<Runnable> kinds = List.of(
                    () -> authorizer.pointerMove(CONN, 10, 10, 1920, 1080),
                    () -> authorizer.pointerClick(CONN, 10, 10, 1920, 1080, PointerButton.LEFT, ClickKind.SINGLE),
                    () -> authorizer.pointerScroll(CONN, 10, 10, 1920, 1080, 1),
                    () -> authorizer.keyAction(CONN, "a", KeyAction.PRESS),
                    () -> authorizer.keyCombination(CONN, List.of("ctrl", "c")),
                    () -> authorizer.textInput(CONN, "hi"));
            int rounds = 20;
            ExecutorService pool = Executors.newFixedThreadPool(kinds.size());
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (Runnable kind : kinds) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        for (int i = 0; i < rounds; i++) {
                            kind.run();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertFalse(device.overlapped());
            assertEquals(kinds.size() * rounds, device.calls().size());
        }
    }
}
