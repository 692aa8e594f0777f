package com.p14n.pubsub.lifecycle;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleScopeTest {

    @Test
    void shouldCancelChildrenWithParent() {
        var root = LifecycleScope.root("app");
        var child = root.child("bridge");
        var grandchild = child.child("loop");

        root.cancel();

        assertTrue(root.isCancelled());
        assertTrue(child.isCancelled());
        assertTrue(grandchild.isCancelled());
        assertEquals("app/bridge/loop", grandchild.name());
    }

    @Test
    void shouldNotCancelParentWithChild() {
        var root = LifecycleScope.root("app");
        var child = root.child("bridge");

        child.cancel();

        assertTrue(child.isCancelled());
        assertFalse(root.isCancelled());
    }

    @Test
    void shouldRunCallbacksOnce() {
        var root = LifecycleScope.root("app");
        var calls = new AtomicInteger();
        root.onCancel(calls::incrementAndGet);

        root.cancel();
        root.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void shouldRunLateCallbackImmediately() {
        var root = LifecycleScope.root("app");
        root.cancel();
        var calls = new AtomicInteger();

        root.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
        assertTrue(root.child("late").isCancelled());
    }

    @Test
    void shouldRunRemainingCallbacksWhenOneFails() {
        var root = LifecycleScope.root("app");
        var calls = new AtomicInteger();
        root.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        root.onCancel(calls::incrementAndGet);

        root.cancel();

        assertEquals(1, calls.get());
    }
}
