package datadog.internal.context;

import static datadog.internal.context.ExecutionContexts.currentContext;
import static datadog.internal.context.ExecutionContexts.rootContext;
import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Phaser;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExecutionContextsTest {
  static final String DATA_KEY = "my.cool.data";

  @BeforeEach
  void init() {
    // Ensure no current context prior starting test
    assertSame(rootContext(), currentContext());
    ExecutionContexts.resetListeners();
  }

  @AfterEach
  void cleanup() {
    ExecutionContexts.resetListeners();
  }

  @Test
  void testRootContext() {
    ExecutionContext root = rootContext();
    assertEquals(ExecutionContext.ROOT_CONTEXT_ID, root.getIdentifier());
    assertTrue(root.parents().isEmpty());
    assertTrue(root.children().isEmpty());
  }

  @Test
  void testScopeMakesContextCurrent() {
    try (ContextScope scope = ExecutionContexts.enterScope("foobar")) {
      assertSame(scope.context(), currentContext());
      assertSame(rootContext(), currentContext().parent());
      try (ContextScope nested = ExecutionContexts.enterScope("nested")) {
        assertSame(nested.context(), currentContext());
        assertSame(scope.context(), nested.context().parent());
      }
      assertSame(scope.context(), currentContext());
    }
    assertSame(rootContext(), currentContext());
  }

  @Test
  void testScopeData() {
    try (ContextScope ignored =
        ExecutionContexts.enterScope("foobar", Collections.singletonMap(DATA_KEY, "ban.ana"))) {
      assertEquals("ban.ana", ExecutionContexts.getItem(DATA_KEY));
    }
    assertNull(ExecutionContexts.getItem(DATA_KEY));
  }

  @Test
  void testScopeDataInheritance() {
    try (ContextScope outer =
        ExecutionContexts.enterScope("foobar", Collections.singletonMap(DATA_KEY, "ban.ana"))) {
      try (ContextScope ignored = ExecutionContexts.enterScope("baz")) {
        assertEquals("ban.ana", ExecutionContexts.getItem(DATA_KEY));
      }
      try (ContextScope ignored =
          ExecutionContexts.enterScope("foobaz", Collections.singletonMap(DATA_KEY, "baz.inga"))) {
        assertEquals("baz.inga", ExecutionContexts.getItem(DATA_KEY));
        assertEquals("ban.ana", ExecutionContexts.getItem(DATA_KEY, outer.context()));
      }
      assertEquals("ban.ana", ExecutionContexts.getItem(DATA_KEY));
    }
  }

  @Test
  void testParentMutationAfterChildCreation() {
    try (ContextScope parent =
        ExecutionContexts.enterScope("parent", Collections.singletonMap(DATA_KEY, "before"))) {
      ExecutionContext child = ExecutionContexts.createContext("child");
      ExecutionContexts.setItem(DATA_KEY, "after");

      assertEquals("before", child.getItem(DATA_KEY));
      assertEquals("after", parent.context().getItem(DATA_KEY));
    }
  }

  @Test
  void testSetItemsTargetsCurrentContextOnly() {
    try (ContextScope outer = ExecutionContexts.enterScope("outer")) {
      try (ContextScope inner = ExecutionContexts.enterScope("inner")) {
        ExecutionContexts.setItems(Collections.singletonMap(DATA_KEY, "inner-value"));
        ExecutionContexts.setItem("explicit", "outer-value", outer.context());
        assertEquals("inner-value", inner.context().getItem(DATA_KEY));
      }
      assertNull(ExecutionContexts.getItem(DATA_KEY));
      assertEquals("outer-value", ExecutionContexts.getItem("explicit"));
    }
  }

  @Test
  void testRootIdentifierIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ExecutionContexts.createContext(ExecutionContext.ROOT_CONTEXT_ID));
    assertSame(rootContext(), currentContext());
  }

  @Test
  void testContextEndedIsDispatched() {
    String contextId = "my.cool.context";
    AtomicInteger ended = new AtomicInteger();
    ExecutionContexts.on("context.ended." + contextId, args -> ended.incrementAndGet());

    ContextScope scope = ExecutionContexts.enterScope(contextId);
    assertEquals(0, ended.get());
    scope.close();
    assertEquals(1, ended.get());
    scope.close();
    assertEquals(1, ended.get());
    assertSame(rootContext(), currentContext());
  }

  @Test
  void testContextEndedIsDispatchedOnError() {
    AtomicInteger ended = new AtomicInteger();
    ExecutionContexts.on("context.ended.failing", args -> ended.incrementAndGet());

    assertThrows(
        IllegalStateException.class,
        () -> {
          try (ContextScope ignored = ExecutionContexts.enterScope("failing")) {
            throw new IllegalStateException("operation failed");
          }
        });

    assertEquals(1, ended.get());
    assertSame(rootContext(), currentContext());
  }

  @Test
  void testEventFunctionsUseCurrentContext() {
    String event = "my.cool.event";
    assertFalse(ExecutionContexts.hasListeners(event));
    ExecutionContexts.on(event, args -> "from.event." + args[0]);
    assertTrue(ExecutionContexts.hasListeners(event));
    assertEquals("from.event.42", ExecutionContexts.dispatch(event, 42).getResult(0));

    try (ContextScope ignored = ExecutionContexts.enterScope("scoped")) {
      assertFalse(ExecutionContexts.hasListeners(event));
      ExecutionContexts.on(event, args -> "scoped");
      assertEquals("scoped", ExecutionContexts.dispatch(event).getResult(0));

      ExecutionContexts.resetListeners();
      assertFalse(ExecutionContexts.hasListeners(event));
    }
    assertFalse(ExecutionContexts.hasListeners(event));
  }

  @Test
  void testThreadIndependence() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    Phaser phaser = new Phaser(2);
    Map<String, Object> results = new ConcurrentHashMap<>();
    try (ContextScope main =
        ExecutionContexts.enterScope("main", Collections.singletonMap("banana", "bazinga"))) {
      Future<?> future =
          executor.submit(
              () -> {
                try {
                  // the other thread starts from the root
                  results.put("initial", currentContext().getIdentifier());
                  try (ContextScope thread =
                      ExecutionContexts.enterScope("in.thread", main.context(), null)) {
                    results.put("thread.parent", currentContext().parent().getIdentifier());
                    results.put("thread.data", ExecutionContexts.getItem("banana"));
                    try (ContextScope nested = ExecutionContexts.enterScope("in.nested")) {
                      results.put("nested.parent", nested.context().parent().getIdentifier());
                      phaser.arriveAndAwaitAdvance();
                      phaser.arriveAndAwaitAdvance();
                    }
                  }
                  results.put("final", currentContext().getIdentifier());
                } finally {
                  phaser.arriveAndDeregister();
                }
              });

      phaser.arriveAndAwaitAdvance();
      // the other thread is inside its nested scope
      assertSame(main.context(), currentContext());
      phaser.arriveAndAwaitAdvance();
      future.get(5, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }

    assertEquals(ExecutionContext.ROOT_CONTEXT_ID, results.get("initial"));
    assertEquals("main", results.get("thread.parent"));
    assertEquals("bazinga", results.get("thread.data"));
    assertEquals("in.thread", results.get("nested.parent"));
    assertEquals(ExecutionContext.ROOT_CONTEXT_ID, results.get("final"));
  }

  @Test
  void testClosingOutOfOrderKeepsCurrent() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      // run on a dedicated thread, the unbalanced close leaves its current context behind
      Future<?> future =
          executor.submit(
              () -> {
                AtomicInteger ended = new AtomicInteger();
                ContextScope outer = ExecutionContexts.enterScope("outer");
                try (ContextScope inner = ExecutionContexts.enterScope("inner")) {
                  inner.context().eventHub().subscribe(
                      "context.ended.outer", args -> ended.incrementAndGet());
                  outer.close();
                  assertSame(inner.context(), currentContext());
                  assertEquals(1, ended.get());
                }
                assertSame(outer.context(), currentContext());
                outer.close();
                assertEquals(1, ended.get());
              });
      future.get(5, TimeUnit.SECONDS);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testScopesAreListedAsChildrenOfTheirParent() {
    try (ContextScope outer = ExecutionContexts.enterScope("outer")) {
      try (ContextScope first = ExecutionContexts.enterScope("first");
          ContextScope second = ExecutionContexts.enterScope("second", outer.context(), null)) {
        assertEquals(asList(first.context(), second.context()), outer.context().children());
        assertSame(outer.context(), second.context().parent());
        assertTrue(first.context().children().isEmpty());
      }
    }
    assertTrue(rootContext().children().isEmpty());
  }

  @Test
  void testConcurrentCloseEndsContextOnce() throws Exception {
    AtomicInteger ended = new AtomicInteger();
    rootContext().eventHub().subscribe("context.ended.shared", args -> ended.incrementAndGet());
    ContextScope scope = ExecutionContexts.enterScope("shared");

    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  scope.close();
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

    assertEquals(1, ended.get());
    assertSame(rootContext(), currentContext());
  }
}
