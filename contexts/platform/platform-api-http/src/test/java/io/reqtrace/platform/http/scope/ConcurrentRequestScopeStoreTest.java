package io.reqtrace.platform.http.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.servlet.http.HttpServletRequestWrapper;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ConcurrentRequestScopeStoreTest {

  private final ConcurrentRequestScopeStore store = new ConcurrentRequestScopeStore();

  @Test
  void getBeforeBindIsEmpty() {
    assertThat(store.get(new MockHttpServletRequest(), "_token")).isEmpty();
    assertThat(store.get(null, "_token")).isEmpty();
  }

  @Test
  void bindOverwritesPreviousValue() {
    MockHttpServletRequest request = new MockHttpServletRequest();

    store.bind(request, "_token", "first");
    store.bind(request, "_token", "second");

    assertThat(store.get(request, "_token")).contains("second");
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void releaseDropsAllBindings() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    store.bind(request, "_token", "abc");
    store.bind(request, "other", 42);

    store.release(request);

    assertThat(store.get(request, "_token")).isEmpty();
    assertThat(store.get(request, "other")).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void unbindDropsEntryOnceEmpty() {
    MockHttpServletRequest request = new MockHttpServletRequest();
    store.bind(request, "a", "1");
    store.bind(request, "b", "2");

    store.unbind(request, "a");
    assertThat(store.get(request, "b")).contains("2");
    assertThat(store.size()).isEqualTo(1);

    store.unbind(request, "b");
    assertThat(store.size()).isZero();
  }

  @Test
  void keysByIdentityNotEquality() {
    EqualToEverythingRequest a = new EqualToEverythingRequest();
    EqualToEverythingRequest b = new EqualToEverythingRequest();
    store.bind(a, "_token", "for-a");

    assertThat(store.get(b, "_token")).isEmpty();
    store.bind(b, "_token", "for-b");
    assertThat(store.get(a, "_token")).contains("for-a");
    assertThat(store.get(b, "_token")).contains("for-b");
  }

  @Test
  void wrappedRequestSeesBindingsOfOriginal() {
    MockHttpServletRequest original = new MockHttpServletRequest();
    store.bind(original, "_token", "abc");

    HttpServletRequestWrapper wrapped =
        new HttpServletRequestWrapper(new HttpServletRequestWrapper(original));

    assertThat(store.get(wrapped, "_token")).contains("abc");
  }

  @Test
  void releaseThroughWrapperDropsOriginalBindings() {
    MockHttpServletRequest original = new MockHttpServletRequest();
    store.bind(original, "_token", "abc123");
    HttpServletRequestWrapper wrapped = new HttpServletRequestWrapper(original);

    store.release(wrapped);

    assertThat(store.get(wrapped, "_token")).isEmpty();
    assertThat(store.get(original, "_token")).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void unbindThroughWrapperDropsOriginalBinding() {
    MockHttpServletRequest original = new MockHttpServletRequest();
    store.bind(original, "_token", "abc123");

    store.unbind(new HttpServletRequestWrapper(original), "_token");

    assertThat(store.get(original, "_token")).isEmpty();
    assertThat(store.size()).isZero();
  }

  @Test
  void bindThroughWrapperSharesOriginalEntry() {
    MockHttpServletRequest original = new MockHttpServletRequest();
    HttpServletRequestWrapper wrapped = new HttpServletRequestWrapper(original);

    store.bind(original, "_token", "first");
    store.bind(wrapped, "_token", "second");

    assertThat(store.get(original, "_token")).contains("second");
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void rejectsNullValue() {
    assertThatThrownBy(() -> store.bind(new MockHttpServletRequest(), "_token", null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void concurrentRequestsNeverObserveEachOther() throws Exception {
    int requests = 64;
    ExecutorService pool = Executors.newFixedThreadPool(16);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < requests; i++) {
        String value = "token-" + i;
        results.add(
            pool.submit(
                () -> {
                  MockHttpServletRequest request = new MockHttpServletRequest();
                  start.await();
                  boolean isolated = true;
                  for (int round = 0; round < 500; round++) {
                    store.bind(request, "_token", value);
                    isolated &= store.get(request, "_token").map(value::equals).orElse(false);
                  }
                  store.release(request);
                  return isolated && store.get(request, "_token").isEmpty();
                }));
      }
      start.countDown();
      for (Future<Boolean> result : results) {
        assertThat(result.get(10, TimeUnit.SECONDS)).isTrue();
      }
    } finally {
      pool.shutdownNow();
    }
    assertThat(store.size()).isZero();
  }

  /** Request whose equals/hashCode would collapse all instances in a content-keyed map. */
  private static final class EqualToEverythingRequest extends MockHttpServletRequest {
    @Override
    public boolean equals(Object o) {
      return true;
    }

    @Override
    public int hashCode() {
      return 1;
    }
  }
}
