package org.hypertrace.core.panelquery.utils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.disposables.Disposable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.hypertrace.core.panelquery.api.BuildException;
import org.junit.jupiter.api.Test;

public class RxFutureUtilTest {

  @Test
  public void testValue() {
    assertEquals(
        "ok", RxFutureUtil.toSingle(() -> CompletableFuture.completedFuture("ok")).blockingGet());
  }

  @Test
  public void testFutureIsCreatedPerSubscription() {
    AtomicInteger created = new AtomicInteger();
    Single<Integer> single =
        RxFutureUtil.toSingle(() -> CompletableFuture.completedFuture(created.incrementAndGet()));

    assertEquals(0, created.get());
    single.blockingGet();
    single.blockingGet();
    assertEquals(2, created.get());
  }

  @Test
  public void testCompletionExceptionIsUnwrapped() {
    CompletableFuture<String> future = new CompletableFuture<>();
    future.completeExceptionally(new CompletionException(new BuildException("bad target")));

    RxFutureUtil.toSingle(() -> future).test().assertError(BuildException.class);
  }

  @Test
  public void testDisposeCancelsTheFuture() {
    CompletableFuture<String> future = new CompletableFuture<>();

    Disposable disposable = RxFutureUtil.toSingle(() -> future).subscribe(value -> {}, error -> {});
    disposable.dispose();

    assertTrue(future.isCancelled());
  }
}
