package org.hypertrace.core.panelquery.utils;

import io.reactivex.rxjava3.core.Single;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

public class RxFutureUtil {

  private RxFutureUtil() {}

  /**
   * Unlike {@link Single#fromCompletionStage}, disposing the returned single cancels the future.
   * The future is created per subscription.
   */
  public static <T> Single<T> toSingle(Supplier<CompletableFuture<T>> futureSupplier) {
    return Single.create(
        emitter -> {
          CompletableFuture<T> future = futureSupplier.get();
          emitter.setCancellable(() -> future.cancel(true));
          future.whenComplete(
              (value, error) -> {
                if (error != null) {
                  emitter.tryOnError(unwrap(error));
                } else {
                  emitter.onSuccess(value);
                }
              });
        });
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }
}
