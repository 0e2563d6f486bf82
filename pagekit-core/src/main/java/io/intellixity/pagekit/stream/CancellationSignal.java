package io.intellixity.pagekit.stream;

/** Caller-owned cancellation flag, polled between emitted rows. */
@FunctionalInterface
public interface CancellationSignal {
  CancellationSignal NONE = () -> false;

  boolean isCancelled();
}
