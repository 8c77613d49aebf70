package com.harness.alerting.common;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Either a value or the error that prevented computing it.
 *
 * <p>Handler, hook and query calls in the rule engine return a {@code Result} so every call
 * site states explicitly what a failure means for it (no match, no futures, empty rates).
 *
 * @param <A> the success value type
 */
public sealed interface Result<A> permits Result.Success, Result.Failure {

  boolean isSuccess();

  A getOrElse(A defaultValue);

  Optional<Throwable> error();

  Result<A> onFailure(Consumer<Throwable> action);

  static <A> Result<A> success(A value) {
    return new Success<>(value);
  }

  static <A> Result<A> failure(Throwable error) {
    return new Failure<>(error);
  }

  static <A> Result<A> of(ThrowingSupplier<A> supplier) {
    try {
      A value = supplier.get();
      if (value == null) {
        return failure(new NullPointerException("supplier returned null"));
      }
      return success(value);
    } catch (Exception e) {
      return failure(e);
    }
  }

  static Result<Boolean> run(ThrowingRunnable action) {
    try {
      action.run();
      return success(Boolean.TRUE);
    } catch (Exception e) {
      return failure(e);
    }
  }

  record Success<A>(A value) implements Result<A> {
    public Success {
      Objects.requireNonNull(value, "Success value cannot be null");
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public A getOrElse(A defaultValue) {
      return value;
    }

    @Override
    public Optional<Throwable> error() {
      return Optional.empty();
    }

    @Override
    public Result<A> onFailure(Consumer<Throwable> action) {
      return this;
    }
  }

  record Failure<A>(Throwable cause) implements Result<A> {
    public Failure {
      Objects.requireNonNull(cause, "Failure cause cannot be null");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public A getOrElse(A defaultValue) {
      return defaultValue;
    }

    @Override
    public Optional<Throwable> error() {
      return Optional.of(cause);
    }

    @Override
    public Result<A> onFailure(Consumer<Throwable> action) {
      action.accept(cause);
      return this;
    }
  }

  @FunctionalInterface
  interface ThrowingSupplier<A> {
    A get() throws Exception;
  }

  @FunctionalInterface
  interface ThrowingRunnable {
    void run() throws Exception;
  }
}
