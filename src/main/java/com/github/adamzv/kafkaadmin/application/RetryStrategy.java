package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.ProtocolException;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Per call site error classification for {@link RetryOrchestrator}. The same protocol error
 * can be transient for one operation and final for another, so every operation builds its
 * own strategy. Anything not listed is fatal.
 */
public final class RetryStrategy<T> {

  public enum Verdict {
    RETRY,
    TOLERATE,
    FATAL
  }

  private final String description;
  private final Set<ErrorType> retriable;
  private final Map<ErrorType, Supplier<T>> tolerated;
  private final Map<ErrorType, String> guidance;
  private final Predicate<ProblemException> retriableProblem;
  private final Consumer<ProblemException> beforeRetry;

  private RetryStrategy(Builder<T> builder) {
    this.description = builder.description;
    this.retriable = builder.retriable.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(builder.retriable));
    this.tolerated = Map.copyOf(builder.tolerated);
    this.guidance = Map.copyOf(builder.guidance);
    this.retriableProblem = builder.retriableProblem;
    this.beforeRetry = builder.beforeRetry;
  }

  public static <T> Builder<T> builder(String description) {
    return new Builder<>(description);
  }

  public String description() {
    return description;
  }

  public Verdict classify(ProblemException ex) {
    if (ex instanceof ProtocolException protocol) {
      if (tolerated.containsKey(protocol.type())) {
        return Verdict.TOLERATE;
      }
      if (retriable.contains(protocol.type())) {
        return Verdict.RETRY;
      }
      return Verdict.FATAL;
    }
    return retriableProblem.test(ex) ? Verdict.RETRY : Verdict.FATAL;
  }

  T toleratedValue(ProblemException ex) {
    Supplier<T> value = tolerated.get(((ProtocolException) ex).type());
    return value.get();
  }

  String guidanceFor(ProblemException ex) {
    if (ex instanceof ProtocolException protocol) {
      return guidance.get(protocol.type());
    }
    return null;
  }

  void beforeRetry(ProblemException ex) {
    beforeRetry.accept(ex);
  }

  public static final class Builder<T> {

    private final String description;
    private final Set<ErrorType> retriable = EnumSet.noneOf(ErrorType.class);
    private final Map<ErrorType, Supplier<T>> tolerated = new EnumMap<>(ErrorType.class);
    private final Map<ErrorType, String> guidance = new EnumMap<>(ErrorType.class);
    private Predicate<ProblemException> retriableProblem = ex -> false;
    private Consumer<ProblemException> beforeRetry = ex -> { };

    private Builder(String description) {
      this.description = description;
    }

    public Builder<T> retryOn(ErrorType... types) {
      retriable.addAll(Set.of(types));
      return this;
    }

    /**
     * Treats {@code type} as a successful no-op that returns {@code value}.
     */
    public Builder<T> tolerate(ErrorType type, T value) {
      tolerated.put(type, () -> value);
      return this;
    }

    /**
     * Message logged at error level before a fatal {@code type} is rethrown.
     */
    public Builder<T> guidance(ErrorType type, String message) {
      guidance.put(type, message);
      return this;
    }

    /**
     * Retry condition for failures that are not single protocol errors.
     */
    public Builder<T> retryWhen(Predicate<ProblemException> predicate) {
      this.retriableProblem = predicate;
      return this;
    }

    public Builder<T> beforeRetry(Consumer<ProblemException> hook) {
      this.beforeRetry = hook;
      return this;
    }

    public RetryStrategy<T> build() {
      return new RetryStrategy<>(this);
    }
  }
}
