package tech.taskpilot.platform.common;

import tech.taskpilot.platform.common.errors.UseCaseError;

import java.util.function.Function;

/**
 * Outcome of a task operation: either a value or a {@link UseCaseError}.
 *
 * <p>Failures carry business outcomes (missing task, rejected calendar call)
 * that the tool layer reports as data. Infrastructure faults are thrown.
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    /**
     * Transform the value of a success; a failure passes through untouched.
     */
    <R> Result<R> map(Function<? super T, ? extends R> mapper);

    record Success<T>(T value) implements Result<T> {
        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }
    }

    record Failure<T>(UseCaseError error) implements Result<T> {
        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(error);
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(UseCaseError error) {
        return new Failure<>(error);
    }
}
