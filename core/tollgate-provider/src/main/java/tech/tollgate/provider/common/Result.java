package tech.tollgate.provider.common;

import tech.tollgate.provider.common.errors.OAuthDenial;
import tech.tollgate.provider.common.errors.OAuthErrorKind;

import java.util.function.Function;

/**
 * Outcome of a validation step.
 *
 * <p>This is a sealed interface with two variants:
 * <ul>
 *   <li>{@link Success} - the request was approved, carrying the resolved value</li>
 *   <li>{@link Failure} - the request was refused, carrying the {@link OAuthDenial}</li>
 * </ul>
 *
 * <p>Validation code never throws for a refused request. Callers branch on the
 * variant and map failures to the wire format:
 * <pre>{@code
 * Result<AuthorizationDecision> result = validator.validateAuthorizationRequest(...);
 * if (result instanceof Result.Failure<AuthorizationDecision> f) {
 *     return errorRedirect(f.denial());
 * }
 * AuthorizationDecision decision = result.value();
 * }</pre>
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    boolean isSuccess();
    boolean isFailure();

    /**
     * The approved value.
     *
     * @throws IllegalStateException if this is a failure
     */
    T value();

    /**
     * The denial.
     *
     * @throws IllegalStateException if this is a success
     */
    OAuthDenial denial();

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }

        @Override
        public OAuthDenial denial() {
            throw new IllegalStateException("Result is a success");
        }
    }

    record Failure<T>(OAuthDenial denial) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Result is a failure: " + denial.kind());
        }
    }

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(OAuthDenial denial) {
        return new Failure<>(denial);
    }

    static <T> Result<T> failure(OAuthErrorKind kind, String detail) {
        return new Failure<>(OAuthDenial.of(kind, detail));
    }

    /**
     * Chain a step that may itself be refused, leaving failures unchanged.
     */
    default <U> Result<U> flatMap(Function<T, Result<U>> fn) {
        if (this instanceof Success<T> s) {
            return fn.apply(s.value());
        }
        return new Failure<>(denial());
    }

    /**
     * Transform the approved value, leaving failures unchanged.
     */
    default <U> Result<U> map(Function<T, U> fn) {
        if (this instanceof Success<T> s) {
            return new Success<>(fn.apply(s.value()));
        }
        return new Failure<>(denial());
    }
}
