package com.bulut.dispatch;

import com.bulut.common.exception.ErrorCode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of one dispatcher step: a value, or the failure that stops the intent.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StepResult<T> {
    T value;
    ErrorCode code;
    String message;

    public static <T> StepResult<T> ok(T value) {
        return new StepResult<>(value, null, null);
    }

    public static <T> StepResult<T> fail(ErrorCode code, String message) {
        return new StepResult<>(null, code, message);
    }

    public boolean isOk() {
        return code == null;
    }

    /**
     * Re-type a failure so it can be returned from a step producing another value.
     */
    public <U> StepResult<U> propagate() {
        if (isOk()) {
            throw new IllegalStateException("Only failures can be propagated");
        }
        return fail(code, message);
    }
}
