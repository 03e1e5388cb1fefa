package com.bulut.dispatch;

import com.bulut.common.exception.AuthorizationException;
import com.bulut.common.exception.BulutException;
import com.bulut.common.exception.ErrorCategory;
import com.bulut.common.exception.ErrorCode;
import lombok.Value;

/**
 * What {@link PaymentDispatcher#dispatch} returns: an executed result
 * (successful or failed at the rail) or a rejection that never reached the rail.
 */
@Value
public class DispatchOutcome {

    DispatchState state;

    PaymentResponse response;

    ErrorCode code;

    String message;

    /**
     * True when the response was recorded by an earlier submission.
     */
    boolean replayed;

    static DispatchOutcome executed(ExecutionRecord record, boolean replayed) {
        return new DispatchOutcome(record.getState(), record.getResponse(), null, null, replayed);
    }

    static DispatchOutcome rejected(ErrorCode code, String message) {
        String visible = code.getCategory() == ErrorCategory.AUTHORIZATION
            ? AuthorizationException.GENERIC_MESSAGE
            : message;
        return new DispatchOutcome(DispatchState.REJECTED, null, code, visible, false);
    }

    public boolean isRejected() {
        return state == DispatchState.REJECTED;
    }

    /**
     * Exception carrying a rejection to the HTTP boundary.
     */
    public BulutException toException() {
        if (!isRejected()) {
            throw new IllegalStateException("Outcome in state " + state + " is not a rejection");
        }
        if (code.getCategory() == ErrorCategory.AUTHORIZATION) {
            return new AuthorizationException(code);
        }
        return new BulutException(code, message);
    }
}
