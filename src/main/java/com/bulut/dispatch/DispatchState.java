package com.bulut.dispatch;

/**
 * States an intent passes through in {@link PaymentDispatcher}.
 *
 * {@code RECEIVED -> RECIPIENTS_RESOLVED -> AUTHORIZED -> EXECUTED_SUCCESS | EXECUTED_FAILED},
 * or {@code REJECTED} from any state before the rail is called. An intent
 * whose rail call outlives the timeout waits in {@code TIMED_OUT} until the
 * rail answers.
 */
public enum DispatchState {
    RECEIVED,
    RECIPIENTS_RESOLVED,
    AUTHORIZED,
    TIMED_OUT,
    EXECUTED_SUCCESS,
    EXECUTED_FAILED,
    REJECTED;

    public boolean isTerminal() {
        return this == EXECUTED_SUCCESS || this == EXECUTED_FAILED || this == REJECTED;
    }
}
