package com.creditengine.idempotency;

import lombok.Value;

/**
 * Outcome of reserving an idempotency key.
 */
@Value
public class Reservation {

    public enum State {
        /**
         * The caller owns the key and must perform the operation.
         */
        ACQUIRED,

        /**
         * The operation already completed; the caller replays the prior result.
         */
        COMPLETED,

        /**
         * The key belongs to a different user.
         */
        FOREIGN
    }

    State state;
    IdempotencyRecord record;

    public boolean isNew() {
        return state == State.ACQUIRED;
    }

    public boolean isReplay() {
        return state == State.COMPLETED;
    }

    public boolean isForeign() {
        return state == State.FOREIGN;
    }

    public String getKey() {
        return record.getKey();
    }

    public String getResultingTransactionId() {
        return record.getResultingTransactionId();
    }

    static Reservation acquired(IdempotencyRecord record) {
        return new Reservation(State.ACQUIRED, record);
    }

    static Reservation completed(IdempotencyRecord record) {
        return new Reservation(State.COMPLETED, record);
    }

    static Reservation foreign(IdempotencyRecord record) {
        return new Reservation(State.FOREIGN, record);
    }
}
