package com.bulut.alias;

import lombok.Value;

/**
 * Outcome of an alias registration attempt.
 */
@Value
public class RegistrationResult {

    Status status;
    AliasRecord record;

    public enum Status {
        REGISTERED,
        ALIAS_TAKEN,
        ADDRESS_ALREADY_ALIASED,
        INVALID_SIGNATURE
    }

    public static RegistrationResult registered(AliasRecord record) {
        return new RegistrationResult(Status.REGISTERED, record);
    }

    public static RegistrationResult rejected(Status status) {
        return new RegistrationResult(status, null);
    }

    public boolean isRegistered() {
        return status == Status.REGISTERED;
    }
}
