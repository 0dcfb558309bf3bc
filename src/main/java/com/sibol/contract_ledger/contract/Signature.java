package com.sibol.contract_ledger.contract;

import lombok.Value;

import java.time.Instant;
import java.util.Objects;

/**
 * A party's signature on a contract. The payload is whatever the signing service produced;
 * the ledger stores it without interpreting it.
 */
@Value
public class Signature {
    SignatoryRole role;
    boolean signed;
    Instant signedAt;
    String payload;

    public static Signature unsigned(SignatoryRole role) {
        return new Signature(Objects.requireNonNull(role), false, null, null);
    }

    public static Signature signed(SignatoryRole role, Instant signedAt, String payload) {
        return new Signature(Objects.requireNonNull(role), true, Objects.requireNonNull(signedAt), payload);
    }
}
