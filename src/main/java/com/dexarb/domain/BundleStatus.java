package com.dexarb.domain;

import lombok.Value;

@Value
public class BundleStatus {

    public enum Kind {
        PENDING, INCLUDED, REJECTED
    }

    Kind kind;
    Long includedBlock;
    String reason;

    public static BundleStatus pending() {
        return new BundleStatus(Kind.PENDING, null, null);
    }

    public static BundleStatus included(long block) {
        return new BundleStatus(Kind.INCLUDED, block, null);
    }

    public static BundleStatus rejected(String reason) {
        return new BundleStatus(Kind.REJECTED, null, reason);
    }
}
