package com.dexarb.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SubmissionHandle {
    String bundleHash;
    String relay;
    long firstTargetBlock;
    long lastTargetBlock;
    List<String> transactionHashes;
}
