package com.z254.prophantom.hive.dispatch;

import lombok.Value;

/**
 * Inclusive range of sequence numbers lost to retained queue overflow.
 */
@Value
public class ReplayGap {
    long fromSeq;
    long toSeq;
}
