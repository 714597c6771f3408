package com.phillippitts.mindscribe.exception;

import com.phillippitts.mindscribe.domain.SessionErrorCode;

/**
 * Thrown when the split fallback cannot produce a segment under the provider byte ceiling.
 */
public class SegmentSizeExceededException extends MindScribeException {

    private final long segmentBytes;
    private final long ceilingBytes;

    public SegmentSizeExceededException(long segmentBytes, long ceilingBytes) {
        super(SessionErrorCode.SEGMENT_SIZE_EXCEEDED,
                "Segment of " + segmentBytes + " bytes exceeds ceiling of " + ceilingBytes + " bytes");
        this.segmentBytes = segmentBytes;
        this.ceilingBytes = ceilingBytes;
    }

    public long getSegmentBytes() {
        return segmentBytes;
    }

    public long getCeilingBytes() {
        return ceilingBytes;
    }
}
