package com.claimrules.infrastructure.ai.segmentation;

/**
 * A slice of claim text could not be turned into a claim segment.
 * Raised and handled inside the segmenter; the slice is dropped.
 */
public class ClaimSegmentationException extends RuntimeException {

    public ClaimSegmentationException(String message) {
        super(message);
    }
}
