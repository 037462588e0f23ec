package io.github.vishalmysore.evolution.engine;

import lombok.Value;

/**
 * A contiguous range of anchor events [anchorStart, anchorEnd) in date order
 * together with the number of in-window pairs those anchors produce.
 */
@Value
public class PairChunk {
    int index;
    int anchorStart;
    int anchorEnd;
    long pairCount;
}
