package org.Aayush.locus.pipeline;

import lombok.Value;

/**
 * Renderer-facing location edge; weight lies in (threshold, 1].
 */
@Value
public class LocationEdgeView {
    String sourceId;
    String targetId;
    double weight;
}
