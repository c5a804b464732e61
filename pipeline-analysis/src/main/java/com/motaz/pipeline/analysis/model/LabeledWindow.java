package com.motaz.pipeline.analysis.model;

import lombok.Value;

/**
 * Features of the window starting at {@code startIndex}, with the labels of its backing samples.
 */
@Value
public class LabeledWindow {
    int startIndex;
    WindowFeatures features;
    boolean anomalous;
    boolean allNormal;
}
