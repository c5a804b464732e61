package com.motaz.pipeline.services;

import com.motaz.pipeline.analysis.model.Sample;

import java.util.List;

/**
 * Supplies the bounded batch one analysis run works on, ordered by asset then time.
 */
public interface SensorDataSource {

    List<Sample> load(Long seed);
}
