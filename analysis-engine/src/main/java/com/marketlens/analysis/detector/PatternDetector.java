package com.marketlens.analysis.detector;

import com.marketlens.common.detection.Detection;
import com.marketlens.common.model.CandleSeries;

import java.util.List;

/**
 * Stateless structural-pattern detector. Implementations never throw for short or degenerate
 * series: below their minimum window they return an empty list. Output is oldest-first and
 * capped at {@link #maxResults()}, keeping the most recent detections.
 */
public interface PatternDetector<T extends Detection> {
    List<T> detect(CandleSeries series);
    String detectorName();
    int maxResults();
}
