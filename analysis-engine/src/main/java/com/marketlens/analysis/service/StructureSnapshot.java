package com.marketlens.analysis.service;

import com.marketlens.common.detection.DetectionSet;
import com.marketlens.common.model.MarketAssessment;

/** Classifier output plus every detector list for one series. */
public record StructureSnapshot(MarketAssessment assessment, DetectionSet detections) {}
