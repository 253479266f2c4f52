package com.jreinhal.compass.autonomous.orchestrator;

import com.jreinhal.compass.autonomous.groundtruth.ExtractionConfig;
import com.jreinhal.compass.autonomous.groundtruth.SourceSheet;

/**
 * Spreadsheet to extract ground truth from during a run.
 */
public record GroundTruthSource(SourceSheet sheet, ExtractionConfig extraction) {
}
