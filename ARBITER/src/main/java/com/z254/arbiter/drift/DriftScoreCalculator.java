package com.z254.arbiter.drift;

/**
 * Distance between a reference and a current feature distribution.
 */
public interface DriftScoreCalculator {

    DriftScore score(DriftWindows windows);
}
