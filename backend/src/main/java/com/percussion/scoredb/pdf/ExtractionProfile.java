package com.percussion.scoredb.pdf;

/**
 * Tolerances for rebuilding a grid from glyph positions.
 *
 * @param rowTolerance  max vertical distance (pt) for glyphs to share a line
 * @param edgeTolerance max horizontal distance (pt) for cell extents to share a column
 */
record ExtractionProfile(String name, float rowTolerance, float edgeTolerance) {
}
