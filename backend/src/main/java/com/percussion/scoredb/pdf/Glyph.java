package com.percussion.scoredb.pdf;

/**
 * One positioned character (or ligature) of a page, in display-adjusted coordinates.
 */
record Glyph(float x, float y, float width, String text) {

    float endX() {
        return x + width;
    }
}
