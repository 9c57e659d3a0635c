package com.percussion.scoredb.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Table detection over PDFBox text positions. A strict pass runs first; when it finds no
 * table the page is retried with looser row and edge tolerances.
 */
@Component
public class PdfBoxScoreTableExtractor implements ScoreTableExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxScoreTableExtractor.class);

    private final ExtractionProfile primary;
    private final ExtractionProfile fallback;

    public PdfBoxScoreTableExtractor(@Value("${scoredb.pdf.strict.row-tolerance:2}") float strictRowTolerance,
                                     @Value("${scoredb.pdf.strict.edge-tolerance:5}") float strictEdgeTolerance,
                                     @Value("${scoredb.pdf.relaxed.row-tolerance:10}") float relaxedRowTolerance,
                                     @Value("${scoredb.pdf.relaxed.edge-tolerance:50}") float relaxedEdgeTolerance) {
        this.primary = new ExtractionProfile("strict", strictRowTolerance, strictEdgeTolerance);
        this.fallback = new ExtractionProfile("relaxed", relaxedRowTolerance, relaxedEdgeTolerance);
    }

    @Override
    public List<RawTable> extract(Path document, int pageIndex) throws IOException {
        List<Glyph> glyphs = readGlyphs(document, pageIndex);
        if (glyphs.isEmpty()) return List.of();

        Optional<RawTable> table = detect(glyphs);
        if (table.isEmpty()) {
            log.debug("[PDF] No table on page {} of {}", pageIndex, document.getFileName());
        }
        return table.map(List::of).orElseGet(List::of);
    }

    Optional<RawTable> detect(List<Glyph> glyphs) {
        Optional<RawTable> table = new TextGridBuilder(primary).build(glyphs);
        if (table.isEmpty()) {
            log.debug("[PDF] No table with {} tolerances, retrying {}", primary.name(), fallback.name());
            table = new TextGridBuilder(fallback).build(glyphs);
        }
        return table;
    }

    private List<Glyph> readGlyphs(Path document, int pageIndex) throws IOException {
        try (PDDocument doc = Loader.loadPDF(document.toFile())) {
            if (pageIndex < 0 || pageIndex >= doc.getNumberOfPages()) return List.of();
            GlyphCollector collector = new GlyphCollector();
            collector.setSortByPosition(true);
            collector.setStartPage(pageIndex + 1);
            collector.setEndPage(pageIndex + 1);
            collector.getText(doc);
            return collector.glyphs;
        }
    }

    private static final class GlyphCollector extends PDFTextStripper {
        private final List<Glyph> glyphs = new ArrayList<>();

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            for (TextPosition tp : textPositions) {
                glyphs.add(new Glyph(tp.getXDirAdj(), tp.getYDirAdj(), tp.getWidthDirAdj(), tp.getUnicode()));
            }
            super.writeString(text, textPositions);
        }
    }
}
