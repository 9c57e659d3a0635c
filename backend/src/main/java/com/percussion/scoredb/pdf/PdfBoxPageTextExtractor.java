package com.percussion.scoredb.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

@Component
public class PdfBoxPageTextExtractor implements PageTextExtractor {

    @Override
    public int pageCount(Path document) throws IOException {
        try (PDDocument doc = Loader.loadPDF(document.toFile())) {
            return doc.getNumberOfPages();
        }
    }

    @Override
    public String pageText(Path document, int pageIndex) throws IOException {
        try (PDDocument doc = Loader.loadPDF(document.toFile())) {
            if (pageIndex < 0 || pageIndex >= doc.getNumberOfPages()) return "";
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            String text = stripper.getText(doc);
            return text == null ? "" : text;
        }
    }
}
