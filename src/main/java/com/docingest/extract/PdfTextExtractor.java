package com.docingest.extract;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docingest.ingest.ContentType;

public class PdfTextExtractor implements DocumentTextExtractor {
    private static final Logger log = LoggerFactory.getLogger(PdfTextExtractor.class);

    @Override
    public boolean supports(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public Optional<ExtractedText> extract(Path path) throws IOException {
        if (!supports(path)) {
            return Optional.empty();
        }
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            String text = new PDFTextStripper().getText(pdf);
            log.debug("extract.pdf file={} pages={} characters={}", path.getFileName(), pdf.getNumberOfPages(), text.length());
            return Optional.of(new ExtractedText(path, text, ContentType.PDF));
        }
    }
}
