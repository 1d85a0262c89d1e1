package com.autoweekly.highlights.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

/**
 * Extracts text from stored reports with Apache PDFBox.
 *
 * <p>PDFs are stripped page by page in reading order. Plain-text formats are read as UTF-8 as-is.
 */
@Log4j2
public class PdfBoxTextExtractor implements DocumentTextExtractor {

  private static final Set<String> PLAIN_TEXT = Set.of("txt", "md", "markdown");

  @Override
  public String extractText(Path document) throws IOException {
    String name = document.getFileName().toString().toLowerCase(Locale.ROOT);
    String ext = name.contains(".") ? name.substring(name.lastIndexOf('.') + 1) : "";

    if (PLAIN_TEXT.contains(ext)) {
      return Files.readString(document, StandardCharsets.UTF_8);
    }
    if (!"pdf".equals(ext)) {
      throw new IOException("Unsupported document type: " + document.getFileName());
    }

    try (PDDocument pdf = PDDocument.load(document.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      stripper.setStartPage(1);
      stripper.setEndPage(pdf.getNumberOfPages());
      String text = stripper.getText(pdf);
      log.debug(
          "pdf.extract file={} pages={} chars={}",
          document.getFileName(),
          pdf.getNumberOfPages(),
          text.length());
      return text;
    }
  }
}
