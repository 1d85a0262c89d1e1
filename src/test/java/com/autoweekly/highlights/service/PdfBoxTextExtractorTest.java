package com.autoweekly.highlights.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfBoxTextExtractorTest {

  @TempDir Path dir;

  private final PdfBoxTextExtractor extractor = new PdfBoxTextExtractor();

  @Test
  void extractsTextFromEveryPage() throws IOException {
    Path pdf = dir.resolve("k9.pdf");
    try (PDDocument doc = new PDDocument()) {
      addPage(doc, "Revenue grew 12% year on year");
      addPage(doc, "Important Disclosures");
      doc.save(pdf.toFile());
    }

    String text = extractor.extractText(pdf);

    assertTrue(text.contains("Revenue grew 12% year on year"));
    assertTrue(text.indexOf("Revenue") < text.indexOf("Important Disclosures"));
  }

  @Test
  void plainTextIsPassedThrough() throws IOException {
    Path txt = Files.writeString(dir.resolve("note.TXT"), "第一行\nsecond line");

    assertEquals("第一行\nsecond line", extractor.extractText(txt));
  }

  @Test
  void unsupportedTypeFails() throws IOException {
    Path docx = Files.writeString(dir.resolve("memo.docx"), "x");

    IOException e = assertThrows(IOException.class, () -> extractor.extractText(docx));
    assertTrue(e.getMessage().contains("memo.docx"));
  }

  @Test
  void corruptPdfFails() throws IOException {
    Path pdf = Files.writeString(dir.resolve("broken.pdf"), "not a pdf");

    assertThrows(IOException.class, () -> extractor.extractText(pdf));
  }

  private static void addPage(PDDocument doc, String line) throws IOException {
    PDPage page = new PDPage();
    doc.addPage(page);
    try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
      content.beginText();
      content.setFont(PDType1Font.HELVETICA, 12);
      content.newLineAtOffset(72, 700);
      content.showText(line);
      content.endText();
    }
  }
}
