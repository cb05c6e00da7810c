package com.example.waivermerger.infrastructure.pdf;

import com.example.waivermerger.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Draws summary cover pages (title, counts, merged IDs) and places them in front of the merged content.
 */
@Component
public class CoverPageRenderer {

    private static final float MARGIN = 72f;
    private static final float LINE_HEIGHT = 18f;
    private static final PDType1Font TITLE_FONT = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
    private static final PDType1Font BODY_FONT = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

    /**
     * Renders the cover and inserts it before the current first page, or appends it when the document
     * has no pages yet. Overflowing ID lists continue on additional cover pages.
     *
     * @param document     merged document
     * @param title        heading on the first cover page
     * @param summaryLines counts and timestamp lines
     * @param identifiers  merged identifiers in output order
     * @return number of cover pages inserted
     * @throws PdfProcessingException when PDFBox cannot write the page content
     */
    public int prepend(PDDocument document, String title, List<String> summaryLines, List<String> identifiers) {
        PDPage firstContentPage = document.getNumberOfPages() > 0 ? document.getPage(0) : null;
        List<String> lines = new ArrayList<>(summaryLines);
        lines.add("");
        lines.add("Students included:");
        for (int i = 0; i < identifiers.size(); i++) {
            lines.add((i + 1) + ". ID " + identifiers.get(i));
        }

        int pages = 0;
        int next = 0;
        try {
            do {
                PDPage page = new PDPage(PDRectangle.LETTER);
                float y = page.getMediaBox().getHeight() - MARGIN;
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    if (pages == 0) {
                        writeLine(content, TITLE_FONT, 22, y, title);
                        y -= LINE_HEIGHT * 2;
                    }
                    while (next < lines.size() && y > MARGIN) {
                        writeLine(content, BODY_FONT, 12, y, lines.get(next++));
                        y -= LINE_HEIGHT;
                    }
                }
                if (firstContentPage == null) {
                    document.addPage(page);
                } else {
                    document.getPages().insertBefore(page, firstContentPage);
                }
                pages++;
            } while (next < lines.size());
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to render the cover page.", e);
        }
        return pages;
    }

    private void writeLine(PDPageContentStream content, PDType1Font font, float size, float y, String text)
            throws IOException {
        if (text.isEmpty()) {
            return;
        }
        content.beginText();
        content.setFont(font, size);
        content.newLineAtOffset(MARGIN, y);
        content.showText(text);
        content.endText();
    }
}
