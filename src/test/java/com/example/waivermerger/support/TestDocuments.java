package com.example.waivermerger.support;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds PDFs and roster workbooks in memory for tests.
 */
public final class TestDocuments {

    private TestDocuments() {
    }

    /**
     * Creates a PDF with one page per text, each page showing its text.
     *
     * @param pageTexts text to render, one entry per page
     * @return PDF bytes
     * @throws IOException when PDFBox cannot create or save the document
     */
    public static byte[] pdf(String... pageTexts) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            for (String text : pageTexts) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD), 18);
                    contentStream.newLineAtOffset(72, 700);
                    contentStream.showText(text);
                    contentStream.endText();
                }
            }
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    /**
     * Creates a single-page PDF protected with the given passwords. An empty user password gives a
     * document that opens without a password but still carries owner restrictions.
     *
     * @param ownerPassword owner password
     * @param userPassword  user password, empty for none
     * @param pageText      text of the only page
     * @return encrypted PDF bytes
     * @throws IOException when PDFBox cannot encrypt or save the document
     */
    public static byte[] encryptedPdf(String ownerPassword, String userPassword, String pageText) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf(pageText));
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            AccessPermission permissions = new AccessPermission();
            permissions.setCanModify(false);
            StandardProtectionPolicy policy = new StandardProtectionPolicy(ownerPassword, userPassword, permissions);
            policy.setEncryptionKeyLength(128);
            document.protect(policy);
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }

    /**
     * Keeps the first half of a legacy {@code .xls} workbook, leaving a damaged file behind.
     *
     * @param rows workbook rows as accepted by {@link #xls(Object[]...)}
     * @return truncated workbook bytes
     * @throws IOException when POI cannot write the workbook
     */
    public static byte[] truncatedXls(Object[]... rows) throws IOException {
        byte[] workbook = xls(rows);
        return Arrays.copyOf(workbook, workbook.length / 2);
    }

    /**
     * Extracts the trimmed text of every page, in page order.
     *
     * @param pdf PDF bytes
     * @return page texts
     * @throws IOException when the PDF cannot be read
     */
    public static List<String> pageTexts(byte[] pdf) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            PDFTextStripper stripper = new PDFTextStripper();
            List<String> texts = new ArrayList<>();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                texts.add(stripper.getText(document).strip());
            }
            return texts;
        }
    }

    public static byte[] xlsx(Object[]... rows) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            return write(workbook, rows);
        }
    }

    public static byte[] xls(Object[]... rows) throws IOException {
        try (Workbook workbook = new HSSFWorkbook()) {
            return write(workbook, rows);
        }
    }

    /**
     * Strings become text cells, numbers numeric cells, booleans boolean cells; {@code null} leaves the cell empty.
     */
    private static byte[] write(Workbook workbook, Object[]... rows) throws IOException {
        Sheet sheet = workbook.createSheet("Roster");
        for (int r = 0; r < rows.length; r++) {
            Row row = sheet.createRow(r);
            for (int c = 0; c < rows[r].length; c++) {
                Object value = rows[r][c];
                if (value instanceof String text) {
                    row.createCell(c).setCellValue(text);
                } else if (value instanceof Number number) {
                    row.createCell(c).setCellValue(number.doubleValue());
                } else if (value instanceof Boolean flag) {
                    row.createCell(c).setCellValue(flag);
                }
            }
        }
        ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
        workbook.write(outputStream);
        return outputStream.toByteArray();
    }
}
