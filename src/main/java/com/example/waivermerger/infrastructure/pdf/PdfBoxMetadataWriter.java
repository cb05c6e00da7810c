package com.example.waivermerger.infrastructure.pdf;

import com.example.waivermerger.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.AdobePDFSchema;
import org.apache.xmpbox.schema.DublinCoreSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.XmpSerializer;
import org.springframework.stereotype.Component;

import javax.xml.transform.TransformerException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.ZonedDateTime;
import java.util.Calendar;
import java.util.GregorianCalendar;

/**
 * Infrastructure service that stamps the merged output with an info dictionary and a matching XMP packet.
 */
@Component
public class PdfBoxMetadataWriter {

    static final String PRODUCER = "Waiver Merger";

    /**
     * Writes title, producer and creation date into both the legacy info dictionary and XMP metadata.
     *
     * @param document  document about to be saved
     * @param title     document title
     * @param createdAt creation timestamp
     * @throws PdfProcessingException when the XMP packet cannot be serialized
     */
    public void stamp(PDDocument document, String title, ZonedDateTime createdAt) {
        Calendar created = GregorianCalendar.from(createdAt);

        PDDocumentInformation info = document.getDocumentInformation();
        info.setTitle(title);
        info.setProducer(PRODUCER);
        info.setCreator(PRODUCER);
        info.setCreationDate(created);
        document.setDocumentInformation(info);

        try {
            XMPMetadata xmp = XMPMetadata.createXMPMetadata();
            DublinCoreSchema dc = xmp.createAndAddDublinCoreSchema();
            dc.setTitle(title);
            dc.addCreator(PRODUCER);
            XMPBasicSchema basic = xmp.createAndAddXMPBasicSchema();
            basic.setCreateDate(created);
            basic.setCreatorTool(PRODUCER);
            AdobePDFSchema pdf = xmp.createAndAddAdobePDFSchema();
            pdf.setProducer(PRODUCER);

            ByteArrayOutputStream xmpBytes = new ByteArrayOutputStream();
            new XmpSerializer().serialize(xmp, xmpBytes, true);
            PDMetadata metadata = new PDMetadata(document);
            metadata.importXMPMetadata(xmpBytes.toByteArray());
            document.getDocumentCatalog().setMetadata(metadata);
        } catch (IOException | TransformerException e) {
            throw new PdfProcessingException("Unable to write XMP metadata for the merged PDF.", e);
        }
    }
}
