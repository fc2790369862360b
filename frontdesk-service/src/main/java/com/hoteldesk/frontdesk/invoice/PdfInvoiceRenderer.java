package com.hoteldesk.frontdesk.invoice;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

/**
 * Single-page A4 invoice drawn with PDFBox standard fonts.
 *
 * The trailer ID is derived from the booking id instead of the clock, and no document
 * information dictionary is written, so the output depends on the invoice data only.
 */
@Slf4j
@Component
public class PdfInvoiceRenderer implements InvoiceRenderer {

    private static final float MARGIN = 56f;
    private static final float LEADING = 18f;
    private static final float TITLE_SIZE = 20f;
    private static final float BODY_SIZE = 12f;
    private static final PDFont TITLE_FONT = PDType1Font.HELVETICA_BOLD;
    private static final PDFont BODY_FONT = PDType1Font.HELVETICA;

    @Value("${frontdesk.invoice.title:HOTEL INVOICE}")
    private String title = "HOTEL INVOICE";

    @Value("${frontdesk.invoice.currency:€}")
    private String currency = "€";

    @Override
    public byte[] render(InvoiceData invoice) {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);

            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setLeading(LEADING);
                content.newLineAtOffset(MARGIN, page.getMediaBox().getHeight() - MARGIN);
                content.setFont(TITLE_FONT, TITLE_SIZE);
                content.showText(printable(TITLE_FONT, title));
                content.newLine();
                content.newLine();
                content.setFont(BODY_FONT, BODY_SIZE);
                for (String line : bodyLines(invoice)) {
                    content.showText(printable(BODY_FONT, line));
                    content.newLine();
                }
                content.endText();
            }

            document.getDocument().getTrailer().setItem(COSName.ID, documentId(invoice.bookingId()));
            document.save(out);
            log.debug("Rendered invoice for booking {} ({} bytes)", invoice.bookingId(), out.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render invoice for booking " + invoice.bookingId(), e);
        }
    }

    @Override
    public String contentType() {
        return "application/pdf";
    }

    @Override
    public String fileName(InvoiceData invoice) {
        return "invoice_" + invoice.bookingId() + ".pdf";
    }

    List<String> bodyLines(InvoiceData invoice) {
        return List.of(
                "Booking: #" + invoice.bookingId(),
                "Client: " + invoice.clientName() + " - " + invoice.clientPhone(),
                "Room: " + invoice.roomNumber() + " - " + invoice.roomType(),
                "Check-in: " + invoice.checkInDate(),
                "Check-out: " + invoice.checkOutDate(),
                "Nights: " + invoice.nights(),
                "Total: " + formatAmount(invoice.totalPrice()) + " " + currency
        );
    }

    static String formatAmount(BigDecimal amount) {
        return amount.stripTrailingZeros().toPlainString();
    }

    /**
     * Standard fonts only cover WinAnsi; anything else is printed as '?'.
     */
    private static String printable(PDFont font, String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String glyph = new String(Character.toChars(cp));
            try {
                font.encode(glyph);
                sb.append(glyph);
            } catch (IllegalArgumentException | IOException e) {
                sb.append('?');
            }
        });
        return sb.toString();
    }

    private static COSArray documentId(Long bookingId) {
        UUID uuid = UUID.nameUUIDFromBytes(("invoice-" + bookingId).getBytes(StandardCharsets.UTF_8));
        byte[] bytes = ByteBuffer.allocate(16)
                .putLong(uuid.getMostSignificantBits())
                .putLong(uuid.getLeastSignificantBits())
                .array();
        COSArray id = new COSArray();
        id.add(new COSString(bytes));
        id.add(new COSString(bytes));
        return id;
    }
}
