package com.hoteldesk.frontdesk.invoice;

/**
 * Turns invoice data into a downloadable document.
 */
public interface InvoiceRenderer {

    /**
     * Renders the document. Identical input yields identical bytes.
     */
    byte[] render(InvoiceData invoice);

    String contentType();

    String fileName(InvoiceData invoice);
}
