package com.hoteldesk.frontdesk.domain.service;

import com.hoteldesk.frontdesk.domain.repository.BookingRepository;
import com.hoteldesk.frontdesk.exception.BookingNotFoundException;
import com.hoteldesk.frontdesk.invoice.InvoiceData;
import com.hoteldesk.frontdesk.invoice.InvoiceRenderer;
import com.hoteldesk.frontdesk.security.DeskPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceService {

    private final BookingRepository bookingRepository;
    private final InvoiceRenderer invoiceRenderer;

    /**
     * Loads the booking with its client and room and renders the billing document.
     *
     * @throws BookingNotFoundException if no such booking exists
     */
    @Transactional(readOnly = true)
    public RenderedInvoice renderInvoice(DeskPrincipal principal, Long bookingId) {
        DeskPrincipal.require(principal);
        InvoiceData data = bookingRepository.findByIdWithClientAndRoom(bookingId)
                .map(InvoiceData::from)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        log.info("Rendering invoice for booking {} requested by {}", bookingId, principal.username());
        return new RenderedInvoice(
                invoiceRenderer.fileName(data),
                invoiceRenderer.contentType(),
                invoiceRenderer.render(data));
    }

    public record RenderedInvoice(String fileName, String contentType, byte[] content) {
    }
}
