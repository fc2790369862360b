package com.hoteldesk.frontdesk.api.controller;

import com.hoteldesk.common.dto.BaseResponse;
import com.hoteldesk.frontdesk.api.dto.BookingResponse;
import com.hoteldesk.frontdesk.api.dto.CreateBookingRequest;
import com.hoteldesk.frontdesk.domain.service.BookingService;
import com.hoteldesk.frontdesk.domain.service.InvoiceService;
import com.hoteldesk.frontdesk.security.AccessGate;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for booking operations and invoice download.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingService bookingService;
    private final InvoiceService invoiceService;
    private final AccessGate accessGate;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request, HttpServletRequest httpRequest) {
        BookingResponse response = bookingService.createBooking(accessGate.currentPrincipal(httpRequest), request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Booking created successfully", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<BookingResponse>>> listBookings(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(BaseResponse.success(
                bookingService.listBookings(accessGate.currentPrincipal(httpRequest))));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(
            @PathVariable Long id, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(BaseResponse.success(
                bookingService.getBooking(accessGate.currentPrincipal(httpRequest), id)));
    }

    @GetMapping("/{id}/invoice")
    public ResponseEntity<byte[]> downloadInvoice(@PathVariable Long id, HttpServletRequest httpRequest) {
        InvoiceService.RenderedInvoice invoice =
                invoiceService.renderInvoice(accessGate.currentPrincipal(httpRequest), id);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(invoice.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(invoice.fileName()).build().toString())
                .body(invoice.content());
    }
}
