package com.hoteldesk.frontdesk.domain.service;

import com.hoteldesk.frontdesk.domain.model.Booking;
import com.hoteldesk.frontdesk.domain.model.Client;
import com.hoteldesk.frontdesk.domain.model.Room;
import com.hoteldesk.frontdesk.domain.model.User;
import com.hoteldesk.frontdesk.domain.repository.BookingRepository;
import com.hoteldesk.frontdesk.exception.BookingNotFoundException;
import com.hoteldesk.frontdesk.invoice.InvoiceData;
import com.hoteldesk.frontdesk.invoice.InvoiceRenderer;
import com.hoteldesk.frontdesk.security.DeskPrincipal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InvoiceServiceTest {

    private static final DeskPrincipal STAFF = new DeskPrincipal(2L, "desk", User.Role.STAFF);

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private InvoiceRenderer invoiceRenderer;

    @InjectMocks
    private InvoiceService invoiceService;

    @Test
    @DisplayName("renderInvoice for an unknown booking fails with BookingNotFound")
    void renderInvoice_missing_notFound() {
        when(bookingRepository.findByIdWithClientAndRoom(7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> invoiceService.renderInvoice(STAFF, 7L))
                .isInstanceOf(BookingNotFoundException.class);
        verify(invoiceRenderer, never()).render(any());
    }

    @Test
    @DisplayName("renderInvoice hands client and room details to the renderer")
    void renderInvoice_passesJoinedData() {
        Booking booking = Booking.builder()
                .id(7L)
                .client(Client.builder().id(1L).name("Jane Doe").phone("555-1234").build())
                .room(Room.builder().id(10L).number("101").type("Standard").rate(BigDecimal.TEN).build())
                .checkInDate(LocalDate.of(2026, 1, 10))
                .checkOutDate(LocalDate.of(2026, 1, 12))
                .totalPrice(new BigDecimal("200.00"))
                .build();
        when(bookingRepository.findByIdWithClientAndRoom(7L)).thenReturn(Optional.of(booking));
        when(invoiceRenderer.render(any())).thenReturn(new byte[]{1, 2, 3});
        when(invoiceRenderer.fileName(any())).thenReturn("invoice_7.pdf");
        when(invoiceRenderer.contentType()).thenReturn("application/pdf");

        InvoiceService.RenderedInvoice invoice = invoiceService.renderInvoice(STAFF, 7L);

        assertThat(invoice.fileName()).isEqualTo("invoice_7.pdf");
        assertThat(invoice.content()).containsExactly(1, 2, 3);
        ArgumentCaptor<InvoiceData> captor = ArgumentCaptor.forClass(InvoiceData.class);
        verify(invoiceRenderer).render(captor.capture());
        assertThat(captor.getValue().clientPhone()).isEqualTo("555-1234");
        assertThat(captor.getValue().roomType()).isEqualTo("Standard");
        assertThat(captor.getValue().totalPrice()).isEqualByComparingTo("200");
    }
}
