package com.hoteldesk.frontdesk;

import com.hoteldesk.frontdesk.api.dto.BookingResponse;
import com.hoteldesk.frontdesk.api.dto.ClientResponse;
import com.hoteldesk.frontdesk.api.dto.CreateBookingRequest;
import com.hoteldesk.frontdesk.api.dto.CreateClientRequest;
import com.hoteldesk.frontdesk.api.dto.CreateRoomRequest;
import com.hoteldesk.frontdesk.api.dto.DashboardResponse;
import com.hoteldesk.frontdesk.api.dto.RoomResponse;
import com.hoteldesk.frontdesk.domain.model.Room;
import com.hoteldesk.frontdesk.domain.model.User;
import com.hoteldesk.frontdesk.domain.repository.BookingRepository;
import com.hoteldesk.frontdesk.domain.repository.ClientRepository;
import com.hoteldesk.frontdesk.domain.repository.RoomRepository;
import com.hoteldesk.frontdesk.domain.service.BookingService;
import com.hoteldesk.frontdesk.domain.service.ClientService;
import com.hoteldesk.frontdesk.domain.service.DashboardService;
import com.hoteldesk.frontdesk.domain.service.InvoiceService;
import com.hoteldesk.frontdesk.domain.service.RoomAvailabilityManager;
import com.hoteldesk.frontdesk.domain.service.RoomService;
import com.hoteldesk.frontdesk.exception.DuplicateKeyException;
import com.hoteldesk.frontdesk.exception.InvalidDateRangeException;
import com.hoteldesk.frontdesk.exception.RoomUnavailableException;
import com.hoteldesk.frontdesk.exception.TotalOutOfRangeException;
import com.hoteldesk.frontdesk.security.DeskPrincipal;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end checks of the booking lifecycle against the in-memory H2 store.
 */
@SpringBootTest
class FrontDeskFlowIntegrationTest {

    private static final DeskPrincipal ADMIN = new DeskPrincipal(1L, "admin", User.Role.ADMIN);
    private static final LocalDate JAN_10 = LocalDate.of(2026, 1, 10);
    private static final LocalDate JAN_12 = LocalDate.of(2026, 1, 12);

    @Autowired
    private ClientService clientService;
    @Autowired
    private RoomService roomService;
    @Autowired
    private RoomAvailabilityManager availabilityManager;
    @Autowired
    private BookingService bookingService;
    @Autowired
    private InvoiceService invoiceService;
    @Autowired
    private DashboardService dashboardService;

    @Autowired
    private BookingRepository bookingRepository;
    @Autowired
    private RoomRepository roomRepository;
    @Autowired
    private ClientRepository clientRepository;

    @BeforeEach
    void cleanStore() {
        bookingRepository.deleteAllInBatch();
        roomRepository.deleteAllInBatch();
        clientRepository.deleteAllInBatch();
    }

    @Test
    @DisplayName("a room is occupied if and only if a booking references it")
    void occupancyFollowsBookings() {
        ClientResponse jane = clientService.addClient(ADMIN, new CreateClientRequest("Jane Doe", "555-1234"));
        RoomResponse r101 = addRoom("101", "100");
        RoomResponse r102 = addRoom("102", "120");
        RoomResponse r103 = addRoom("103", "80");

        book(jane, r101, JAN_10, JAN_12);
        book(jane, r103, JAN_10, LocalDate.of(2026, 1, 11));

        for (Room room : roomRepository.findAll()) {
            assertThat(room.getStatus() == Room.RoomStatus.OCCUPIED)
                    .as("room %s", room.getNumber())
                    .isEqualTo(bookingRepository.existsByRoomId(room.getId()));
        }
        assertThat(availabilityManager.listAvailableRooms(ADMIN))
                .extracting(RoomResponse::id)
                .containsExactly(r102.id());
    }

    @Test
    @DisplayName("second booking of the same room fails and leaves exactly one booking")
    void secondBookingOfSameRoom_roomUnavailable() {
        ClientResponse jane = clientService.addClient(ADMIN, new CreateClientRequest("Jane Doe", "555-1234"));
        RoomResponse r101 = addRoom("101", "100");

        book(jane, r101, JAN_10, JAN_12);

        assertThatThrownBy(() -> book(jane, r101, LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 3)))
                .isInstanceOf(RoomUnavailableException.class);
        assertThat(bookingRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("rejected date range writes nothing and keeps the room available")
    void invalidDateRange_noPartialCommit() {
        ClientResponse jane = clientService.addClient(ADMIN, new CreateClientRequest("Jane Doe", "555-1234"));
        RoomResponse r101 = addRoom("101", "100");

        assertThatThrownBy(() -> book(jane, r101, JAN_10, JAN_10))
                .isInstanceOf(InvalidDateRangeException.class);
        assertThat(bookingRepository.count()).isZero();
        assertThat(roomRepository.findById(r101.id()).orElseThrow().getStatus())
                .isEqualTo(Room.RoomStatus.AVAILABLE);
    }

    @Test
    @DisplayName("adding room 101 twice fails with DuplicateKey")
    void duplicateRoomNumber_rejected() {
        addRoom("101", "100");

        assertThatThrownBy(() -> addRoom("101", "150"))
                .isInstanceOf(DuplicateKeyException.class);
        assertThat(roomRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("a year at the highest accepted rate is stored with its exact total")
    void yearLongStayAtMaximumRate_stored() {
        ClientResponse jane = clientService.addClient(ADMIN, new CreateClientRequest("Jane Doe", "555-1234"));
        RoomResponse suite = addRoom("900", "99999999.99");

        BookingResponse booking = book(jane, suite, JAN_10, LocalDate.of(2027, 1, 10));

        assertThat(booking.totalPrice()).isEqualByComparingTo("36499999996.35");
        assertThat(bookingService.getBooking(ADMIN, booking.id()).totalPrice())
                .isEqualByComparingTo("36499999996.35");
        assertThat(roomRepository.findById(suite.id()).orElseThrow().getStatus())
                .isEqualTo(Room.RoomStatus.OCCUPIED);
    }

    @Test
    @DisplayName("a total too large to store is rejected before anything is written")
    void totalBeyondStorableRange_rejected() {
        ClientResponse jane = clientService.addClient(ADMIN, new CreateClientRequest("Jane Doe", "555-1234"));
        RoomResponse suite = addRoom("900", "99999999.99");

        assertThatThrownBy(() -> book(jane, suite, JAN_10, JAN_10.plusYears(3_000_000)))
                .isInstanceOf(TotalOutOfRangeException.class)
                .extracting("errorCode").isEqualTo("TOTAL_OUT_OF_RANGE");
        assertThat(bookingRepository.count()).isZero();
        assertThat(roomRepository.findById(suite.id()).orElseThrow().getStatus())
                .isEqualTo(Room.RoomStatus.AVAILABLE);
    }

    @Test
    @DisplayName("rate changes never alter the total of existing bookings")
    void rateChange_keepsExistingTotals() {
        ClientResponse jane = clientService.addClient(ADMIN, new CreateClientRequest("Jane Doe", "555-1234"));
        RoomResponse r101 = addRoom("101", "100");
        BookingResponse booking = book(jane, r101, JAN_10, JAN_12);

        roomService.updateRoomRate(ADMIN, r101.id(), new BigDecimal("250"));
        availabilityManager.releaseRoom(ADMIN, r101.id());
        BookingResponse second = book(jane, r101, LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 3));

        assertThat(bookingService.getBooking(ADMIN, booking.id()).totalPrice()).isEqualByComparingTo("200");
        assertThat(second.totalPrice()).isEqualByComparingTo("500");
        assertThat(bookingService.listBookings(ADMIN))
                .extracting(BookingResponse::id)
                .containsExactly(booking.id(), second.id());
    }

    @Test
    @DisplayName("invoice for Jane Doe in room 101 shows all fields and a total of 200")
    void invoice_containsBookingDetails() throws Exception {
        ClientResponse jane = clientService.addClient(ADMIN, new CreateClientRequest("Jane Doe", "555-1234"));
        RoomResponse r101 = roomService.addRoom(ADMIN, new CreateRoomRequest("101", "Standard", BigDecimal.valueOf(100)));
        BookingResponse booking = book(jane, r101, JAN_10, JAN_12);

        InvoiceService.RenderedInvoice invoice = invoiceService.renderInvoice(ADMIN, booking.id());

        assertThat(booking.totalPrice()).isEqualByComparingTo("200");
        assertThat(invoice.fileName()).isEqualTo("invoice_" + booking.id() + ".pdf");
        try (PDDocument document = PDDocument.load(invoice.content())) {
            String text = new PDFTextStripper().getText(document);
            assertThat(text).contains("Jane Doe", "555-1234", "101", "Standard",
                    "2026-01-10", "2026-01-12", "Total: 200 €");
        }
        assertThat(invoiceService.renderInvoice(ADMIN, booking.id()).content()).isEqualTo(invoice.content());
    }

    @Test
    @DisplayName("dashboard counts rooms by status and sums revenue")
    void dashboard_summary() {
        assertThat(dashboardService.summary(ADMIN).revenue()).isEqualByComparingTo("0");

        ClientResponse jane = clientService.addClient(ADMIN, new CreateClientRequest("Jane Doe", "555-1234"));
        RoomResponse r101 = addRoom("101", "100");
        addRoom("102", "100");
        book(jane, r101, JAN_10, JAN_12);

        DashboardResponse summary = dashboardService.summary(ADMIN);
        assertThat(summary.totalRooms()).isEqualTo(2);
        assertThat(summary.occupiedRooms()).isEqualTo(1);
        assertThat(summary.availableRooms()).isEqualTo(1);
        assertThat(summary.revenue()).isEqualByComparingTo("200");
    }

    @Test
    @DisplayName("concurrent bookings of the same room: exactly one wins, the rest see RoomUnavailable")
    void concurrentBookings_singleWinner() throws Exception {
        ClientResponse jane = clientService.addClient(ADMIN, new CreateClientRequest("Jane Doe", "555-1234"));
        ClientResponse john = clientService.addClient(ADMIN, new CreateClientRequest("John Roe", "555-9876"));
        RoomResponse r101 = addRoom("101", "100");

        int attempts = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(attempts);
        List<Future<BookingResponse>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < attempts; i++) {
                ClientResponse guest = i % 2 == 0 ? jane : john;
                Callable<BookingResponse> task = () -> {
                    start.await();
                    return book(guest, r101, JAN_10, JAN_12);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            int succeeded = 0;
            int unavailable = 0;
            for (Future<BookingResponse> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(RoomUnavailableException.class);
                    unavailable++;
                }
            }

            assertThat(succeeded).isEqualTo(1);
            assertThat(unavailable).isEqualTo(attempts - 1);
            assertThat(bookingRepository.count()).isEqualTo(1);
            assertThat(roomRepository.findById(r101.id()).orElseThrow().getStatus())
                    .isEqualTo(Room.RoomStatus.OCCUPIED);
        } finally {
            pool.shutdownNow();
        }
    }

    private RoomResponse addRoom(String number, String rate) {
        return roomService.addRoom(ADMIN, new CreateRoomRequest(number, "Standard", new BigDecimal(rate)));
    }

    private BookingResponse book(ClientResponse client, RoomResponse room, LocalDate in, LocalDate out) {
        return bookingService.createBooking(ADMIN, new CreateBookingRequest(client.id(), room.id(), in, out));
    }
}
