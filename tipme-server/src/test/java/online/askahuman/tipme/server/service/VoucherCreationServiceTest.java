package online.askahuman.tipme.server.service;

import online.askahuman.tipme.lnurl.Bech32Utils;
import online.askahuman.tipme.lnurl.LnurlException;
import online.askahuman.tipme.server.ServerTestSupport;
import online.askahuman.tipme.server.dto.CreationInvoiceResponse;
import online.askahuman.tipme.server.dto.CreationStatusResponse;
import online.askahuman.tipme.server.entity.CreationStatus;
import online.askahuman.tipme.server.entity.Voucher;
import online.askahuman.tipme.server.exception.GatewayUnavailableException;
import online.askahuman.tipme.server.exception.VoucherNotFoundException;
import online.askahuman.tipme.server.exception.VoucherValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("VoucherCreationService Tests")
class VoucherCreationServiceTest extends ServerTestSupport {

    @Autowired
    private VoucherCreationService creationService;

    private String stubInvoice(boolean paid) {
        String hash = randomHash();
        when(gateway.createInvoice(anyLong(), anyString())).thenReturn(invoice(hash));
        when(gateway.waitForPayment(eq(hash), any(Instant.class), any(Clock.class))).thenReturn(paid);
        return hash;
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("malformed lightning address is rejected before invoicing")
        void rejectsMalformedAddress() {
            VoucherValidationException ex = assertThrows(VoucherValidationException.class,
                    () -> creationService.createInvoice("not-an-address", 1, 3600));

            assertEquals("invalid lightning_address", ex.getMessage());
            verify(gateway, never()).createInvoice(anyLong(), anyString());
        }

        @Test
        @DisplayName("count outside 1..10 is rejected")
        void rejectsCountOutOfRange() {
            VoucherValidationException zero = assertThrows(VoucherValidationException.class,
                    () -> creationService.createInvoice(OWNER, 0, 3600));
            assertThrows(VoucherValidationException.class,
                    () -> creationService.createInvoice(OWNER, 11, 3600));

            assertEquals("count must be between 1 and 10", zero.getMessage());
            verify(gateway, never()).createInvoice(anyLong(), anyString());
        }

        @Test
        @DisplayName("gateway failure surfaces as unavailable and stores nothing")
        void gatewayFailure() {
            when(gateway.createInvoice(anyLong(), anyString())).thenThrow(new LnurlException("connection refused"));

            GatewayUnavailableException ex = assertThrows(GatewayUnavailableException.class,
                    () -> creationService.createInvoice(OWNER, 1, 3600));

            assertEquals("failed to create payment invoice", ex.getMessage());
        }
    }

    @Nested
    @DisplayName("Creation Flow")
    class CreationFlow {

        @Test
        @DisplayName("fee is charged per voucher and described for the payer")
        void invoicesFee() {
            String hash = stubInvoice(false);

            CreationInvoiceResponse response = creationService.createInvoice(OWNER, 3, 3600);

            assertEquals(30, response.feeSats());
            assertEquals(hash, response.paymentHash());
            assertTrue(response.invoice().startsWith("lnbc1"));
            verify(gateway).createInvoice(30_000, "TipMe: create 3 voucher(s)");
        }

        @Test
        @DisplayName("a settled invoice completes the request with working LNURLs")
        void paidRequestCompletes() {
            String hash = stubInvoice(true);

            creationService.createInvoice(OWNER, 2, 7200);
            CreationStatusResponse status = creationService.getStatus(hash);

            assertEquals("complete", status.status());
            assertEquals(2, status.vouchers().size());
            List<Voucher> vouchers = store.findVouchersByCreationRequest(hash);
            for (int i = 0; i < 2; i++) {
                CreationStatusResponse.VoucherLinksResponse links = status.vouchers().get(i);
                Voucher voucher = vouchers.get(i);
                assertEquals("https://tipme.example/pay/" + voucher.getPayId(),
                        Bech32Utils.decodeLnurl(links.lnurlPay()));
                assertEquals("https://tipme.example/withdraw/" + voucher.getWithdrawId(),
                        Bech32Utils.decodeLnurl(links.lnurlWithdraw()));
                assertEquals(OWNER, links.lightningAddress());
                assertEquals(7200, links.relativeExpirySeconds());
                assertEquals("2027-01-01T00:00:00Z", links.absoluteExpiry());
            }
        }

        @Test
        @DisplayName("an unpaid invoice expires the request and lists no vouchers")
        void unpaidRequestExpires() {
            String hash = stubInvoice(false);

            creationService.createInvoice(OWNER, 1, 3600);
            CreationStatusResponse status = creationService.getStatus(hash);

            assertEquals("expired", status.status());
            assertNull(status.vouchers());
            assertTrue(store.findVouchersByCreationRequest(hash).isEmpty());
        }

        @Test
        @DisplayName("pending status while the invoice is still open")
        void pendingStatus() {
            String hash = randomHash();
            store.createCreationRequest(hash, OWNER, 1, 3600, 10_000);

            assertEquals("pending", creationService.getStatus(hash).status());
        }

        @Test
        @DisplayName("non-positive expiry selects the 30 day default")
        void defaultExpiry() {
            String hash = stubInvoice(true);

            creationService.createInvoice(OWNER, 1, 0);

            assertEquals(2_592_000, store.findCreationRequest(hash).orElseThrow().getExpirySeconds());
            assertEquals(CreationStatus.COMPLETE, store.findCreationRequest(hash).orElseThrow().getStatus());
        }

        @Test
        @DisplayName("unknown payment hash is not found")
        void unknownHash() {
            VoucherNotFoundException ex = assertThrows(VoucherNotFoundException.class,
                    () -> creationService.getStatus(randomHash()));
            assertEquals("not found", ex.getMessage());
        }
    }
}
