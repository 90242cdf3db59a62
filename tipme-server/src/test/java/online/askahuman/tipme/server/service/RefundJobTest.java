package online.askahuman.tipme.server.service;

import online.askahuman.tipme.gateway.PaymentResult;
import online.askahuman.tipme.lnurl.LightningAddressResolver;
import online.askahuman.tipme.server.ServerTestSupport;
import online.askahuman.tipme.server.entity.Voucher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RefundJob Tests")
class RefundJobTest extends ServerTestSupport {

    private static final String CALLBACK = "https://example.com/cb";

    @Autowired
    private RefundJob refundJob;

    @BeforeEach
    void stubOwner() {
        when(resolver.resolve(OWNER)).thenReturn(
                new LightningAddressResolver.PayParams(CALLBACK, 1000, 100_000_000));
        when(resolver.requestInvoice(CALLBACK, 48_000)).thenReturn("lnbcrefund");
    }

    @Test
    @DisplayName("nothing is refunded before expiry")
    void nothingDue() {
        fund(createVoucher(), 48_000);

        assertEquals(0, refundJob.sweep());
        verify(gateway, never()).payInvoice(anyString());
    }

    @Test
    @DisplayName("an expired voucher is refunded exactly once across sweeps")
    void refundsOnce() {
        Voucher voucher = createVoucher();
        fund(voucher, 48_000);
        when(gateway.payInvoice("lnbcrefund")).thenReturn(PaymentResult.succeeded("h"));
        clock.advance(Duration.ofSeconds(3600));

        assertEquals(1, refundJob.sweep());
        assertEquals(0, refundJob.sweep());

        verify(gateway, times(1)).payInvoice("lnbcrefund");
        Voucher after = reload(voucher);
        assertFalse(after.isActiveFlag());
        assertEquals(0, after.getTotalPaidMsats());
    }

    @Test
    @DisplayName("a failed refund is retried on the next sweep")
    void retriesAfterFailure() {
        Voucher voucher = createVoucher();
        fund(voucher, 48_000);
        when(gateway.payInvoice("lnbcrefund"))
                .thenReturn(PaymentResult.failed("no route"))
                .thenReturn(PaymentResult.succeeded("h"));
        clock.advance(Duration.ofSeconds(7200));

        assertEquals(1, refundJob.sweep());
        Voucher restored = reload(voucher);
        assertTrue(restored.isActiveFlag());
        assertEquals(48_000, restored.getTotalPaidMsats());

        assertEquals(1, refundJob.sweep());
        assertEquals(0, refundJob.sweep());
        verify(gateway, times(2)).payInvoice("lnbcrefund");
        assertEquals(0, reload(voucher).getTotalPaidMsats());
    }

    @Test
    @DisplayName("an ambiguous refund is never retried")
    void ambiguousNotRetried() {
        Voucher voucher = createVoucher();
        fund(voucher, 48_000);
        when(gateway.payInvoice("lnbcrefund")).thenReturn(PaymentResult.ambiguous("timed out"));
        clock.advance(Duration.ofSeconds(3600));

        refundJob.sweep();
        refundJob.sweep();

        verify(gateway, times(1)).payInvoice("lnbcrefund");
        assertFalse(reload(voucher).isActiveFlag());
    }

    @Test
    @DisplayName("a failure on one voucher does not stop the sweep")
    void continuesPastFailures() {
        Voucher broken = createVoucher();
        Voucher healthy = createVoucher();
        fund(broken, 48_000);
        fund(healthy, 48_000);
        when(resolver.resolve(OWNER))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(new LightningAddressResolver.PayParams(CALLBACK, 1000, 100_000_000));
        when(gateway.payInvoice("lnbcrefund")).thenReturn(PaymentResult.succeeded("h"));
        clock.advance(Duration.ofSeconds(3600));

        refundJob.sweep();

        verify(gateway, times(1)).payInvoice("lnbcrefund");
    }
}
