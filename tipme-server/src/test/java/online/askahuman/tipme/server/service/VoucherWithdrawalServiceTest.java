package online.askahuman.tipme.server.service;

import online.askahuman.tipme.gateway.LightningGateway;
import online.askahuman.tipme.gateway.PaymentResult;
import online.askahuman.tipme.lnurl.LightningAddressResolver;
import online.askahuman.tipme.lnurl.LnurlException;
import online.askahuman.tipme.server.ServerTestSupport;
import online.askahuman.tipme.server.config.VoucherProperties;
import online.askahuman.tipme.server.dto.LnurlResponse;
import online.askahuman.tipme.server.dto.LnurlStatusResponse;
import online.askahuman.tipme.server.dto.WithdrawRequestResponse;
import online.askahuman.tipme.server.entity.Voucher;
import online.askahuman.tipme.server.store.VoucherStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("VoucherWithdrawalService Tests")
class VoucherWithdrawalServiceTest extends ServerTestSupport {

    private static final String PR = "lnbc480n1holder";

    @Autowired
    private VoucherWithdrawalService withdrawalService;

    private static LnurlStatusResponse status(LnurlResponse response) {
        return assertInstanceOf(LnurlStatusResponse.class, response);
    }

    private Voucher fundedVoucher() {
        Voucher voucher = createVoucher();
        fund(voucher, 48_000);
        return voucher;
    }

    private String k1For(Voucher voucher) {
        WithdrawRequestResponse response = assertInstanceOf(WithdrawRequestResponse.class,
                withdrawalService.withdrawRequest(voucher.getWithdrawId()));
        return response.k1();
    }

    @Nested
    @DisplayName("Withdraw Request")
    class WithdrawRequest {

        @Test
        @DisplayName("offers the whole balance as both min and max")
        void offersWholeBalance() {
            Voucher voucher = fundedVoucher();

            WithdrawRequestResponse response = assertInstanceOf(WithdrawRequestResponse.class,
                    withdrawalService.withdrawRequest(voucher.getWithdrawId()));

            assertEquals("withdrawRequest", response.tag());
            assertEquals("https://tipme.example/withdraw/" + voucher.getWithdrawId() + "/callback",
                    response.callback());
            assertEquals(48_000, response.minWithdrawable());
            assertEquals(48_000, response.maxWithdrawable());
            assertEquals("TipMe withdrawal", response.defaultDescription());
            assertTrue(response.k1().matches("[0-9a-f]{64}"));
        }

        @Test
        @DisplayName("unknown, unfunded and inactive vouchers are refused")
        void refuses() {
            Voucher unfunded = createVoucher();
            Voucher withdrawn = fundedVoucher();
            store.deactivateForWithdrawal(withdrawn.getPayId());

            assertEquals("voucher not found", status(withdrawalService.withdrawRequest("nope")).reason());
            assertEquals("voucher has no balance",
                    status(withdrawalService.withdrawRequest(unfunded.getWithdrawId())).reason());
            assertEquals("voucher is not active",
                    status(withdrawalService.withdrawRequest(withdrawn.getWithdrawId())).reason());
        }
    }

    @Nested
    @DisplayName("Withdraw Callback")
    class WithdrawCallback {

        @Test
        @DisplayName("a successful payment zeroes and deactivates the voucher")
        void successDeactivates() {
            Voucher voucher = fundedVoucher();
            String k1 = k1For(voucher);
            when(gateway.payInvoice(PR)).thenReturn(PaymentResult.succeeded("h"));

            LnurlStatusResponse response = status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, PR));

            assertEquals("OK", response.status());
            assertNull(response.reason());
            Voucher after = reload(voucher);
            assertFalse(after.isActiveFlag());
            assertEquals(0, after.getTotalPaidMsats());
        }

        @Test
        @DisplayName("a k1 cannot be replayed")
        void replayRejected() {
            Voucher voucher = fundedVoucher();
            String k1 = k1For(voucher);
            when(gateway.payInvoice(PR)).thenReturn(PaymentResult.succeeded("h"));

            withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, PR);
            LnurlStatusResponse replay = status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, PR));

            assertEquals("invalid or already-used k1", replay.reason());
            verify(gateway, times(1)).payInvoice(PR);
        }

        @Test
        @DisplayName("a definitive failure keeps the voucher funded for another attempt")
        void failureKeepsVoucher() {
            Voucher voucher = fundedVoucher();
            when(gateway.payInvoice(PR))
                    .thenReturn(PaymentResult.failed("no route"))
                    .thenReturn(PaymentResult.succeeded("h"));

            LnurlStatusResponse first = status(
                    withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1For(voucher), PR));
            assertEquals("payment failed", first.reason());
            Voucher kept = reload(voucher);
            assertTrue(kept.isActiveFlag());
            assertEquals(48_000, kept.getTotalPaidMsats());

            LnurlStatusResponse retry = status(
                    withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1For(voucher), PR));
            assertEquals("OK", retry.status());
            assertEquals(0, reload(voucher).getTotalPaidMsats());
        }

        @Test
        @DisplayName("an ambiguous payment deactivates the voucher")
        void ambiguousDeactivates() {
            Voucher voucher = fundedVoucher();
            String k1 = k1For(voucher);
            when(gateway.payInvoice(PR)).thenReturn(PaymentResult.ambiguous("request timed out"));

            LnurlStatusResponse response = status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, PR));

            assertEquals("payment timed out", response.reason());
            Voucher after = reload(voucher);
            assertFalse(after.isActiveFlag());
            assertEquals(0, after.getTotalPaidMsats());
        }

        @Test
        @DisplayName("missing parameters are rejected without touching the session")
        void missingParameters() {
            Voucher voucher = fundedVoucher();
            String k1 = k1For(voucher);

            assertEquals("missing k1 or pr parameter",
                    status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), null, PR)).reason());
            assertEquals("missing k1 or pr parameter",
                    status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, "")).reason());
            verify(gateway, never()).payInvoice(anyString());

            when(gateway.payInvoice(PR)).thenReturn(PaymentResult.succeeded("h"));
            assertEquals("OK", status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, PR)).status());
        }

        @Test
        @DisplayName("a k1 issued for another voucher is rejected")
        void foreignK1() {
            List<Voucher> vouchers = createVouchers(2, 3600);
            fund(vouchers.get(0), 48_000);
            fund(vouchers.get(1), 48_000);
            String k1 = k1For(vouchers.get(0));

            assertEquals("invalid or already-used k1",
                    status(withdrawalService.withdrawCallback(vouchers.get(1).getWithdrawId(), k1, PR)).reason());
            verify(gateway, never()).payInvoice(anyString());
        }

        @Test
        @DisplayName("a second withdrawal during an in-flight payment is refused")
        void inFlightGuard() {
            Voucher voucher = fundedVoucher();
            String first = k1For(voucher);
            String second = k1For(voucher);
            AtomicReference<LnurlResponse> nested = new AtomicReference<>();
            doAnswer(inv -> {
                nested.set(withdrawalService.withdrawCallback(voucher.getWithdrawId(), second, "lnbc2"));
                return PaymentResult.succeeded("h");
            }).when(gateway).payInvoice(PR);

            assertEquals("OK", status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), first, PR)).status());
            assertEquals("withdrawal already in progress", status(nested.get()).reason());
            verify(gateway, never()).payInvoice("lnbc2");
        }

        @Test
        @DisplayName("funds credited during the payment are refunded to the owner")
        void surplusRefunded() {
            Voucher voucher = fundedVoucher();
            String k1 = k1For(voucher);
            doAnswer(inv -> {
                fund(voucher, 10_000);
                return PaymentResult.succeeded("h");
            }).when(gateway).payInvoice(PR);
            when(resolver.resolve(OWNER)).thenReturn(
                    new LightningAddressResolver.PayParams("https://example.com/cb", 1000, 100_000_000));
            when(resolver.requestInvoice("https://example.com/cb", 10_000)).thenReturn("lnbcsurplus");
            when(gateway.payInvoice("lnbcsurplus")).thenReturn(PaymentResult.succeeded("s"));

            assertEquals("OK", status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, PR)).status());

            verify(gateway).payInvoice("lnbcsurplus");
            assertEquals(0, reload(voucher).getTotalPaidMsats());
        }

        @Test
        @DisplayName("funds credited during an ambiguous payment are refunded to the owner")
        void ambiguousSurplusRefunded() {
            Voucher voucher = fundedVoucher();
            String k1 = k1For(voucher);
            doAnswer(inv -> {
                fund(voucher, 10_000);
                return PaymentResult.ambiguous("request timed out");
            }).when(gateway).payInvoice(PR);
            when(resolver.resolve(OWNER)).thenReturn(
                    new LightningAddressResolver.PayParams("https://example.com/cb", 1000, 100_000_000));
            when(resolver.requestInvoice("https://example.com/cb", 10_000)).thenReturn("lnbcsurplus");
            when(gateway.payInvoice("lnbcsurplus")).thenReturn(PaymentResult.succeeded("s"));

            assertEquals("payment timed out",
                    status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, PR)).reason());

            verify(resolver).requestInvoice("https://example.com/cb", 10_000);
            verify(gateway).payInvoice("lnbcsurplus");
            Voucher after = reload(voucher);
            assertFalse(after.isActiveFlag());
            assertEquals(0, after.getTotalPaidMsats());
        }
    }

    @Nested
    @DisplayName("Invoice Amount")
    class InvoiceAmount {

        @Test
        @DisplayName("an invoice for more than the balance is refused before paying")
        void largerInvoiceRefused() {
            Voucher voucher = fundedVoucher();
            String k1 = k1For(voucher);

            LnurlStatusResponse response = status(
                    withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, "lnbc100u1holder"));

            assertEquals("invoice amount does not match balance", response.reason());
            verify(gateway, never()).payInvoice(anyString());
            Voucher kept = reload(voucher);
            assertTrue(kept.isActiveFlag());
            assertEquals(48_000, kept.getTotalPaidMsats());
        }

        @Test
        @DisplayName("smaller and amountless invoices are refused too")
        void smallerOrAmountlessRefused() {
            Voucher voucher = fundedVoucher();

            assertEquals("invoice amount does not match balance", status(withdrawalService.withdrawCallback(
                    voucher.getWithdrawId(), k1For(voucher), "lnbc470n1holder")).reason());
            assertEquals("invoice amount does not match balance", status(withdrawalService.withdrawCallback(
                    voucher.getWithdrawId(), k1For(voucher), "lnbc1holder")).reason());
            verify(gateway, never()).payInvoice(anyString());
            assertEquals(48_000, reload(voucher).getTotalPaidMsats());
        }

        @Test
        @DisplayName("a malformed invoice is refused")
        void malformedRefused() {
            Voucher voucher = fundedVoucher();

            assertEquals("invalid invoice", status(withdrawalService.withdrawCallback(
                    voucher.getWithdrawId(), k1For(voucher), "not-an-invoice")).reason());
            verify(gateway, never()).payInvoice(anyString());
        }

        @Test
        @DisplayName("a gateway that cannot decode leaves the voucher untouched")
        void decodeFailure() {
            Voucher voucher = fundedVoucher();
            when(gateway.decodeAmountMsats(PR)).thenThrow(new LnurlException("node unreachable"));

            assertEquals("failed to decode invoice", status(withdrawalService.withdrawCallback(
                    voucher.getWithdrawId(), k1For(voucher), PR)).reason());
            verify(gateway, never()).payInvoice(anyString());
            assertTrue(reload(voucher).isActiveFlag());
        }
    }

    @Nested
    @DisplayName("Concurrent Refund")
    @ExtendWith(OutputCaptureExtension.class)
    class ConcurrentRefund {

        @Test
        @DisplayName("a refund sweeping the voucher mid-payment is flagged for reconciliation")
        void sweptDuringPayment(CapturedOutput output) {
            Voucher voucher = fundedVoucher();
            String k1 = k1For(voucher);
            doAnswer(inv -> {
                assertEquals(48_000, store.deactivateForRefund(voucher.getPayId()).getAsLong());
                return PaymentResult.succeeded("h");
            }).when(gateway).payInvoice(PR);

            assertEquals("OK", status(withdrawalService.withdrawCallback(voucher.getWithdrawId(), k1, PR)).status());

            verify(resolver, never()).requestInvoice(anyString(), anyLong());
            assertEquals(0, reload(voucher).getTotalPaidMsats());
            assertTrue(output.getAll().contains("CRITICAL: voucher pay_id=" + voucher.getPayId()));
            assertTrue(output.getAll().contains("a concurrent refund already went out"));
        }
    }

    @Nested
    @DisplayName("Deactivation Failure")
    class DeactivationFailure {

        @Test
        @DisplayName("a paid withdrawal is reported OK even if deactivation fails")
        void paidButNotDeactivated() {
            VoucherProperties properties = new VoucherProperties();
            properties.setBaseUrl("https://tipme.example");
            Clock fixed = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
            Voucher voucher = new Voucher("pay", "withdraw", null, 0, OWNER, 3600, fixed.instant());
            voucher.credit(48_000, fixed.instant());

            VoucherStore mockStore = mock(VoucherStore.class);
            LightningGateway mockGateway = mock(LightningGateway.class);
            when(mockStore.consumeWithdrawSession("k1", "withdraw")).thenReturn("pay");
            when(mockStore.findVoucherByPayId("pay")).thenReturn(Optional.of(voucher));
            when(mockStore.deactivateForWithdrawal("pay"))
                    .thenThrow(new DataAccessResourceFailureException("database gone"));
            when(mockGateway.decodeAmountMsats(PR)).thenReturn(OptionalLong.of(48_000));
            when(mockGateway.payInvoice(PR)).thenReturn(PaymentResult.succeeded("h"));

            VoucherWithdrawalService service = new VoucherWithdrawalService(mockStore, mockGateway,
                    mock(RefundService.class), new ConfirmationTaskRunner(Runnable::run),
                    new VoucherLinks(properties), properties, fixed);

            assertEquals("OK", status(service.withdrawCallback("withdraw", "k1", PR)).status());
        }
    }
}
