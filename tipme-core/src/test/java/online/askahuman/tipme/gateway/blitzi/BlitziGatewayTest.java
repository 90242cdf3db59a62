package online.askahuman.tipme.gateway.blitzi;

import online.askahuman.tipme.gateway.GatewayInvoice;
import online.askahuman.tipme.gateway.PaymentOutcome;
import online.askahuman.tipme.lnurl.LnurlException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.ConnectException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("BlitziGateway Tests")
class BlitziGatewayTest {

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> resp = mock(HttpResponse.class);
        when(resp.statusCode()).thenReturn(status);
        when(resp.body()).thenReturn(body);
        return resp;
    }

    private static HttpClient httpReturning(HttpResponse<String> resp) throws Exception {
        HttpClient http = mock(HttpClient.class);
        doReturn(resp).when(http).send(any(HttpRequest.class), any());
        return http;
    }

    private static BlitziGateway gatewayWith(HttpClient http, String token) {
        return new BlitziGateway("http://localhost:3000/", token, http, Duration.ofMillis(10));
    }

    @Test
    @DisplayName("createInvoice posts to /invoice with the bearer token")
    void shouldCreateInvoice() throws Exception {
        HttpClient http = httpReturning(response(200, "{\"payment_hash\":\"h1\",\"invoice\":\"lnbc1\"}"));

        GatewayInvoice invoice = gatewayWith(http, "secret").createInvoice(5000, "TipMe voucher funding");

        assertEquals("h1", invoice.paymentHash());
        assertEquals("lnbc1", invoice.invoice());
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any());
        assertEquals("http://localhost:3000/invoice", captor.getValue().uri().toString());
        assertEquals("Bearer secret", captor.getValue().headers().firstValue("Authorization").orElse(null));
    }

    @Test
    @DisplayName("no Authorization header without a token")
    void shouldOmitAuthorizationWithoutToken() throws Exception {
        HttpClient http = httpReturning(response(200, "{\"payment_hash\":\"h1\",\"paid\":false}"));

        assertFalse(gatewayWith(http, "").isInvoicePaid("h1"));
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(http).send(captor.capture(), any());
        assertTrue(captor.getValue().headers().firstValue("Authorization").isEmpty());
        assertEquals("http://localhost:3000/invoice/h1", captor.getValue().uri().toString());
    }

    @Test
    @DisplayName("isInvoicePaid reads the paid flag")
    void shouldReadPaidFlag() throws Exception {
        assertTrue(gatewayWith(httpReturning(response(200, "{\"paid\":true}")), null).isInvoicePaid("h1"));
    }

    @Test
    @DisplayName("incomplete invoice response throws LnurlException")
    void shouldRejectIncompleteInvoice() throws Exception {
        BlitziGateway gateway = gatewayWith(httpReturning(response(200, "{\"payment_hash\":\"h1\"}")), null);

        assertThrows(LnurlException.class, () -> gateway.createInvoice(1000, "x"));
    }

    @Test
    @DisplayName("pay classifies success, error and transport outcomes")
    void shouldClassifyPayments() throws Exception {
        assertEquals(PaymentOutcome.SUCCEEDED,
                gatewayWith(httpReturning(response(200, "{\"success\":true}")), null).payInvoice("lnbc1").outcome());
        assertEquals(PaymentOutcome.SUCCEEDED,
                gatewayWith(httpReturning(response(200, "")), null).payInvoice("lnbc1").outcome());
        assertEquals(PaymentOutcome.FAILED,
                gatewayWith(httpReturning(response(200, "{\"success\":false,\"error\":\"no route\"}")), null)
                        .payInvoice("lnbc1").outcome());
        assertEquals(PaymentOutcome.FAILED,
                gatewayWith(httpReturning(response(500, "boom")), null).payInvoice("lnbc1").outcome());

        HttpClient timingOut = mock(HttpClient.class);
        doThrow(new HttpTimeoutException("timed out")).when(timingOut).send(any(HttpRequest.class), any());
        assertEquals(PaymentOutcome.AMBIGUOUS, gatewayWith(timingOut, null).payInvoice("lnbc1").outcome());

        HttpClient refusing = mock(HttpClient.class);
        doThrow(new ConnectException("refused")).when(refusing).send(any(HttpRequest.class), any());
        assertEquals(PaymentOutcome.FAILED, gatewayWith(refusing, null).payInvoice("lnbc1").outcome());
    }

    @Test
    @DisplayName("decodeAmountMsats reads the invoice prefix without calling Blitzi")
    void shouldDecodeLocally() throws Exception {
        HttpClient http = mock(HttpClient.class);

        assertEquals(OptionalLong.of(48_000), gatewayWith(http, null).decodeAmountMsats("lnbc480n1pjqq0sd"));
        verify(http, never()).send(any(HttpRequest.class), any());
    }
}
