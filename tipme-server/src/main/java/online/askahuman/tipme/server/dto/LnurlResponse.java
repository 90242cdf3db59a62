package online.askahuman.tipme.server.dto;

/**
 * Body of an LNURL endpoint. Wallets only read the body, so both successes and protocol
 * errors are returned with HTTP 200.
 */
public interface LnurlResponse {
}
