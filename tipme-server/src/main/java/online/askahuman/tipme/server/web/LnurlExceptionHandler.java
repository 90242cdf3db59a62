package online.askahuman.tipme.server.web;

import online.askahuman.tipme.server.dto.LnurlStatusResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * LNURL wallets only parse the body, so anything that escapes the pay and withdraw flows is
 * still answered with HTTP 200 and an LNURL error object.
 */
@RestControllerAdvice(assignableTypes = {LnurlPayController.class, LnurlWithdrawController.class})
@Order(Ordered.HIGHEST_PRECEDENCE)
public class LnurlExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(LnurlExceptionHandler.class);

    @ExceptionHandler(DataAccessException.class)
    @ResponseStatus(HttpStatus.OK)
    public LnurlStatusResponse handleStorage(DataAccessException ex) {
        log.error("Storage error in LNURL flow", ex);
        return LnurlStatusResponse.error("database error");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.OK)
    public LnurlStatusResponse handleUnexpected(Exception ex) {
        log.error("Unexpected error in LNURL flow", ex);
        return LnurlStatusResponse.error("internal error");
    }
}
