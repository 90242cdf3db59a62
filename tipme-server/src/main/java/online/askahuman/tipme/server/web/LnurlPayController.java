package online.askahuman.tipme.server.web;

import online.askahuman.tipme.server.dto.LnurlResponse;
import online.askahuman.tipme.server.service.VoucherFundingService;
import org.springframework.web.bind.annotation.*;

/**
 * LNURL-pay endpoints a wallet reaches through a voucher's {@code lnurl_pay} code.
 */
@RestController
@RequestMapping("/pay")
public class LnurlPayController {

    private final VoucherFundingService fundingService;

    public LnurlPayController(VoucherFundingService fundingService) {
        this.fundingService = fundingService;
    }

    @GetMapping("/{payId}")
    public LnurlResponse payRequest(@PathVariable String payId) {
        return fundingService.payRequest(payId);
    }

    @GetMapping("/{payId}/callback")
    public LnurlResponse callback(@PathVariable String payId,
                                  @RequestParam(required = false) String amount) {
        return fundingService.payCallback(payId, amount);
    }
}
