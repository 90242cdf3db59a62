package online.askahuman.tipme.server.web;

import online.askahuman.tipme.server.dto.LnurlResponse;
import online.askahuman.tipme.server.service.VoucherWithdrawalService;
import org.springframework.web.bind.annotation.*;

/**
 * LNURL-withdraw endpoints a wallet reaches through a voucher's {@code lnurl_withdraw} code.
 */
@RestController
@RequestMapping("/withdraw")
public class LnurlWithdrawController {

    private final VoucherWithdrawalService withdrawalService;

    public LnurlWithdrawController(VoucherWithdrawalService withdrawalService) {
        this.withdrawalService = withdrawalService;
    }

    @GetMapping("/{withdrawId}")
    public LnurlResponse withdrawRequest(@PathVariable String withdrawId) {
        return withdrawalService.withdrawRequest(withdrawId);
    }

    @GetMapping("/{withdrawId}/callback")
    public LnurlResponse callback(@PathVariable String withdrawId,
                                  @RequestParam(required = false) String k1,
                                  @RequestParam(required = false) String pr) {
        return withdrawalService.withdrawCallback(withdrawId, k1, pr);
    }
}
