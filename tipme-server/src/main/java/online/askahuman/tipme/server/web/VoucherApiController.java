package online.askahuman.tipme.server.web;

import online.askahuman.tipme.server.dto.CreateVoucherRequest;
import online.askahuman.tipme.server.dto.CreationInvoiceResponse;
import online.askahuman.tipme.server.dto.CreationStatusResponse;
import online.askahuman.tipme.server.dto.VoucherSummaryResponse;
import online.askahuman.tipme.server.service.VoucherCreationService;
import online.askahuman.tipme.server.service.VoucherFundingService;
import org.springframework.web.bind.annotation.*;

/**
 * JSON API for buying vouchers and inspecting them.
 *
 * <ul>
 *   <li>POST /api/vouchers/invoice -- invoice the creation fee for a batch</li>
 *   <li>GET /api/vouchers/status/{paymentHash} -- poll a batch; lists vouchers once complete</li>
 *   <li>GET /api/vouchers/{payId} -- balance, expiry and funding history of one voucher</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/vouchers")
public class VoucherApiController {

    private final VoucherCreationService creationService;
    private final VoucherFundingService fundingService;

    public VoucherApiController(VoucherCreationService creationService, VoucherFundingService fundingService) {
        this.creationService = creationService;
        this.fundingService = fundingService;
    }

    @PostMapping("/invoice")
    public CreationInvoiceResponse createInvoice(@RequestBody CreateVoucherRequest request) {
        return creationService.createInvoice(request.lightningAddress(), request.count(), request.expirySeconds());
    }

    @GetMapping("/status/{paymentHash}")
    public CreationStatusResponse status(@PathVariable String paymentHash) {
        return creationService.getStatus(paymentHash);
    }

    @GetMapping("/{payId}")
    public VoucherSummaryResponse summary(@PathVariable String payId) {
        return fundingService.summary(payId);
    }
}
