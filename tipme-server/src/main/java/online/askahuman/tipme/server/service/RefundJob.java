package online.askahuman.tipme.server.service;

import online.askahuman.tipme.server.entity.Voucher;
import online.askahuman.tipme.server.store.VoucherStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * One sweep over expired funded vouchers. Scheduling lives in
 * {@link online.askahuman.tipme.server.config.RefundJobConfiguration}.
 */
@Component
public class RefundJob implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RefundJob.class);

    private final VoucherStore store;
    private final RefundService refundService;

    public RefundJob(VoucherStore store, RefundService refundService) {
        this.store = store;
        this.refundService = refundService;
    }

    @Override
    public void run() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Refund sweep failed", e);
        }
    }

    /**
     * Refunds every voucher that is due, one at a time. A failure on one voucher is logged and
     * the sweep moves on.
     *
     * @return number of vouchers a refund was attempted for
     */
    public int sweep() {
        List<Voucher> expired = store.findExpiredFundedVouchers();
        log.info("Refund sweep: {} expired voucher(s) with balance", expired.size());

        int attempted = 0;
        for (Voucher voucher : expired) {
            try {
                if (refundService.refundExpiredVoucher(voucher) != null) {
                    attempted++;
                }
            } catch (RuntimeException e) {
                log.error("Refund of pay_id={} failed", voucher.getPayId(), e);
            }
        }
        return attempted;
    }
}
