package com.rental.settlement.core;

import org.springframework.stereotype.Component;

/**
 * Flat success-fee slabs charged when a deal completes, in whole rupees.
 * Boundaries are strict: a rent of exactly 10,000 falls in the second slab.
 */
@Component
public class SuccessFeeSchedule {

    static final int LOW_SLAB_LIMIT = 10_000;
    static final int MID_SLAB_LIMIT = 25_000;

    static final int LOW_SLAB_FEE = 299;
    static final int MID_SLAB_FEE = 499;
    static final int HIGH_SLAB_FEE = 999;

    public int feeFor(int agreedRent) {
        if (agreedRent < LOW_SLAB_LIMIT) {
            return LOW_SLAB_FEE;
        }
        if (agreedRent < MID_SLAB_LIMIT) {
            return MID_SLAB_FEE;
        }
        return HIGH_SLAB_FEE;
    }
}
