package com.hoteldesk.frontdesk.exception;

import com.hoteldesk.common.exception.ValidationException;

import java.math.BigDecimal;

public class TotalOutOfRangeException extends ValidationException {

    public TotalOutOfRangeException(BigDecimal total, BigDecimal limit) {
        super(String.format("Booking total %s exceeds the limit of %s", total.toPlainString(), limit.toPlainString()),
                "TOTAL_OUT_OF_RANGE");
    }
}
