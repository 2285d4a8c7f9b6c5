package com.geodash.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class NumericRounding {

    private NumericRounding() {
    }

    static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
