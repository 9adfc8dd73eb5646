package com.guno.drawimport.util;

import lombok.experimental.UtilityClass;

import java.util.Comparator;

/**
 * Ordering of period keys by numeric value. Periods can exceed the int range, so digit
 * strings are compared by significant length first, then lexicographically. Non-numeric keys
 * sort after numeric ones, by plain string order.
 */
@UtilityClass
public class PeriodOrder {

    public static final Comparator<String> ASCENDING = PeriodOrder::compare;

    public static int compare(String a, String b) {
        boolean an = NumericTokens.isAllDigits(a);
        boolean bn = NumericTokens.isAllDigits(b);

        if (an && bn) {
            String x = NumericTokens.stripLeadingZeros(a);
            String y = NumericTokens.stripLeadingZeros(b);
            if (x.length() != y.length()) return Integer.compare(x.length(), y.length());
            int c = x.compareTo(y);
            return c != 0 ? c : a.compareTo(b);
        }
        if (an) return -1;
        if (bn) return 1;
        return a.compareTo(b);
    }
}
