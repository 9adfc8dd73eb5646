package com.guno.drawimport.api.explore;

import java.time.LocalDate;
import java.time.chrono.MinguoChronology;
import java.time.chrono.MinguoDate;
import java.time.format.DateTimeFormatter;

/**
 * Ways the upstream may expect the draw date to be written.
 */
public enum DateFormatVariant {

    ISO(DateTimeFormatter.ISO_LOCAL_DATE),
    SLASH(DateTimeFormatter.ofPattern("yyyy/MM/dd")),
    COMPACT(DateTimeFormatter.BASIC_ISO_DATE),
    /** Republic of China calendar, e.g. 114/08/19. */
    ROC(DateTimeFormatter.ofPattern("yyy/MM/dd").withChronology(MinguoChronology.INSTANCE));

    private final DateTimeFormatter formatter;

    DateFormatVariant(DateTimeFormatter formatter) {
        this.formatter = formatter;
    }

    public String format(LocalDate date) {
        if (this == ROC) {
            return formatter.format(MinguoDate.from(date));
        }
        return formatter.format(date);
    }
}
