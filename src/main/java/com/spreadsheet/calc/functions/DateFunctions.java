package com.spreadsheet.calc.functions;

import com.spreadsheet.calc.exceptions.NumericDomainException;
import com.spreadsheet.calc.models.CellValue;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.function.ToIntFunction;

/**
 * Serial dates of the 1900 date system: day 1 is 1900-01-01 and day 60 is
 * the fictitious 1900-02-29 kept for Lotus compatibility.
 */
final class DateFunctions {

    static final String CATEGORY = "Date";

    private static final LocalDate EPOCH = LocalDate.of(1899, 12, 31);
    private static final int LEAP_BUG_SERIAL = 60;
    private static final int MAX_SERIAL = 2958465; // 9999-12-31

    private DateFunctions() {
    }

    static void register(FunctionRegistry registry) {
        registry.register("DATE", CATEGORY, 3, 3, (ctx, args) -> {
            int year = Coercion.toInt(args.get(0), ctx);
            int month = Coercion.toInt(args.get(1), ctx);
            int day = Coercion.toInt(args.get(2), ctx);
            if (year < 1900) {
                year += 1900;
            }
            if (year < 1900 || year > 9999) {
                throw new NumericDomainException("Year out of range: " + year);
            }
            LocalDate date = LocalDate.of(year, 1, 1).plusMonths(month - 1L).plusDays(day - 1L);
            return CellValue.of(toSerial(date));
        });
        registry.register("YEAR", CATEGORY, 1, 1, part(d -> d == null ? 1900 : d.getYear()));
        registry.register("MONTH", CATEGORY, 1, 1, part(d -> d == null ? 2 : d.getMonthValue()));
        registry.register("DAY", CATEGORY, 1, 1, part(d -> d == null ? 29 : d.getDayOfMonth()));
    }

    static long toSerial(LocalDate date) {
        long serial = ChronoUnit.DAYS.between(EPOCH, date);
        if (serial < 1) {
            throw new NumericDomainException("Date before 1900: " + date);
        }
        long adjusted = serial >= LEAP_BUG_SERIAL ? serial + 1 : serial;
        if (adjusted > MAX_SERIAL) {
            throw new NumericDomainException("Date after 9999-12-31: " + date);
        }
        return adjusted;
    }

    /**
     * Date of a serial number; null for the phantom 1900-02-29.
     */
    static LocalDate fromSerial(double serial) {
        long day = (long) Math.floor(serial);
        if (day < 0 || day > MAX_SERIAL) {
            throw new NumericDomainException("Serial date out of range: " + serial);
        }
        if (day == LEAP_BUG_SERIAL) {
            return null;
        }
        if (day == 0) {
            // Excel shows serial 0 as 1900-01-00
            return EPOCH;
        }
        return EPOCH.plusDays(day > LEAP_BUG_SERIAL ? day - 1 : day);
    }

    // the phantom leap day is 1900-02-29, hence the literal fallbacks above
    private static ExcelFunction part(ToIntFunction<LocalDate> extractor) {
        return (ctx, args) -> CellValue.of(extractor.applyAsInt(fromSerial(Coercion.toNumber(args.get(0), ctx))));
    }
}
