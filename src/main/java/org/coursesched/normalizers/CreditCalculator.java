package org.coursesched.normalizers;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;

import static org.coursesched.normalizers.RawRecords.CREDIT_HOURS;
import static org.coursesched.normalizers.RawRecords.CREDIT_HOUR_SESSION;

@UtilityClass
public class CreditCalculator {

    /**
     * Explicit section credit hours when present and non-zero, otherwise the sum of per-meeting session credits.
     */
    public static double credits(JsonNode record) {
        final var credits = RawRecords.number(record, CREDIT_HOURS, 0.0);
        if (credits != 0.0) return credits;

        var sum = 0.0;
        for (final var block : RawRecords.meetingBlocks(record)) {
            sum += RawRecords.number(block, CREDIT_HOUR_SESSION, 0.0);
        }
        return sum;
    }
}
