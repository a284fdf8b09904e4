package com.guildledger.allowance;

import lombok.Value;

import java.time.YearMonth;

/**
 * Counts from one monthly payroll run.
 */
@Value
public class AllowanceRunSummary {
    YearMonth yearMonth;
    int paid;
    int alreadyPaid;
    int failed;
}
