package com.govcomms.collector.dto;

import java.time.YearMonth;

public record MonthlyCount(YearMonth month, long count) {
}
