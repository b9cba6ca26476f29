package com.govcomms.collector.dto;

import java.time.LocalDate;

public record DailyAverage(LocalDate date, double value) {
}
