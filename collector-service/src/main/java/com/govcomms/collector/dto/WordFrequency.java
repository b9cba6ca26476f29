package com.govcomms.collector.dto;

public record WordFrequency(String word, long count) {
}
