package com.onionwatch.tracker.links.model;

public record BatchReport(int batchNumber, int checked, int alive, int dead) {
}
