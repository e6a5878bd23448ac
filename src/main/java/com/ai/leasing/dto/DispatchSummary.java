package com.ai.leasing.dto;

import lombok.Getter;
import lombok.ToString;

/** Counts for one dispatch cycle. */
@Getter
@ToString
public class DispatchSummary {

    private int picked;
    private int sent;
    private int retried;
    private int failed;
    private int skipped;
    private int errors;

    public void picked(int count) {
        picked = count;
    }

    public void sent() {
        sent++;
    }

    public void retried() {
        retried++;
    }

    public void failed() {
        failed++;
    }

    public void skipped() {
        skipped++;
    }

    public void error() {
        errors++;
    }
}
