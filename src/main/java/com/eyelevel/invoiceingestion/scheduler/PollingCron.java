package com.eyelevel.invoiceingestion.scheduler;

/**
 * Turns a polling frequency in minutes into a six-field Spring cron expression.
 */
public final class PollingCron {

    private PollingCron() {
    }

    public static String fromMinutes(final int minutes) {
        if (minutes < 60) {
            return "0 */" + minutes + " * * * *";
        }
        if (minutes == 60) {
            return "0 0 * * * *";
        }
        if (minutes < 1440) {
            return "0 0 */" + (minutes / 60) + " * * *";
        }
        return "0 0 0 * * *";
    }
}
