package com.eyelevel.invoiceingestion.scheduler;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.scheduling.support.CronExpression;

import static org.assertj.core.api.Assertions.assertThat;

class PollingCronTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "5    | 0 */5 * * * *",
            "30   | 0 */30 * * * *",
            "60   | 0 0 * * * *",
            "120  | 0 0 */2 * * *",
            "720  | 0 0 */12 * * *",
            "1440 | 0 0 0 * * *"
    })
    void mapsFrequencyToCron(int minutes, String expected) {
        final String cron = PollingCron.fromMinutes(minutes);

        assertThat(cron).isEqualTo(expected);
        assertThat(CronExpression.isValidExpression(cron)).isTrue();
    }
}
