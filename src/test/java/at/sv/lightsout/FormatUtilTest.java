package at.sv.lightsout;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

class FormatUtilTest {

    @Test
    void formatBrightnessPercent() {
        assertThat(FormatUtil.formatBrightnessPercent(0), is("0"));
        assertThat(FormatUtil.formatBrightnessPercent(127), is("50"));
        assertThat(FormatUtil.formatBrightnessPercent(126), is("49.6"));
        assertThat(FormatUtil.formatBrightnessPercent(200), is("78.7"));
        assertThat(FormatUtil.formatBrightnessPercent(254), is("100"));
    }

    @Test
    void roundConfidence_twoDecimals() {
        assertThat(FormatUtil.roundConfidence(0.66666), is(0.67));
        assertThat(FormatUtil.roundConfidence(1.0), is(1.0));
    }

    @Test
    void formatConfidencePercent() {
        assertThat(FormatUtil.formatConfidencePercent(0.854), is("85%"));
        assertThat(FormatUtil.formatConfidencePercent(1.0), is("100%"));
    }
}
