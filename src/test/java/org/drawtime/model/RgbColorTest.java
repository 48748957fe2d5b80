package org.drawtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class RgbColorTest {

    @Test
    void parsesSixHexDigitsInAnyCase() {
        RgbColor color = RgbColor.parseHex("ffCC00");

        assertThat(color.red()).isEqualTo(0xFF);
        assertThat(color.green()).isEqualTo(0xCC);
        assertThat(color.blue()).isZero();
        assertThat(color.toHex()).isEqualTo("FFCC00");
    }

    @Test
    void rejectsOtherNotations() {
        assertThatThrownBy(() -> RgbColor.parseHex("#FFCC00")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbColor.parseHex("FFF")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbColor.parseHex("GG0000")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RgbColor(0x1000000)).isInstanceOf(IllegalArgumentException.class);
    }
}
