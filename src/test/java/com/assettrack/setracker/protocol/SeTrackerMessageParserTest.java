package com.assettrack.setracker.protocol;

import com.assettrack.setracker.exception.FrameFormatException;
import com.assettrack.setracker.exception.LengthMismatchException;
import com.assettrack.setracker.model.SeTrackerMessage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeTrackerMessageParserTest {

    private final SeTrackerMessageParser parser = new SeTrackerMessageParser();

    @Test
    void parsesHexLengthFrame() throws Exception {
        SeTrackerMessage message = parser.parse("[3G*8800000015*000D*LK,50,100,100]");

        assertThat(message.getManufacturer()).isEqualTo("3G");
        assertThat(message.getDeviceId()).isEqualTo("8800000015");
        assertThat(message.getDeclaredLength()).isEqualTo(13);
        assertThat(message.getContent()).isEqualTo("LK,50,100,100");
        assertThat(message.getToken()).isEqualTo("LK");
    }

    @Test
    void readsLengthAsDecimalBeforeHex() throws Exception {
        SeTrackerMessage message = parser.parse("[CS*1234567890*0010*0123456789]");

        assertThat(message.getDeclaredLength()).isEqualTo(10);
    }

    @Test
    void fallsBackToHexWhenLengthIsNotDecimal() throws Exception {
        SeTrackerMessage message = parser.parse("[CS*1234567890*000A*0123456789]");

        assertThat(message.getDeclaredLength()).isEqualTo(10);
    }

    @Test
    void acceptsEmptyContentWithZeroLength() throws Exception {
        SeTrackerMessage message = parser.parse("[3G*8800000015*0000*]");

        assertThat(message.getContent()).isEmpty();
        assertThat(message.getToken()).isEmpty();
    }

    @Test
    void parsesWhatTheFormatterProduces() throws Exception {
        SeTrackerResponseFormatter formatter = new SeTrackerResponseFormatter();
        String content = "UD2,220414,134652,V,0,N,0,E,0,0,0,0,100,50,0,0,00000000,1,1,460,0,9346,13713,180";

        String frame = formatter.format("SG", "3000000001", String.format("%04d", content.length()), content);

        assertThat(parser.parse(frame))
                .isEqualTo(new SeTrackerMessage("SG", "3000000001", content.length(), content));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "[",
            "]",
            "3G*8800000015*0002*LK]",
            "[3G*8800000015*0002*LK",
            "[3G*8800000015*0002*LK]\r",
            "[]",
            "[3G*8800000015*LK]",
            "[3G*8800000015*0002*LK*X]",
            "[3G*8800000015*ZZZZ*LK]",
            "[3G*8800000015**LK]"
    })
    void rejectsMalformedFrames(String raw) {
        assertThatThrownBy(() -> parser.parse(raw)).isInstanceOf(FrameFormatException.class);
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(FrameFormatException.class);
    }

    @Test
    void rejectsLengthMismatch() {
        assertThatThrownBy(() -> parser.parse("[3G*8800000015*0003*LK]"))
                .isInstanceOfSatisfying(LengthMismatchException.class, e -> {
                    assertThat(e.getDeclaredLength()).isEqualTo(3);
                    assertThat(e.getActualLength()).isEqualTo(2);
                    assertThat(e.getValidationType()).isEqualTo("LENGTH");
                    assertThat(e.getPayloadFragment()).isEqualTo("[3G*8800000015*0003*LK]");
                });
    }

    @Test
    void truncatesPayloadFragmentOfLongFrames() {
        String content = "x".repeat(100);

        assertThatThrownBy(() -> parser.parse("[3G*8800000015*0001*" + content + "]"))
                .isInstanceOfSatisfying(LengthMismatchException.class,
                        e -> assertThat(e.getPayloadFragment()).hasSize(32));
    }
}
