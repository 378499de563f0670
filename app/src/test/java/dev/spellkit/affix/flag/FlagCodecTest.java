package dev.spellkit.affix.flag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class FlagCodecTest {

    @Test
    void charModeYieldsOneFlagPerCodePoint() {
        List<FlagValue> flags = FlagCodec.parseFlags("AB😀", FlagMode.CHAR);

        assertThat(flags).containsExactly(FlagValue.ofChar('A'), FlagValue.ofChar('B'), FlagValue.ofChar(0x1F600));
    }

    @Test
    void longModePacksCharacterPairs() {
        List<FlagValue> flags = FlagCodec.parseFlags("AaBb", FlagMode.LONG);

        assertThat(flags).containsExactly(FlagValue.ofPair('A', 'a'), FlagValue.ofPair('B', 'b'));
        assertThat(flags.get(0).value()).isEqualTo(('A' << 16) | 'a');
    }

    @Test
    void longModeRejectsOddLength() {
        Throwable thrown = catchThrowable(() -> FlagCodec.parseFlags("AaB", FlagMode.LONG));

        assertThat(thrown).isInstanceOf(FlagFormatException.class).hasMessageContaining("even");
    }

    @Test
    void numModeSplitsOnCommas() {
        assertThat(FlagCodec.parseFlags("1,22, 333", FlagMode.NUM))
                .containsExactly(FlagValue.ofNumber(1), FlagValue.ofNumber(22), FlagValue.ofNumber(333));
    }

    @Test
    void numModeRejectsMalformedSegments() {
        assertThat(catchThrowable(() -> FlagCodec.parseFlags("1,,2", FlagMode.NUM))).isInstanceOf(FlagFormatException.class);
        assertThat(catchThrowable(() -> FlagCodec.parseFlags("1,x", FlagMode.NUM))).isInstanceOf(FlagFormatException.class);
        assertThat(catchThrowable(() -> FlagCodec.parseFlags("-4", FlagMode.NUM))).isInstanceOf(FlagFormatException.class);
    }

    @Test
    void uniModeReDecodesLatin1TextAsUtf8() {
        List<FlagValue> flags = FlagCodec.parseFlags("Ã©", FlagMode.UNI, StandardCharsets.ISO_8859_1);

        assertThat(flags).containsExactly(FlagValue.ofChar('é'));
    }

    @Test
    void uniModeIsCharModeForUtf8Files() {
        assertThat(FlagCodec.parseFlags("éx", FlagMode.UNI, StandardCharsets.UTF_8))
                .containsExactly(FlagValue.ofChar('é'), FlagValue.ofChar('x'));
    }

    @Test
    void uniModeRejectsBytesThatAreNotUtf8() {
        Throwable thrown = catchThrowable(() -> FlagCodec.parseFlags("é", FlagMode.UNI, StandardCharsets.ISO_8859_1));

        assertThat(thrown).isInstanceOf(FlagFormatException.class);
    }

    @Test
    void emptyTextHasNoFlags() {
        for (FlagMode mode : FlagMode.values()) {
            assertThat(FlagCodec.parseFlags("", mode)).isEmpty();
        }
    }

    @Test
    void singleFlagRequiresExactlyOne() {
        assertThat(FlagCodec.parseSingleFlag("Zz", FlagMode.LONG)).isEqualTo(FlagValue.ofPair('Z', 'z'));
        assertThat(catchThrowable(() -> FlagCodec.parseSingleFlag("AB", FlagMode.CHAR)))
                .isInstanceOf(FlagFormatException.class)
                .hasMessageContaining("exactly one");
        assertThat(catchThrowable(() -> FlagCodec.parseSingleFlag("", FlagMode.CHAR))).isInstanceOf(FlagFormatException.class);
    }

    @Test
    void encodeRestoresTheWrittenForm() {
        assertThat(FlagCodec.encode(FlagValue.ofPair('A', 'a'), FlagMode.LONG)).isEqualTo("Aa");
        assertThat(FlagCodec.encode(FlagValue.ofNumber(501), FlagMode.NUM)).isEqualTo("501");
        assertThat(FlagCodec.encodeAll(List.of(FlagValue.ofNumber(1), FlagValue.ofNumber(2)), FlagMode.NUM)).isEqualTo("1,2");
        assertThat(FlagCodec.encodeAll(List.of(FlagValue.ofChar('x'), FlagValue.ofChar('y')), FlagMode.CHAR)).isEqualTo("xy");
    }

    @Test
    void flagsFromDifferentModesWithSameValueAreEqual() {
        assertThat(FlagCodec.parseSingleFlag("65", FlagMode.NUM)).isEqualTo(FlagCodec.parseSingleFlag("A", FlagMode.CHAR));
    }

    @Test
    void orderingIsUnsigned() {
        FlagValue high = new FlagValue(0xFFFF0000);
        FlagValue low = FlagValue.ofChar('a');

        assertThat(high).isGreaterThan(low);
    }

    @Test
    void flagDirectiveNamesResolveIgnoringCase() {
        assertThat(FlagMode.fromDirective("long")).contains(FlagMode.LONG);
        assertThat(FlagMode.fromDirective("num")).contains(FlagMode.NUM);
        assertThat(FlagMode.fromDirective("UTF-8")).contains(FlagMode.UNI);
        assertThat(FlagMode.fromDirective("uni")).contains(FlagMode.UNI);
        assertThat(FlagMode.fromDirective("hex")).isEmpty();
    }
}
