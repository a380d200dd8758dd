package io.tupla.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OptionParserTest {

    @Test
    void emptyOptionsGiveDefaults() {
        var parsed = OptionParser.parse(TableKind.SET, Map.of()).value();

        assertThat(parsed.layout()).isEqualTo(Layout.SET);
        assertThat(parsed.options().keyPos()).isEqualTo(1);
        assertThat(parsed.options().visibility()).isNull();
        assertThat(parsed.options().heir().isNone()).isTrue();
        assertThat(parsed.options().name()).isNull();
    }

    @Test
    void parsesEveryRecognisedOption() {
        var heir = Actor.spawn("heir");
        var options = new LinkedHashMap<String, Object>();
        options.put("name", "users");
        options.put("visibility", "public");
        options.put("heir", Heir.of(heir, "payload"));
        options.put("key_pos", 2);
        options.put("read_concurrency", true);
        options.put("write_concurrency", true);
        options.put("compressed", true);
        options.put("ordered", true);

        var parsed = OptionParser.parse(TableKind.SET, options).value();

        assertThat(parsed.layout()).isEqualTo(Layout.ORDERED_SET);
        var typed = parsed.options();
        assertThat(typed.name()).isEqualTo("users");
        assertThat(typed.visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(typed.heir().actor()).isSameAs(heir);
        assertThat(typed.heir().payload()).isEqualTo("payload");
        assertThat(typed.keyPos()).isEqualTo(2);
        assertThat(typed.readConcurrency()).isTrue();
        assertThat(typed.writeConcurrency()).isTrue();
        assertThat(typed.compressed()).isTrue();
    }

    @Test
    void bagKindUsesDuplicateOption() {
        assertThat(OptionParser.parse(TableKind.BAG, Map.of("duplicate", true)).value().layout())
                .isEqualTo(Layout.DUPLICATE_BAG);
        assertThat(OptionParser.parse(TableKind.BAG, Map.of()).value().layout()).isEqualTo(Layout.BAG);
    }

    @Test
    void rejectsKeyPosBelowOne() {
        var error = OptionParser.parse(TableKind.SET, Map.of("key_pos", 0)).error();

        assertThat(error).isEqualTo(TableError.invalidOption("key_pos", 0));
    }

    @Test
    void rejectsOptionOfAnotherKind() {
        assertThat(OptionParser.parse(TableKind.SET, Map.of("duplicate", true)).error())
                .isEqualTo(TableError.invalidOption("duplicate", true));
        assertThat(OptionParser.parse(TableKind.KEY_VALUE_SET, Map.of("key_pos", 1)).error())
                .isEqualTo(TableError.invalidOption("key_pos", 1));
    }

    @Test
    void rejectsUnknownKeysAndBadValues() {
        assertThat(OptionParser.parse(TableKind.SET, Map.of("colour", "red")).error().option()).isEqualTo("colour");
        assertThat(OptionParser.parse(TableKind.SET, Map.of("visibility", "secret")).error().option())
                .isEqualTo("visibility");
        assertThat(OptionParser.parse(TableKind.SET, Map.of("ordered", "yes")).error().option()).isEqualTo("ordered");
        assertThat(OptionParser.parse(TableKind.SET, Map.of("name", " ")).error().option()).isEqualTo("name");
        assertThat(OptionParser.parse(TableKind.SET, Map.of("heir", "someone")).error().option()).isEqualTo("heir");
    }

    @Test
    void reportsFirstIllegalEntryInIterationOrder() {
        var options = new LinkedHashMap<String, Object>();
        options.put("visibility", "private");
        options.put("key_pos", -1);
        options.put("colour", "red");

        assertThat(OptionParser.parse(TableKind.SET, options).error().option()).isEqualTo("key_pos");
    }

    @Test
    void rawKindHasNoLayoutOption() {
        var parsed = OptionParser.parse(TableKind.RAW, Map.of("key_pos", 3)).value();

        assertThat(parsed.layout()).isNull();
        assertThat(OptionParser.parse(TableKind.RAW, Map.of("ordered", true)).isErr()).isTrue();
    }

    @Test
    void heirNoneIsAccepted() {
        assertThat(OptionParser.parse(TableKind.SET, Map.of("heir", "none")).value().options().heir())
                .isEqualTo(Heir.NONE);
    }
}
