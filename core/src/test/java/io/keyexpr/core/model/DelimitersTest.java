package io.keyexpr.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.keyexpr.core.error.InvalidDelimiterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("Delimiters")
class DelimitersTest {

    @Test
    @DisplayName("default pair is % and #")
    void defaults() {
        assertThat(Delimiters.DEFAULT.field()).isEqualTo('%');
        assertThat(Delimiters.DEFAULT.generator()).isEqualTo('#');
    }

    @Test
    @DisplayName("custom pair is accepted")
    void customPair() {
        assertThatCode(() -> new Delimiters('?', ';')).doesNotThrowAnyException();
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(
            delimiter = '|',
            value = {
                "field zero     | 0  | 35 | field delimiter can not be the empty string",
                "generator zero | 37 | 0  | generator delimiter can not be the empty string",
                "field period   | 46 | 35 | cannot use . as a field or generator delimiter",
                "gen period     | 37 | 46 | cannot use . as a field or generator delimiter",
                "field backtick | 96 | 35 | cannot use ` as a field or generator delimiter",
                "gen backtick   | 37 | 96 | cannot use ` as a field or generator delimiter",
                "equal          | 45 | 45 | field delimiter and generator delimiter can not be the same"
            })
    @DisplayName("invalid pairs are rejected")
    void invalidPairs(String name, int field, int generator, String message) {
        assertThatThrownBy(() -> new Delimiters((char) field, (char) generator))
                .isInstanceOf(InvalidDelimiterException.class)
                .hasMessage(message);
    }

    @Test
    @DisplayName("first failing rule wins")
    void firstRuleWins() {
        // both zero: the field rule is reported
        assertThatThrownBy(() -> Delimiters.validate((char) 0, (char) 0))
                .hasMessage("field delimiter can not be the empty string");
        // period and equal: the period rule is reported
        assertThatThrownBy(() -> Delimiters.validate('.', '.'))
                .hasMessage("cannot use . as a field or generator delimiter");
    }
}
