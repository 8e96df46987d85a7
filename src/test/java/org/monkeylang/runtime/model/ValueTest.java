package org.monkeylang.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ValueTest {

    @Test
    @Tag("unit")
    void integerInspectsAsDecimal() {
        IntegerValue value = new IntegerValue(-42);

        assertThat(value.type()).isEqualTo(ValueType.INTEGER);
        assertThat(value.inspect()).isEqualTo("-42");
        assertThat(value).isEqualTo(new IntegerValue(-42));
    }

    @Test
    @Tag("unit")
    void booleanMapsToSingletons() {
        assertThat(BooleanValue.of(true)).isSameAs(BooleanValue.TRUE);
        assertThat(BooleanValue.of(false)).isSameAs(BooleanValue.FALSE);
        assertThat(BooleanValue.TRUE.value()).isTrue();
        assertThat(BooleanValue.FALSE.value()).isFalse();
    }

    @Test
    @Tag("unit")
    void booleanInspectsAsKeyword() {
        assertThat(BooleanValue.TRUE.inspect()).isEqualTo("true");
        assertThat(BooleanValue.FALSE.inspect()).isEqualTo("false");
        assertThat(BooleanValue.TRUE.type()).isEqualTo(ValueType.BOOLEAN);
    }
}
