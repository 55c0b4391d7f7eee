package io.shuttle.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProtocolVersionTest {

    @Test
    void parsesSupportedVersionsAndAliases() {
        assertThat(ProtocolVersion.parse("1.0")).isEqualTo(ProtocolVersion.HTTP_1_0);
        assertThat(ProtocolVersion.parse("1")).isEqualTo(ProtocolVersion.HTTP_1_0);
        assertThat(ProtocolVersion.parse("1.1")).isEqualTo(ProtocolVersion.HTTP_1_1);
        assertThat(ProtocolVersion.parse(" 2 ")).isEqualTo(ProtocolVersion.HTTP_2);
        assertThat(ProtocolVersion.parse("2.0")).isEqualTo(ProtocolVersion.HTTP_2);
    }

    @Test
    void unknownVersionIsAConfigurationError() {
        assertThatThrownBy(() -> ProtocolVersion.parse("3"))
                .isInstanceOf(ShuttleException.UnknownProtocolVersion.class)
                .isInstanceOf(ShuttleException.InvalidConfiguration.class)
                .hasMessage("Unknown HTTP protocol version: 3");
    }

    @Test
    void mapsWireVersions() {
        assertThat(ProtocolVersion.of(1, 0)).isEqualTo(ProtocolVersion.HTTP_1_0);
        assertThat(ProtocolVersion.of(1, 1)).isEqualTo(ProtocolVersion.HTTP_1_1);
        assertThat(ProtocolVersion.of(2, 0)).isEqualTo(ProtocolVersion.HTTP_2);
        assertThat(ProtocolVersion.HTTP_2.toString()).isEqualTo("2");
    }
}
