package org.iceforge.bifrost.gateway.mysql;

import org.iceforge.bifrost.error.MalformedRequestException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MySqlPacketIOTest {

    private static byte[] header(int len, int seq) {
        return new byte[] {(byte) len, (byte) (len >> 8), (byte) (len >> 16), (byte) seq};
    }

    private static MySqlPacketIO reader(byte[] wire) {
        return new MySqlPacketIO(new ByteArrayInputStream(wire), new ByteArrayOutputStream());
    }

    @Test
    void continuationPacketsAreJoined() throws IOException {
        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        wire.write(header(MySqlPacketIO.MAX_PAYLOAD, 0));
        wire.write(new byte[MySqlPacketIO.MAX_PAYLOAD]);
        wire.write(header(3, 1));
        wire.write(new byte[] {1, 2, 3});

        assertThat(reader(wire.toByteArray()).read()).hasSize(MySqlPacketIO.MAX_PAYLOAD + 3);
    }

    @Test
    void oversizedHeaderIsRejectedBeforeItsPayloadIsRead() {
        MySqlPacketIO io = reader(header(MySqlPacketIO.MAX_PAYLOAD, 0));
        io.limit(MySqlPacketIO.HANDSHAKE_REQUEST_BYTES);

        assertThatThrownBy(io::read).isInstanceOf(MalformedRequestException.class);
    }

    @Test
    void continuationsCountTowardTheLimit() throws IOException {
        ByteArrayOutputStream wire = new ByteArrayOutputStream();
        wire.write(header(MySqlPacketIO.MAX_PAYLOAD, 0));
        wire.write(new byte[MySqlPacketIO.MAX_PAYLOAD]);
        // a second full chunk pushes the request past the limit; its payload is never sent
        wire.write(header(MySqlPacketIO.MAX_PAYLOAD, 1));
        MySqlPacketIO io = reader(wire.toByteArray());
        io.limit(MySqlPacketIO.MAX_PAYLOAD + 100);

        assertThatThrownBy(io::read)
                .isInstanceOf(MalformedRequestException.class)
                .hasMessageContaining(String.valueOf(MySqlPacketIO.MAX_PAYLOAD + 100));
    }
}
