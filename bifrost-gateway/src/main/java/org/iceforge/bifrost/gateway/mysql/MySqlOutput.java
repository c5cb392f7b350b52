package org.iceforge.bifrost.gateway.mysql;

/** Where one COM_QUERY response is written. */
final class MySqlOutput {
    final MySqlPacketIO io;

    MySqlOutput(MySqlPacketIO io) {
        this.io = io;
    }
}
