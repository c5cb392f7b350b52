package org.iceforge.bifrost.gateway.mongo;

import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.iceforge.bifrost.pipeline.ProxyPipeline;
import org.junit.jupiter.api.Test;

import java.net.Socket;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class MongoSessionCursorTest {

    private final MongoSession session = new MongoSession(new Socket(), mock(ProxyPipeline.class),
            mock(MongoBackend.class), new MongoAdapter(1024), Duration.ofMinutes(1));

    private static BsonDocument cursorReply(long id) {
        return new BsonDocument("cursor", new BsonDocument("id", new BsonInt64(id))
                .append("ns", new BsonString("app.events")))
                .append("ok", new BsonInt32(1));
    }

    private void open(String name, BsonDocument command, long cursorId) {
        session.trackCursor(command, name, cursorReply(cursorId), session.operation(command, name));
    }

    @Test
    void getMoreIsAuthorizedAsTheCommandThatOpenedTheCursor() {
        open("aggregate", new BsonDocument("aggregate", new BsonString("events")).append("pipeline", new BsonArray()), 42);

        assertThat(session.operation(new BsonDocument("getMore", new BsonInt64(42)), "getMore")).isEqualTo("AGGREGATE");
        assertThat(session.operation(new BsonDocument("getMore", new BsonInt64(7)), "getMore")).isEqualTo("FIND");
    }

    @Test
    void exhaustedCursorIsForgotten() {
        open("find", new BsonDocument("find", new BsonString("events")), 42);
        BsonDocument more = new BsonDocument("getMore", new BsonInt64(42));

        session.trackCursor(more, "getMore", cursorReply(42), "FIND");
        assertThat(session.openCursors()).isEqualTo(1);

        session.trackCursor(more, "getMore", cursorReply(0), "FIND");
        assertThat(session.openCursors()).isZero();
    }

    @Test
    void killedCursorsAreForgotten() {
        open("find", new BsonDocument("find", new BsonString("events")), 1);
        open("find", new BsonDocument("find", new BsonString("events")), 2);
        open("find", new BsonDocument("find", new BsonString("events")), 3);

        BsonDocument kill = new BsonDocument("killCursors", new BsonString("events"))
                .append("cursors", new BsonArray(List.of(new BsonInt64(1), new BsonInt64(3))));
        session.trackCursor(kill, "killCursors", new BsonDocument("ok", new BsonInt32(1)), "FIND");

        assertThat(session.openCursors()).isEqualTo(1);
    }

    @Test
    void aggregateWithOutputStageIsAWrite() {
        BsonDocument out = new BsonDocument("aggregate", new BsonString("events")).append("pipeline", new BsonArray(List.of(
                new BsonDocument("$match", new BsonDocument("kind", new BsonString("click"))),
                new BsonDocument("$out", new BsonString("clicks")))));
        BsonDocument merge = new BsonDocument("aggregate", new BsonString("events")).append("pipeline", new BsonArray(List.of(
                new BsonDocument("$merge", new BsonDocument("into", new BsonString("clicks"))))));
        BsonDocument plain = new BsonDocument("aggregate", new BsonString("events")).append("pipeline", new BsonArray(List.of(
                new BsonDocument("$match", new BsonDocument()))));

        assertThat(MongoAdapter.commandOperation("aggregate", out)).isEqualTo(MongoAdapter.AGGREGATE_WRITE);
        assertThat(MongoAdapter.commandOperation("aggregate", merge)).isEqualTo(MongoAdapter.AGGREGATE_WRITE);
        assertThat(MongoAdapter.commandOperation("aggregate", plain)).isEqualTo("AGGREGATE");
        assertThat(MongoAdapter.isReadOnlyCommand(MongoAdapter.AGGREGATE_WRITE)).isFalse();
    }
}
