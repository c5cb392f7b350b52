package org.iceforge.bifrost.gateway.pgwire;

import java.io.DataOutputStream;

/** Where one statement's response goes, and which descriptions precede it. */
final class PgOutput {

    /**
     * SIMPLE: RowDescription before rows. PORTAL: a described portal, so RowDescription before
     * rows and NoData when there are none. NONE: rows only.
     */
    enum Describe {
        SIMPLE, PORTAL, NONE;

        boolean rows() {
            return this != NONE;
        }

        boolean noData() {
            return this == PORTAL;
        }
    }

    final DataOutputStream stream;
    final String verb;
    final Describe describe;
    boolean errorSent;

    PgOutput(DataOutputStream stream, String verb, Describe describe) {
        this.stream = stream;
        this.verb = verb;
        this.describe = describe;
    }
}
