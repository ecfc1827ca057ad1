/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.pkisession.internal.http;

import java.io.IOException;
import java.io.InterruptedIOException;
import javax.net.ssl.SSLException;
import okhttp3.Call;
import okhttp3.EventListener;
import okhttp3.Response;

/**
 * Follows the TLS handshake of a single call.
 * <p>
 * A TLS 1.3 server checks the client certificate after the client has finished its side of the handshake. When it
 * rejects the identity the client usually sees the alert, but it may only notice a broken pipe or a reset while
 * writing the request. A connection dropped after a fresh handshake and before any response is therefore reported as
 * a rejected handshake.
 */
public final class TlsHandshakeListener extends EventListener {
    /**
     * Hands each call the listener attached to its request as a tag, if any.
     */
    public static final EventListener.Factory FACTORY = call -> {
        var listener = call.request().tag(TlsHandshakeListener.class);
        return listener != null ? listener : EventListener.NONE;
    };

    private volatile boolean handshakeStarted;
    private volatile boolean responseReceived;

    @Override
    public void secureConnectStart(Call call) {
        handshakeStarted = true;
    }

    @Override
    public void responseHeadersEnd(Call call, Response response) {
        responseReceived = true;
    }

    IOException classify(IOException error) {
        if (!handshakeStarted
                || responseReceived
                || error instanceof SSLException
                || error instanceof InterruptedIOException) {
            return error;
        }
        return new HandshakeRejectedException(error);
    }
}
