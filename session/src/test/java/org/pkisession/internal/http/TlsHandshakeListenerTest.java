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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import javax.net.ssl.SSLException;
import okhttp3.Call;
import okhttp3.EventListener;
import okhttp3.Request;
import okhttp3.Response;
import org.junit.jupiter.api.Test;

class TlsHandshakeListenerTest {
    private final Call call = mock(Call.class);
    private final TlsHandshakeListener listener = new TlsHandshakeListener();

    @Test
    void dropAfterFreshHandshakeIsRejection() {
        var brokenPipe = new SocketException("Broken pipe");
        listener.secureConnectStart(call);

        var error = listener.classify(brokenPipe);

        assertThat(error, instanceOf(HandshakeRejectedException.class));
        assertSame(brokenPipe, error.getCause());
    }

    @Test
    void failuresWithoutHandshakeKeepTheirType() {
        var reset = new SocketException("Connection reset");

        assertSame(reset, listener.classify(reset));
    }

    @Test
    void failuresAfterResponseKeepTheirType() {
        var reset = new SocketException("Connection reset");
        listener.secureConnectStart(call);
        listener.responseHeadersEnd(call, mock(Response.class));

        assertSame(reset, listener.classify(reset));
    }

    @Test
    void timeoutsAndTlsErrorsKeepTheirType() {
        listener.secureConnectStart(call);
        var timeout = new SocketTimeoutException("Read timed out");
        IOException alert = new SSLException("Received fatal alert: certificate_required");

        assertSame(timeout, listener.classify(timeout));
        assertSame(alert, listener.classify(alert));
    }

    @Test
    void factoryReturnsListenerTaggedOnRequest() {
        var tagged = new Request.Builder()
                .url("https://api.example.com")
                .tag(TlsHandshakeListener.class, listener)
                .build();
        var untagged = new Request.Builder().url("https://api.example.com").build();
        var taggedCall = mock(Call.class);
        var untaggedCall = mock(Call.class);
        when(taggedCall.request()).thenReturn(tagged);
        when(untaggedCall.request()).thenReturn(untagged);

        assertSame(listener, TlsHandshakeListener.FACTORY.create(taggedCall));
        assertSame(EventListener.NONE, TlsHandshakeListener.FACTORY.create(untaggedCall));
    }
}
