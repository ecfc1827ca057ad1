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
package org.pkisession.internal;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.MINUTES;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.pkisession.CertificateStore;
import org.pkisession.ConnectionInfo;
import org.pkisession.HttpResponse;
import org.pkisession.Logger;
import org.pkisession.Logging;
import org.pkisession.PkiInfo;
import org.pkisession.RequestOptions;
import org.pkisession.SecurityConfig;
import org.pkisession.SessionConfig;
import org.pkisession.SessionManager;
import org.pkisession.SslOverride;
import org.pkisession.SslStatus;
import org.pkisession.VerifyMode;
import org.pkisession.exceptions.ConfigurationException;
import org.pkisession.exceptions.RequestException;
import org.pkisession.exceptions.SessionException;
import org.pkisession.internal.http.IOExceptionTranslator;
import org.pkisession.internal.http.OkHttpRequests;
import org.pkisession.internal.http.TlsHandshakeListener;
import org.pkisession.internal.retry.ExponentialBackoffRetryLogic;
import org.pkisession.internal.security.SecurityConfigResolver;
import org.pkisession.internal.security.TlsMaterials;
import org.pkisession.internal.security.TlsMaterialsFactory;
import org.pkisession.internal.settings.ConfigStoreProvider;

public class InternalSessionManager implements SessionManager {
    private static final long KEEP_ALIVE_MINUTES = 5;

    private final CertificateStore certificateStore;
    private final SecurityConfigResolver resolver;
    private final TlsMaterialsFactory tlsMaterialsFactory;
    private final ExponentialBackoffRetryLogic.SleepTask sleepTask;
    private final SettingsSubscription subscription;
    private final RuntimeSslOverride sslOverride = new RuntimeSslOverride();
    private final Logging logging;
    private final Logger log;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final AtomicLong appliedReconfigurations = new AtomicLong();
    private final AtomicLong skippedReconfigurations = new AtomicLong();

    // guarded by lock for writes, read without it
    private volatile SessionState session;
    // the requested configuration behind the applied TLS materials, which may have degraded it
    private volatile SecurityConfig appliedSecurity;
    private volatile MaterialStamp appliedStamp;
    private volatile SecurityConfig pendingSecurity;
    private volatile List<String> lastWarnings = List.of();

    public InternalSessionManager(
            ConfigStoreProvider settings,
            CertificateStore certificateStore,
            SecurityConfigResolver resolver,
            TlsMaterialsFactory tlsMaterialsFactory,
            Logging logging) {
        this(settings, certificateStore, resolver, tlsMaterialsFactory, Thread::sleep, logging);
    }

    public InternalSessionManager(
            ConfigStoreProvider settings,
            CertificateStore certificateStore,
            SecurityConfigResolver resolver,
            TlsMaterialsFactory tlsMaterialsFactory,
            ExponentialBackoffRetryLogic.SleepTask sleepTask,
            Logging logging) {
        this.certificateStore = certificateStore;
        this.resolver = resolver;
        this.tlsMaterialsFactory = tlsMaterialsFactory;
        this.sleepTask = sleepTask;
        this.logging = logging;
        this.log = logging.getLog(getClass());
        this.subscription = new SettingsSubscription(settings, this::reconfigureOnChange, logging);
        subscription.bind();
    }

    @Override
    public void configure(SessionConfig config) {
        lock.lock();
        try {
            var previous = session;
            if (previous != null) {
                release(previous);
            }
            var baseClient = createClient(config);
            session = new SessionState(
                    config,
                    baseClient,
                    baseClient,
                    new ExponentialBackoffRetryLogic(
                            config.maxRetries(), config.backoffFactor(), logging, sleepTask),
                    null);
            headers.clear();
            headers.putAll(config.defaultHeaders());
            appliedSecurity = null;
            appliedStamp = null;
            log.info(
                    "Session configured: timeout=%ss, retries=%s, pool_size=%s",
                    config.timeout().toSeconds(),
                    config.maxRetries(),
                    config.poolMaxSize());

            // a fresh read replaces any cached configuration, the lock is reentrant
            pendingSecurity = null;
            reconfigureSecurity();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean reconfigureSecurity() {
        subscription.bind();
        lock.lock();
        try {
            var target = resolve();
            if (session == null) {
                if (!target.equals(pendingSecurity)) {
                    pendingSecurity = target;
                    log.debug(
                            "No session configured, keeping security configuration for configure(): %s",
                            target.describe());
                }
                return false;
            }
            var stamp = MaterialStamp.of(target);
            if (target.equals(appliedSecurity) && stamp.equals(appliedStamp)) {
                skipped();
                return false;
            }
            apply(target, stamp);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void reconfigureOnChange() {
        try {
            reconfigureSecurity();
        } catch (RuntimeException e) {
            log.error("Security reconfiguration after a settings change failed", e);
        }
    }

    private SecurityConfig resolve() {
        var settings = SecuritySettings.capture(certificateStore, subscription.storeOrNull());
        var resolution = resolver.resolve(settings, sslOverride.isActive());
        var warnings = new ArrayList<String>();
        for (SessionException warning : resolution.warnings()) {
            warnings.add(warning.getMessage());
        }
        lastWarnings = List.copyOf(warnings);
        return resolution.config();
    }

    private void skipped() {
        skippedReconfigurations.incrementAndGet();
        log.debug("Security config unchanged, skipping reconfiguration");
    }

    // requires lock and a session
    private void apply(SecurityConfig target, MaterialStamp stamp) {
        var state = session;
        var tls = tlsMaterialsFactory.create(target);
        var builder = state.baseClient().newBuilder().sslSocketFactory(tls.socketFactory(), tls.trustManager());
        if (tls.hostnameVerifier() != null) {
            builder.hostnameVerifier(tls.hostnameVerifier());
        }
        session = state.withTls(builder.build(), tls);
        appliedSecurity = target;
        appliedStamp = stamp;
        // connections negotiated under the previous configuration must not be reused
        state.baseClient().connectionPool().evictAll();
        appliedReconfigurations.incrementAndGet();
        log.info("Security reconfigured: %s", tls.effective().describe());
    }

    @Override
    public HttpResponse makeRequest(String method, String url, RequestOptions options) {
        SessionState state;
        Map<String, String> requestHeaders;
        lock.lock();
        try {
            state = session;
            requestHeaders = new TreeMap<>(headers);
        } finally {
            lock.unlock();
        }
        if (state == null) {
            throw new ConfigurationException("Session not configured. Call configure() first.");
        }

        var request = OkHttpRequests.build(method, url, requestHeaders, options);
        var client = clientFor(state, options);
        log.debug("Making %s request to %s", request.method(), url);
        try {
            var response = state.retryLogic()
                    .retry(request.method(), url, () -> OkHttpRequests.execute(client, request));
            log.debug("Request completed: %s %s -> %s", request.method(), url, response.statusCode());
            return response;
        } catch (IOException e) {
            var error = IOExceptionTranslator.translate(request.method(), url, e, state.clientCertificateActive());
            log.error(String.format("Request failed: %s %s", request.method(), url), error);
            throw error;
        } catch (RequestException e) {
            log.error(String.format("Request failed: %s %s", request.method(), url), e);
            throw e;
        }
    }

    private static OkHttpClient clientFor(SessionState state, RequestOptions options) {
        var timeout = options.timeout();
        if (timeout == null) {
            return state.client();
        }
        var millis = timeout.toMillis();
        return state.client()
                .newBuilder()
                .connectTimeout(millis, MILLISECONDS)
                .readTimeout(millis, MILLISECONDS)
                .writeTimeout(millis, MILLISECONDS)
                .build();
    }

    @Override
    public void updateHeaders(Map<String, String> newHeaders) {
        lock.lock();
        try {
            if (session == null) {
                log.warn("No session configured, ignoring header update");
                return;
            }
            headers.putAll(newHeaders);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeHeaders(Collection<String> headerNames) {
        lock.lock();
        try {
            if (session == null) {
                log.warn("No session configured, ignoring header removal");
                return;
            }
            headerNames.forEach(headers::remove);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SslOverride overrideSslVerification() {
        sslOverride.acquire();
        log.warn("SSL verification disabled at runtime, the setting is not persisted");
        reconfigureSecurity();
        var closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                sslOverride.release();
                reconfigureSecurity();
            }
        };
    }

    @Override
    public boolean bindSettings() {
        return subscription.bind();
    }

    @Override
    public PkiInfo getPkiInfo() {
        return PkiInfo.of(currentSecurity(), lastWarnings);
    }

    @Override
    public SslStatus sslStatus() {
        var settings = SecuritySettings.capture(certificateStore, subscription.storeOrNull());
        var verify = currentSecurity().verify();
        var customCa = verify instanceof VerifyMode.CustomCa applied ? applied.caChainPath() : null;
        return new SslStatus(
                verify.strategy() != VerifyMode.Strategy.DISABLED,
                settings.ignoreSslVerification(),
                sslOverride.isActive(),
                customCa != null,
                customCa,
                customCa != null && Files.isRegularFile(customCa),
                verify);
    }

    @Override
    public ConnectionInfo getConnectionInfo() {
        SessionState state;
        Map<String, String> headersSnapshot;
        lock.lock();
        try {
            state = session;
            headersSnapshot = Map.copyOf(headers);
        } finally {
            lock.unlock();
        }
        var config = state != null ? state.config() : SessionConfig.defaultConfig();
        var pool = state != null ? state.baseClient().connectionPool() : null;
        return new ConnectionInfo(
                state != null,
                config.timeout(),
                config.maxRetries(),
                config.backoffFactor(),
                config.poolConnections(),
                config.poolMaxSize(),
                headersSnapshot,
                getPkiInfo(),
                appliedReconfigurations.get(),
                skippedReconfigurations.get(),
                pool != null ? pool.idleConnectionCount() : 0,
                pool != null ? pool.connectionCount() : 0);
    }

    @Override
    public boolean isConfigured() {
        return session != null;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            var state = session;
            if (state == null) {
                return;
            }
            session = null;
            appliedSecurity = null;
            appliedStamp = null;
            headers.clear();
            release(state);
        } finally {
            lock.unlock();
        }
        subscription.unbind();
        log.info("SessionManager closed");
    }

    private SecurityConfig currentSecurity() {
        var state = session;
        if (state != null && state.tls() != null) {
            return state.tls().effective();
        }
        var pending = pendingSecurity;
        return pending != null ? pending : SecurityConfig.DEFAULT;
    }

    TlsMaterials appliedTls() {
        var state = session;
        return state != null ? state.tls() : null;
    }

    private static OkHttpClient createClient(SessionConfig config) {
        var dispatcher = new Dispatcher();
        dispatcher.setMaxRequestsPerHost(config.poolMaxSize());
        dispatcher.setMaxRequests(config.poolConnections() * config.poolMaxSize());
        var timeoutMillis = config.timeout().toMillis();
        return new OkHttpClient.Builder()
                .connectionPool(new ConnectionPool(config.poolMaxSize(), KEEP_ALIVE_MINUTES, MINUTES))
                .dispatcher(dispatcher)
                .eventListenerFactory(TlsHandshakeListener.FACTORY)
                .connectTimeout(timeoutMillis, MILLISECONDS)
                .readTimeout(timeoutMillis, MILLISECONDS)
                .writeTimeout(timeoutMillis, MILLISECONDS)
                // retries are handled by the retry logic
                .retryOnConnectionFailure(false)
                .build();
    }

    private static void release(SessionState state) {
        state.baseClient().connectionPool().evictAll();
        state.baseClient().dispatcher().executorService().shutdown();
    }
}
