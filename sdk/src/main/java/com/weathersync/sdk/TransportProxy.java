/*
 * Copyright © 2017 Google Inc.
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
package com.weathersync.sdk;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.io.BaseEncoding;
import com.weathersync.sdk.config.Configuration;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.Objects;
import java.util.Optional;

/**
 * Proxy settings of the HTTP transport used to reach the upstream API.
 *
 * <p>Optional configuration parameters:
 *
 * <ul>
 *   <li>{@value #CONFIG_TYPE} - {@code HTTP} or {@code SOCKS}. Default is {@code HTTP}.
 *   <li>{@value #CONFIG_HOSTNAME} - proxy host. Requests go direct when unset.
 *   <li>{@value #CONFIG_PORT} - proxy port, required with a host.
 *   <li>{@value #CONFIG_USERNAME}, {@value #CONFIG_PASSWORD} - credentials sent as a
 *       {@code Proxy-Authorization} basic header. Both must be set to take effect.
 * </ul>
 */
public final class TransportProxy {
  public static final String CONFIG_TYPE = "transport.proxy.type";
  public static final String CONFIG_HOSTNAME = "transport.proxy.hostname";
  public static final String CONFIG_PORT = "transport.proxy.port";
  public static final String CONFIG_USERNAME = "transport.proxy.username";
  public static final String CONFIG_PASSWORD = "transport.proxy.password";

  @VisibleForTesting static final String PROXY_AUTHORIZATION_HEADER = "Proxy-Authorization";

  /** Direct connections without proxy authentication. */
  public static final TransportProxy DIRECT = new Builder().build();

  private final Proxy proxy;
  private final Optional<String> authorization;

  private TransportProxy(Builder builder) {
    this.proxy = builder.proxy;
    this.authorization = Optional.ofNullable(builder.authorization);
  }

  /** Reads the proxy settings from configuration. */
  public static TransportProxy fromConfiguration() {
    checkState(Configuration.isInitialized(), "configuration must be initialized");
    Proxy.Type type =
        Configuration.getValue(CONFIG_TYPE, Proxy.Type.HTTP,
            Configuration.enumParser(Proxy.Type.class)).get();
    String hostname = Configuration.getString(CONFIG_HOSTNAME, "").get();
    int port = Configuration.getInteger(CONFIG_PORT, -1).get();
    String username = Configuration.getString(CONFIG_USERNAME, "").get();
    String password = Configuration.getString(CONFIG_PASSWORD, "").get();

    Builder builder = new Builder();
    if (!hostname.isEmpty()) {
      Configuration.checkConfiguration(port > 0 && port <= 0xFFFF,
          "%s %d is invalid for proxy %s", CONFIG_PORT, port, hostname);
      builder.setProxy(new Proxy(type, new InetSocketAddress(hostname, port)));
    }
    if (!username.isEmpty() && !password.isEmpty()) {
      builder.setCredentials(username, password);
    }
    return builder.build();
  }

  public Proxy getProxy() {
    return proxy;
  }

  public boolean isAuthenticated() {
    return authorization.isPresent();
  }

  /** Creates a transport whose connections go through the proxy. */
  public HttpTransport createHttpTransport() {
    return new NetHttpTransport.Builder().setProxy(proxy).build();
  }

  /** Gets an initializer adding the proxy authorization header, if credentials are set. */
  public HttpRequestInitializer getRequestInitializer() {
    if (!authorization.isPresent()) {
      return request -> {};
    }
    String header = authorization.get();
    return request -> request.getHeaders().set(PROXY_AUTHORIZATION_HEADER, header);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransportProxy)) {
      return false;
    }
    TransportProxy other = (TransportProxy) o;
    return proxy.equals(other.proxy) && authorization.equals(other.authorization);
  }

  @Override
  public int hashCode() {
    return Objects.hash(proxy, authorization);
  }

  /** Never prints the credentials. */
  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("proxy", proxy)
        .add("authenticated", isAuthenticated())
        .toString();
  }

  /** Builder for {@link TransportProxy}. */
  public static class Builder {
    private Proxy proxy = Proxy.NO_PROXY;
    private String authorization;

    public Builder setProxy(Proxy proxy) {
      this.proxy = checkNotNull(proxy, "proxy can not be null");
      return this;
    }

    public Builder setCredentials(String username, String password) {
      checkArgument(!Strings.isNullOrEmpty(username), "username can not be null or empty");
      checkNotNull(password, "password can not be null");
      String token = BaseEncoding.base64().encode((username + ":" + password).getBytes(UTF_8));
      this.authorization = "Basic " + token;
      return this;
    }

    public TransportProxy build() {
      return new TransportProxy(this);
    }
  }
}
