package com.delinea.tss.server;

import com.delinea.tss.auth.Credentials;
import com.delinea.tss.auth.PasswordGrantFlow;
import com.delinea.tss.auth.Preconditions;
import com.delinea.tss.auth.SslContextBuilder;
import com.delinea.tss.auth.TssHttpClient;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import javax.net.ssl.SSLContext;

/**
 * Connection settings for a {@link SecretServer}.
 *
 * <p>Exactly one of {@code serverUrl} (on-premises or Platform) and {@code tenant} (Secret Server
 * Cloud) must be set. A tenant resolves to {@code https://{tenant}.secretservercloud.{tld}/}.
 *
 * <h2>Parameters</h2>
 * <p>{@link #fromParameters(Map)} resolves each value in order: parameter, environment variable,
 * default.
 * <table>
 *   <caption>Parameters</caption>
 *   <tr><th>Parameter</th><th>Environment</th><th>Default</th></tr>
 *   <tr><td>server-url</td><td>TSS_SERVER_URL</td><td></td></tr>
 *   <tr><td>tenant</td><td>TSS_TENANT</td><td></td></tr>
 *   <tr><td>tld</td><td>TSS_TLD</td><td>com</td></tr>
 *   <tr><td>api-path</td><td></td><td>api/v1</td></tr>
 *   <tr><td>token-path</td><td></td><td>oauth2/token</td></tr>
 *   <tr><td>username</td><td>TSS_USERNAME</td><td></td></tr>
 *   <tr><td>password</td><td>TSS_PASSWORD</td><td></td></tr>
 *   <tr><td>domain</td><td>TSS_DOMAIN</td><td></td></tr>
 *   <tr><td>token</td><td>TSS_TOKEN</td><td></td></tr>
 *   <tr><td>token-file</td><td>TSS_TOKEN_FILE</td><td></td></tr>
 *   <tr><td>ca-cert</td><td>TSS_CACERT</td><td></td></tr>
 *   <tr><td>client-cert</td><td>TSS_CLIENT_CERT</td><td></td></tr>
 *   <tr><td>client-key</td><td>TSS_CLIENT_KEY</td><td></td></tr>
 *   <tr><td>skip-verify</td><td>TSS_SKIP_VERIFY</td><td>false</td></tr>
 *   <tr><td>request-timeout-seconds</td><td></td><td>30</td></tr>
 * </table>
 *
 * <p>A static token (parameter, environment or file) takes precedence over a username and
 * password.
 */
public final class Configuration {

    static final String CLOUD_URL_TEMPLATE = "https://%s.secretservercloud.%s/";
    public static final String DEFAULT_TLD = "com";
    public static final String DEFAULT_API_PATH = "api/v1";
    public static final String DEFAULT_TOKEN_PATH = Preconditions.trimSlashes(PasswordGrantFlow.DEFAULT_TOKEN_PATH);

    static final String PARAM_SERVER_URL = "server-url";
    static final String PARAM_TENANT = "tenant";
    static final String PARAM_TLD = "tld";
    static final String PARAM_API_PATH = "api-path";
    static final String PARAM_TOKEN_PATH = "token-path";
    static final String PARAM_USERNAME = "username";
    static final String PARAM_PASSWORD = "password";
    static final String PARAM_DOMAIN = "domain";
    static final String PARAM_TOKEN = "token";
    static final String PARAM_TOKEN_FILE = "token-file";
    static final String PARAM_CA_CERT = "ca-cert";
    static final String PARAM_CLIENT_CERT = "client-cert";
    static final String PARAM_CLIENT_KEY = "client-key";
    static final String PARAM_SKIP_VERIFY = "skip-verify";
    static final String PARAM_REQUEST_TIMEOUT = "request-timeout-seconds";

    static final String ENV_SERVER_URL = "TSS_SERVER_URL";
    static final String ENV_TENANT = "TSS_TENANT";
    static final String ENV_TLD = "TSS_TLD";
    static final String ENV_USERNAME = "TSS_USERNAME";
    static final String ENV_PASSWORD = "TSS_PASSWORD";
    static final String ENV_DOMAIN = "TSS_DOMAIN";
    static final String ENV_TOKEN = "TSS_TOKEN";
    static final String ENV_TOKEN_FILE = "TSS_TOKEN_FILE";
    static final String ENV_CA_CERT = "TSS_CACERT";
    static final String ENV_CLIENT_CERT = "TSS_CLIENT_CERT";
    static final String ENV_CLIENT_KEY = "TSS_CLIENT_KEY";
    static final String ENV_SKIP_VERIFY = "TSS_SKIP_VERIFY";

    private final String serverUrl;
    private final String tenant;
    private final String tld;
    private final String apiPath;
    private final String tokenPath;
    private final Credentials credentials;
    private final String caCertPath;
    private final String clientCertPath;
    private final String clientKeyPath;
    private final boolean skipVerify;
    private final Duration requestTimeout;

    private Configuration(Builder builder) {
        this.serverUrl = Preconditions.isBlank(builder.serverUrl) ? null : builder.serverUrl.trim();
        this.tenant = Preconditions.isBlank(builder.tenant) ? null : builder.tenant.trim();
        this.tld = Preconditions.isBlank(builder.tld) ? DEFAULT_TLD : builder.tld.trim();
        this.apiPath = pathOrDefault(builder.apiPath, DEFAULT_API_PATH);
        this.tokenPath = pathOrDefault(builder.tokenPath, DEFAULT_TOKEN_PATH);
        this.credentials = builder.credentials;
        this.caCertPath = builder.caCertPath;
        this.clientCertPath = builder.clientCertPath;
        this.clientKeyPath = builder.clientKeyPath;
        this.skipVerify = builder.skipVerify;
        this.requestTimeout = builder.requestTimeout != null
                ? builder.requestTimeout : TssHttpClient.DEFAULT_REQUEST_TIMEOUT;
    }

    private static String pathOrDefault(String path, String defaultPath) {
        String trimmed = path == null ? "" : Preconditions.trimSlashes(path.trim());
        return trimmed.isEmpty() ? defaultPath : trimmed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Resolves a configuration from named parameters and the process environment.
     *
     * @throws IllegalArgumentException if a numeric or boolean parameter is malformed
     * @throws SecurityException        if a configured token file is missing or empty
     */
    public static Configuration fromParameters(Map<String, String> params) {
        return fromParameters(params, System::getenv);
    }

    static Configuration fromParameters(Map<String, String> params, Function<String, String> env) {
        Resolver resolver = new Resolver(params, env);

        Builder builder = builder()
                .serverUrl(resolver.get(PARAM_SERVER_URL, ENV_SERVER_URL, null))
                .tenant(resolver.get(PARAM_TENANT, ENV_TENANT, null))
                .tld(resolver.get(PARAM_TLD, ENV_TLD, DEFAULT_TLD))
                .apiPath(resolver.get(PARAM_API_PATH, null, DEFAULT_API_PATH))
                .tokenPath(resolver.get(PARAM_TOKEN_PATH, null, DEFAULT_TOKEN_PATH))
                .caCert(resolver.get(PARAM_CA_CERT, ENV_CA_CERT, null))
                .clientCert(resolver.get(PARAM_CLIENT_CERT, ENV_CLIENT_CERT, null),
                        resolver.get(PARAM_CLIENT_KEY, ENV_CLIENT_KEY, null))
                .skipVerify(Boolean.parseBoolean(resolver.get(PARAM_SKIP_VERIFY, ENV_SKIP_VERIFY, "false")));

        String timeout = resolver.get(PARAM_REQUEST_TIMEOUT, null, null);
        if (timeout != null) {
            try {
                builder.requestTimeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(PARAM_REQUEST_TIMEOUT + " must be a number of seconds, got '"
                        + timeout + "'", e);
            }
        }

        String token = resolver.get(PARAM_TOKEN, ENV_TOKEN, null);
        String tokenFile = resolver.get(PARAM_TOKEN_FILE, ENV_TOKEN_FILE, null);
        String username = resolver.get(PARAM_USERNAME, ENV_USERNAME, null);
        if (token != null) {
            builder.credentials(Credentials.token(token));
        } else if (tokenFile != null) {
            builder.credentials(Credentials.tokenFrom(null, tokenFile));
        } else if (username != null) {
            builder.credentials(Credentials.password(
                    resolver.get(PARAM_DOMAIN, ENV_DOMAIN, null),
                    username,
                    resolver.get(PARAM_PASSWORD, ENV_PASSWORD, null)));
        }

        return builder.build();
    }

    /**
     * Checks that the configuration identifies exactly one backend and carries credentials.
     *
     * @throws IllegalArgumentException if both or neither of server URL and tenant are set,
     *                                  or no credentials are configured
     */
    public void validate() {
        if (serverUrl != null && tenant != null) {
            throw new IllegalArgumentException("Either ServerURL or Tenant must be set, not both");
        }
        if (serverUrl == null && tenant == null) {
            throw new IllegalArgumentException("Either ServerURL or Tenant must be set");
        }
        if (credentials == null) {
            throw new IllegalArgumentException("Credentials are required: a token, a token file, "
                    + "or a username and password");
        }
    }

    /**
     * The configured base URL: the server URL, or the Secret Server Cloud URL of the tenant.
     */
    public String backendIdentity() {
        if (serverUrl != null) {
            return serverUrl;
        }
        return String.format(CLOUD_URL_TEMPLATE, tenant, tld);
    }

    /**
     * Builds the TLS context for the configured CA, client certificate and verification mode.
     *
     * @return the context, or null to use the JVM default
     */
    public SSLContext sslContext() throws GeneralSecurityException, IOException {
        SslContextBuilder builder = SslContextBuilder.create()
                .withCaCert(caCertPath)
                .withClientCert(clientCertPath, clientKeyPath)
                .withSkipVerify(skipVerify);
        return builder.isCustomized() ? builder.build() : null;
    }

    public String getServerUrl() {
        return serverUrl;
    }

    public String getTenant() {
        return tenant;
    }

    public String getTld() {
        return tld;
    }

    public String getApiPath() {
        return apiPath;
    }

    public String getTokenPath() {
        return tokenPath;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public boolean isSkipVerify() {
        return skipVerify;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    @Override
    public String toString() {
        return "Configuration{backend='" + (serverUrl != null || tenant != null ? backendIdentity() : "unset")
                + "', apiPath='" + apiPath + "', tokenPath='" + tokenPath + "', credentials=" + credentials
                + ", skipVerify=" + skipVerify + '}';
    }

    private static final class Resolver {
        private final Map<String, String> params;
        private final Function<String, String> env;

        Resolver(Map<String, String> params, Function<String, String> env) {
            this.params = params;
            this.env = env;
        }

        String get(String paramName, String envName, String defaultValue) {
            String value = params.get(paramName);
            if (!Preconditions.isBlank(value)) {
                return value;
            }
            if (envName != null) {
                value = env.apply(envName);
                if (!Preconditions.isBlank(value)) {
                    return value;
                }
            }
            return defaultValue;
        }
    }

    public static final class Builder {
        private String serverUrl;
        private String tenant;
        private String tld;
        private String apiPath;
        private String tokenPath;
        private Credentials credentials;
        private String caCertPath;
        private String clientCertPath;
        private String clientKeyPath;
        private boolean skipVerify;
        private Duration requestTimeout;

        private Builder() {
        }

        public Builder serverUrl(String serverUrl) {
            this.serverUrl = serverUrl;
            return this;
        }

        public Builder tenant(String tenant) {
            this.tenant = tenant;
            return this;
        }

        public Builder tld(String tld) {
            this.tld = tld;
            return this;
        }

        public Builder apiPath(String apiPath) {
            this.apiPath = apiPath;
            return this;
        }

        public Builder tokenPath(String tokenPath) {
            this.tokenPath = tokenPath;
            return this;
        }

        public Builder credentials(Credentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder caCert(String path) {
            this.caCertPath = path;
            return this;
        }

        public Builder clientCert(String certPath, String keyPath) {
            this.clientCertPath = certPath;
            this.clientKeyPath = keyPath;
            return this;
        }

        public Builder skipVerify(boolean skipVerify) {
            this.skipVerify = skipVerify;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Configuration build() {
            return new Configuration(this);
        }
    }
}
