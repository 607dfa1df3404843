package com.grabber.core.net;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One normalized proxy: {@code scheme://[user:pass@]host:port}.
 */
public record ProxyEntry(String scheme, String host, int port, String username, String password) {

    private static final Pattern SCHEME = Pattern.compile("^(https?|socks4a?|socks5h?)://(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern USER_AT_HOST = Pattern.compile("^([^:@]+):([^@]+)@([^:@]+):(\\d{1,5})$");
    private static final Pattern HOST_PORT_USER_PASS = Pattern.compile("^([^:@]+):(\\d{1,5}):([^:@]+):(.+)$");
    private static final Pattern HOST_PORT = Pattern.compile("^([^:@]+):(\\d{1,5})$");

    /**
     * Parses {@code host:port}, {@code user:pass@host:port} or {@code host:port:user:pass},
     * each optionally prefixed with a scheme (default http).
     */
    public static Optional<ProxyEntry> parse(String line) {
        if (line == null) return Optional.empty();
        String s = line.trim();
        if (s.isEmpty() || s.startsWith("#")) return Optional.empty();

        String scheme = "http";
        Matcher sm = SCHEME.matcher(s);
        if (sm.matches()) {
            scheme = sm.group(1).toLowerCase(Locale.ROOT);
            s = sm.group(2);
        }
        if (s.endsWith("/")) s = s.substring(0, s.length() - 1);

        Matcher m = USER_AT_HOST.matcher(s);
        if (m.matches()) {
            return build(scheme, m.group(3), m.group(4), m.group(1), m.group(2));
        }
        m = HOST_PORT_USER_PASS.matcher(s);
        if (m.matches()) {
            return build(scheme, m.group(1), m.group(2), m.group(3), m.group(4));
        }
        m = HOST_PORT.matcher(s);
        if (m.matches()) {
            return build(scheme, m.group(1), m.group(2), null, null);
        }
        return Optional.empty();
    }

    private static Optional<ProxyEntry> build(String scheme, String host, String port, String user, String pass) {
        int p = Integer.parseInt(port);
        if (p < 1 || p > 65535) return Optional.empty();
        return Optional.of(new ProxyEntry(scheme, host.toLowerCase(Locale.ROOT), p, user, pass));
    }

    public boolean hasCredentials() {
        return username != null && password != null;
    }

    /**
     * Canonical URI including credentials, as handed to backends.
     */
    public String toUri() {
        String auth = hasCredentials() ? username + ":" + password + "@" : "";
        return scheme + "://" + auth + host + ":" + port;
    }

    // Never leak the password into logs
    @Override
    public String toString() {
        String auth = hasCredentials() ? username + ":***@" : "";
        return scheme + "://" + auth + host + ":" + port;
    }
}
