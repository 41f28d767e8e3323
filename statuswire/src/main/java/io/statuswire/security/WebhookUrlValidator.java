package io.statuswire.security;

import io.statuswire.application.service.WebhookValidationException;
import io.statuswire.application.service.WebhookValidationException.Reason;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates webhook target URLs before they are stored.
 *
 * Rules:
 * - Absolute http or https URI with a host
 * - Production: https only, no localhost, no loopback, private, link-local, multicast,
 *   unspecified or carrier-grade NAT address literals
 * - Development: http and private hosts allowed
 *
 * Only literal addresses are checked. A public name that later resolves to a private address
 * (DNS rebinding) is not caught here.
 */
public final class WebhookUrlValidator {

    private static final Pattern IPV4_LITERAL = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");
    private static final int MAX_URL_LENGTH = 2048;

    private final boolean productionMode;

    public WebhookUrlValidator(boolean productionMode) {
        this.productionMode = productionMode;
    }

    /**
     * @return the parsed URI
     * @throws WebhookValidationException if the URL is not acceptable
     */
    public URI validate(String url) {
        if (url == null || url.isBlank() || url.length() > MAX_URL_LENGTH) {
            throw new WebhookValidationException(Reason.INVALID_URL, "Webhook URL is missing or too long");
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new WebhookValidationException(Reason.INVALID_URL, "Webhook URL is not a valid URI");
        }

        if (!uri.isAbsolute() || uri.getHost() == null || uri.getHost().isBlank()) {
            throw new WebhookValidationException(Reason.INVALID_URL, "Webhook URL must be absolute with a host");
        }

        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new WebhookValidationException(Reason.UNSUPPORTED_SCHEME,
                "Webhook URL scheme must be http or https");
        }

        if (!productionMode) {
            return uri;
        }

        if (!scheme.equals("https")) {
            throw new WebhookValidationException(Reason.HTTPS_REQUIRED, "Webhook URL must use https");
        }

        if (isBlockedHost(uri.getHost())) {
            throw new WebhookValidationException(Reason.PRIVATE_HOST,
                "Webhook URL must not target a local or private address");
        }

        return uri;
    }

    static boolean isBlockedHost(String rawHost) {
        String host = rawHost.toLowerCase(Locale.ROOT);
        if (host.endsWith(".")) {
            host = host.substring(0, host.length() - 1);
        }
        if (host.equals("localhost") || host.endsWith(".localhost")) {
            return true;
        }

        InetAddress address = parseLiteral(host);
        if (address == null) {
            return false;
        }

        if (address.isLoopbackAddress()
            || address.isSiteLocalAddress()
            || address.isLinkLocalAddress()
            || address.isMulticastAddress()
            || address.isAnyLocalAddress()) {
            return true;
        }

        byte[] b = address.getAddress();
        if (address instanceof Inet4Address) {
            // 100.64.0.0/10
            return (b[0] & 0xFF) == 100 && (b[1] & 0xC0) == 64;
        }
        if (address instanceof Inet6Address) {
            // fc00::/7 unique local
            return (b[0] & 0xFE) == 0xFC;
        }
        return false;
    }

    /**
     * Parses IPv4 dotted quads and bracketed IPv6 literals without touching DNS.
     */
    private static InetAddress parseLiteral(String host) {
        String literal;
        if (host.startsWith("[") && host.endsWith("]")) {
            literal = host.substring(1, host.length() - 1);
        } else if (IPV4_LITERAL.matcher(host).matches()) {
            literal = host;
        } else {
            return null;
        }
        try {
            return InetAddress.getByName(literal);
        } catch (UnknownHostException e) {
            // Out-of-range octets: not a usable address either way
            throw new WebhookValidationException(Reason.INVALID_URL, "Webhook URL host is not a valid address");
        }
    }
}
