package io.simmy.core.tool.impl;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;

/**
 * Rejects non-http(s) URLs and, unless allowed, hosts with any address in a loopback, wildcard,
 * private, link-local, carrier-grade NAT or IPv6 unique-local range.
 */
public final class UrlGuard {

    /** Name resolution seam; production code uses {@link InetAddress#getAllByName}. */
    @FunctionalInterface
    interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }

    private final boolean allowPrivateAddresses;
    private final HostResolver resolver;

    public UrlGuard(boolean allowPrivateAddresses) {
        this(allowPrivateAddresses, InetAddress::getAllByName);
    }

    UrlGuard(boolean allowPrivateAddresses, HostResolver resolver) {
        this.allowPrivateAddresses = allowPrivateAddresses;
        this.resolver = resolver;
    }

    public URI validate(String rawUrl) throws UnknownHostException {
        if (rawUrl == null || rawUrl.isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        return validate(URI.create(rawUrl.trim()));
    }

    public URI validate(URI uri) throws UnknownHostException {
        String scheme = uri.getScheme();
        if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
            throw new IllegalArgumentException("Only http/https URLs are allowed");
        }

        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("URL host is required");
        }
        if (allowPrivateAddresses) {
            return uri;
        }

        // every record counts: a name can mix public and internal addresses
        for (InetAddress address : resolver.resolve(host)) {
            if (isInternal(address)) {
                throw new IllegalArgumentException(
                    "Private or loopback addresses are blocked: " + host + " (" + address.getHostAddress() + ")");
            }
        }
        return uri;
    }

    static boolean isInternal(InetAddress address) {
        if (address.isLoopbackAddress() || address.isAnyLocalAddress() || address.isSiteLocalAddress()
            || address.isLinkLocalAddress() || address.isMulticastAddress()) {
            return true;
        }
        byte[] bytes = address.getAddress();
        if (address instanceof Inet4Address) {
            // 100.64.0.0/10
            return (bytes[0] & 0xFF) == 100 && (bytes[1] & 0xC0) == 64;
        }
        if (address instanceof Inet6Address) {
            // fc00::/7
            return (bytes[0] & 0xFE) == 0xFC;
        }
        return false;
    }
}
