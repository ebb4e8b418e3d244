package com.example.resourceapi.common.util;

import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.regex.Pattern;

/**
 * Utility for extracting client IP addresses from requests.
 * Handles X-Forwarded-For header with trusted proxy validation.
 */
public final class ClientIpExtractor {

    private static final String X_FORWARDED_FOR = "X-Forwarded-For";
    private static final String UNKNOWN = "unknown";
    private static final Pattern IP_ADDRESS_PATTERN = Pattern.compile(
            "^([0-9]{1,3}\\.){3}[0-9]{1,3}$|^([0-9a-fA-F]{0,4}:){2,7}[0-9a-fA-F]{0,4}$");

    private ClientIpExtractor() {}

    /**
     * Extracts client IP from the exchange. X-Forwarded-For is only trusted when the
     * direct connection comes from a private-network proxy.
     *
     * @param exchange the server web exchange
     * @return the client IP address, or "unknown" if not determinable
     */
    @NonNull
    public static String extract(@NonNull ServerWebExchange exchange) {
        return extract(exchange.getRequest());
    }

    /**
     * Request-level variant of {@link #extract(ServerWebExchange)}, used where only the request is at hand.
     *
     * @param request the server HTTP request
     * @return the client IP address, or "unknown" if not determinable
     */
    @NonNull
    public static String extract(@NonNull ServerHttpRequest request) {
        String directIp = directAddress(request);

        // Forwarded headers from an untrusted peer are attacker controlled
        if (isTrustedProxy(directIp)) {
            String forwardedFor = request.getHeaders().getFirst(X_FORWARDED_FOR);
            if (forwardedFor != null && !forwardedFor.isBlank()) {
                // Rightmost untrusted hop is the client as seen by our first proxy
                String[] ips = forwardedFor.split(",");
                for (int i = ips.length - 1; i >= 0; i--) {
                    String ip = ips[i].trim();
                    if (!isTrustedProxy(ip) && isValidIp(ip)) {
                        return ip;
                    }
                }
                // Every hop is a private proxy: the leftmost entry is the originating client
                String firstIp = ips[0].trim();
                if (isValidIp(firstIp)) {
                    return firstIp;
                }
            }
        }
        return directIp;
    }

    /**
     * Simple extraction without trusted proxy validation. Takes the first X-Forwarded-For entry
     * and falls back to the socket address. Suitable for request logs, never for audit stamps.
     *
     * @param exchange the server web exchange
     * @return the client IP address, or "unknown" if not determinable
     */
    @NonNull
    public static String extractSimple(@NonNull ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();
        String forwardedFor = request.getHeaders().getFirst(X_FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String firstIp = forwardedFor.split(",")[0].trim();
            if (isValidIp(firstIp)) {
                return firstIp;
            }
        }
        return directAddress(request);
    }

    /**
     * Checks the IPv4 dotted-quad or IPv6 colon-hex shape. Octet ranges are not validated.
     *
     * @param ip the IP string to validate
     * @return true if it looks like an IPv4 or IPv6 address
     */
    public static boolean isValidIp(@Nullable String ip) {
        if (ip == null || ip.isBlank()) {
            return false;
        }
        return IP_ADDRESS_PATTERN.matcher(ip).matches();
    }

    /**
     * Checks if an address belongs to a private network and may therefore be one of our own proxies.
     * Trusted: 10.0.0.0/8, 172.16.0.0/12, 192.168.0.0/16, localhost, IPv6 link-local and unique local.
     *
     * @param ip the IP address to check
     * @return true if the address is private
     */
    public static boolean isTrustedProxy(@Nullable String ip) {
        if (ip == null) {
            return false;
        }

        if (ip.startsWith("10.") || ip.startsWith("192.168.") ||
                ip.equals("127.0.0.1") || ip.equals("::1")) {
            return true;
        }

        // 172.16.x.x through 172.31.x.x
        if (ip.startsWith("172.")) {
            String[] octets = ip.split("\\.");
            if (octets.length >= 2) {
                try {
                    int secondOctet = Integer.parseInt(octets[1]);
                    return secondOctet >= 16 && secondOctet <= 31;
                } catch (NumberFormatException e) {
                    return false;
                }
            }
        }

        // fe80::/10 link-local, fc00::/7 unique local
        return ip.startsWith("fe80:") || ip.startsWith("fc") || ip.startsWith("fd");
    }

    /**
     * Socket peer address, or "unknown" when the server did not record one.
     */
    @NonNull
    private static String directAddress(@NonNull ServerHttpRequest request) {
        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress != null) {
            InetAddress address = remoteAddress.getAddress();
            if (address != null) {
                return address.getHostAddress();
            }
        }
        return UNKNOWN;
    }
}
