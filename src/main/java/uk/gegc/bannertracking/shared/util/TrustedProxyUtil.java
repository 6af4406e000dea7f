package uk.gegc.bannertracking.shared.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class TrustedProxyUtil {

    @Value("${app.security.trusted-proxies:}")
    private String trustedProxiesConfig;

    @Value("${app.security.enable-forwarded-headers:false}")
    private boolean enableForwardedHeaders;

    private volatile List<String> trustedProxies;

    /**
     * Extracts the client IP address from the request, honouring
     * {@code X-Forwarded-For} / {@code X-Real-IP} only when they come from a trusted proxy.
     *
     * @param request The HTTP request
     * @return The client IP address
     */
    public String getClientIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!enableForwardedHeaders || remoteAddr == null || !isTrustedProxy(remoteAddr)) {
            return remoteAddr;
        }

        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            // Leftmost entry is the original client
            String clientIp = forwardedFor.split(",")[0].trim();
            if (isValidIpAddress(clientIp)) {
                return clientIp;
            }
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && isValidIpAddress(realIp.trim())) {
            return realIp.trim();
        }

        return remoteAddr;
    }

    /**
     * Masks an IP address for log lines: last IPv4 octet, or everything after the third IPv6 group.
     */
    public static String maskIpAddress(String ipAddress) {
        if (ipAddress == null || ipAddress.isEmpty()) {
            return "unknown";
        }

        if (ipAddress.contains(".")) {
            String[] parts = ipAddress.split("\\.");
            if (parts.length == 4) {
                return parts[0] + "." + parts[1] + "." + parts[2] + ".*";
            }
        }

        if (ipAddress.contains(":")) {
            String[] parts = ipAddress.split(":");
            if (parts.length >= 4) {
                return parts[0] + ":" + parts[1] + ":" + parts[2] + ":*";
            }
        }

        return "masked";
    }

    private boolean isTrustedProxy(String ip) {
        if (trustedProxies == null) {
            initializeTrustedProxies();
        }

        // Entries ending in '.' are IPv4 prefixes, e.g. "10.0."; everything else must match exactly
        return trustedProxies.contains(ip) ||
               trustedProxies.stream().anyMatch(proxy -> proxy.endsWith(".") && ip.startsWith(proxy));
    }

    private void initializeTrustedProxies() {
        if (trustedProxiesConfig == null || trustedProxiesConfig.trim().isEmpty()) {
            trustedProxies = List.of("127.0.0.1", "::1", "localhost");
        } else {
            trustedProxies = Arrays.stream(trustedProxiesConfig.split(","))
                    .map(String::trim)
                    .filter(proxy -> !proxy.isEmpty())
                    .toList();
        }
    }

    private boolean isValidIpAddress(String ip) {
        if (ip == null || ip.trim().isEmpty()) {
            return false;
        }

        String[] parts = ip.split("\\.");
        if (parts.length == 4) {
            try {
                for (String part : parts) {
                    int num = Integer.parseInt(part);
                    if (num < 0 || num > 255) {
                        return false;
                    }
                }
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }

        if (ip.contains(":")) {
            return ip.matches("^[0-9a-fA-F:]+$");
        }

        return false;
    }
}
