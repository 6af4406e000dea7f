package uk.gegc.bannertracking.shared.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.util.ReflectionTestUtils;

import static org.assertj.core.api.Assertions.assertThat;

class TrustedProxyUtilTest {

    private TrustedProxyUtil trustedProxyUtil;

    @BeforeEach
    void setUp() {
        trustedProxyUtil = new TrustedProxyUtil();
        ReflectionTestUtils.setField(trustedProxyUtil, "trustedProxiesConfig", "127.0.0.1, 10.20.");
        ReflectionTestUtils.setField(trustedProxyUtil, "enableForwardedHeaders", true);
    }

    private static MockHttpServletRequest forwardedFrom(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(remoteAddr);
        request.addHeader("X-Forwarded-For", "203.0.113.7, " + remoteAddr);
        return request;
    }

    @Test
    @DisplayName("exact trusted address: forwarded client IP is used")
    void exactTrustedProxy_usesForwardedFor() {
        assertThat(trustedProxyUtil.getClientIp(forwardedFrom("127.0.0.1"))).isEqualTo("203.0.113.7");
    }

    @Test
    @DisplayName("address that merely starts with a trusted address is not trusted")
    void addressSharingLeadingDigits_notTrusted() {
        assertThat(trustedProxyUtil.getClientIp(forwardedFrom("127.0.0.10"))).isEqualTo("127.0.0.10");
        assertThat(trustedProxyUtil.getClientIp(forwardedFrom("127.0.0.19"))).isEqualTo("127.0.0.19");
    }

    @Test
    @DisplayName("entry ending in a dot trusts the whole prefix")
    void dottedPrefix_trusted() {
        assertThat(trustedProxyUtil.getClientIp(forwardedFrom("10.20.3.4"))).isEqualTo("203.0.113.7");
        assertThat(trustedProxyUtil.getClientIp(forwardedFrom("10.200.3.4"))).isEqualTo("10.200.3.4");
    }

    @Test
    @DisplayName("forwarded headers disabled: remote address is used")
    void forwardedHeadersDisabled_usesRemoteAddr() {
        ReflectionTestUtils.setField(trustedProxyUtil, "enableForwardedHeaders", false);

        assertThat(trustedProxyUtil.getClientIp(forwardedFrom("127.0.0.1"))).isEqualTo("127.0.0.1");
    }

    @Test
    void maskIpAddress_hidesLastOctet() {
        assertThat(TrustedProxyUtil.maskIpAddress("203.0.113.7")).isEqualTo("203.0.113.*");
        assertThat(TrustedProxyUtil.maskIpAddress(null)).isEqualTo("unknown");
    }
}
