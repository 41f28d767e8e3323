package io.statuswire.security;

import io.statuswire.application.service.WebhookValidationException;
import io.statuswire.application.service.WebhookValidationException.Reason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class WebhookUrlValidatorTest {

    private final WebhookUrlValidator production = new WebhookUrlValidator(true);
    private final WebhookUrlValidator development = new WebhookUrlValidator(false);

    @Test
    void acceptsPublicHttpsUrl() {
        assertEquals("example.com", production.validate("https://example.com/hook").getHost());
    }

    @Test
    @DisplayName("http://localhost is refused in production")
    void rejectsPlainHttpLocalhost() {
        WebhookValidationException e = assertThrows(WebhookValidationException.class,
            () -> production.validate("http://localhost/hook"));
        assertEquals(Reason.HTTPS_REQUIRED, e.reason());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "https://localhost/hook",
        "https://api.localhost/hook",
        "https://127.0.0.1/hook",
        "https://10.1.2.3/hook",
        "https://172.16.0.1/hook",
        "https://192.168.1.5/hook",
        "https://169.254.169.254/latest/meta-data",
        "https://100.64.0.1/hook",
        "https://0.0.0.0/hook",
        "https://224.0.0.1/hook",
        "https://[::1]/hook",
        "https://[fd00::1]/hook",
        "https://[fe80::1]/hook"
    })
    void rejectsLocalAndPrivateHosts(String url) {
        WebhookValidationException e = assertThrows(WebhookValidationException.class, () -> production.validate(url));
        assertEquals(Reason.PRIVATE_HOST, e.reason());
    }

    @Test
    void acceptsPublicAddressLiteralsOutsideBlockedRanges() {
        assertDoesNotThrow(() -> production.validate("https://100.128.0.1/hook"));
        assertDoesNotThrow(() -> production.validate("https://172.32.0.1/hook"));
        assertDoesNotThrow(() -> production.validate("https://93.184.216.34/hook"));
    }

    @Test
    void rejectsMalformedAndUnsupportedUrls() {
        assertEquals(Reason.INVALID_URL,
            assertThrows(WebhookValidationException.class, () -> production.validate("not a url")).reason());
        assertEquals(Reason.INVALID_URL,
            assertThrows(WebhookValidationException.class, () -> production.validate("/relative/path")).reason());
        assertEquals(Reason.INVALID_URL,
            assertThrows(WebhookValidationException.class, () -> production.validate(null)).reason());
        assertEquals(Reason.UNSUPPORTED_SCHEME,
            assertThrows(WebhookValidationException.class, () -> production.validate("ftp://example.com/x")).reason());
    }

    @Test
    void developmentModeAllowsHttpAndPrivateHosts() {
        assertDoesNotThrow(() -> development.validate("http://localhost:8080/hook"));
        assertDoesNotThrow(() -> development.validate("http://192.168.1.5/hook"));
        assertEquals(Reason.UNSUPPORTED_SCHEME,
            assertThrows(WebhookValidationException.class, () -> development.validate("ftp://example.com/hook")).reason());
    }
}
