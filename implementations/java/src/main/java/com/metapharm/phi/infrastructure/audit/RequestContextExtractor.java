package com.metapharm.phi.infrastructure.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads client address, User-Agent and a coarse device description from an
 * incoming request. Never throws; anything it cannot determine is null.
 */
@Component
@Slf4j
public class RequestContextExtractor {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String REAL_IP = "X-Real-IP";
    static final String USER_AGENT = "User-Agent";

    private static final Pattern APP_VERSION = Pattern.compile("MetaPharmApp/(\\d+\\.\\d+\\.\\d+)");

    private static final Pattern ANDROID = Pattern.compile("android", Pattern.CASE_INSENSITIVE);
    private static final Pattern IOS = Pattern.compile("iphone|ipad|ipod|\\bios\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WINDOWS = Pattern.compile("windows", Pattern.CASE_INSENSITIVE);
    private static final Pattern MAC = Pattern.compile("macintosh|mac os x", Pattern.CASE_INSENSITIVE);
    private static final Pattern LINUX = Pattern.compile("linux", Pattern.CASE_INSENSITIVE);

    private static final Pattern EDGE = Pattern.compile("edg(e|a|ios)?/", Pattern.CASE_INSENSITIVE);
    private static final Pattern CHROME = Pattern.compile("chrome|crios", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIREFOX = Pattern.compile("firefox|fxios", Pattern.CASE_INSENSITIVE);
    private static final Pattern SAFARI = Pattern.compile("safari", Pattern.CASE_INSENSITIVE);

    private static final Pattern TABLET = Pattern.compile("tablet|ipad", Pattern.CASE_INSENSITIVE);
    private static final Pattern MOBILE = Pattern.compile("mobile|android|iphone|ipod", Pattern.CASE_INSENSITIVE);

    public RequestContext extract(HttpServletRequest request) {
        if (request == null) {
            return RequestContext.EMPTY;
        }
        try {
            String userAgent = emptyToNull(request.getHeader(USER_AGENT));
            return new RequestContext(clientAddress(request), userAgent, parseDeviceInfo(userAgent));
        } catch (RuntimeException e) {
            log.warn("Could not read request context: {}", e.getMessage());
            return RequestContext.EMPTY;
        }
    }

    /**
     * First {@code X-Forwarded-For} hop, then {@code X-Real-IP}, then the socket address.
     */
    String clientAddress(HttpServletRequest request) {
        String forwardedFor = request.getHeader(FORWARDED_FOR);
        if (forwardedFor != null) {
            String first = forwardedFor.split(",", 2)[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        String realIp = emptyToNull(request.getHeader(REAL_IP));
        if (realIp != null) {
            return realIp.trim();
        }
        return emptyToNull(request.getRemoteAddr());
    }

    /**
     * @return parsed device info, or null when there is no User-Agent
     */
    public DeviceInfo parseDeviceInfo(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return null;
        }

        String os = detectOs(userAgent);
        DeviceInfo.DeviceInfoBuilder info = DeviceInfo.builder()
            .os(os)
            .browser(detectBrowser(userAgent));

        if (TABLET.matcher(userAgent).find()) {
            info.platform("tablet");
        } else if (MOBILE.matcher(userAgent).find() || "iOS".equals(os)) {
            info.platform("mobile");
        } else {
            info.platform("desktop");
        }

        Matcher version = APP_VERSION.matcher(userAgent);
        if (version.find()) {
            info.appVersion(version.group(1));
        }
        return info.build();
    }

    // Android and iOS agents also mention Linux and Mac OS X, so they go first
    private static String detectOs(String userAgent) {
        if (ANDROID.matcher(userAgent).find()) {
            return "Android";
        }
        if (IOS.matcher(userAgent).find()) {
            return "iOS";
        }
        if (WINDOWS.matcher(userAgent).find()) {
            return "Windows";
        }
        if (MAC.matcher(userAgent).find()) {
            return "macOS";
        }
        if (LINUX.matcher(userAgent).find()) {
            return "Linux";
        }
        return null;
    }

    private static String detectBrowser(String userAgent) {
        if (EDGE.matcher(userAgent).find()) {
            return "Edge";
        }
        if (CHROME.matcher(userAgent).find()) {
            return "Chrome";
        }
        if (FIREFOX.matcher(userAgent).find()) {
            return "Firefox";
        }
        if (SAFARI.matcher(userAgent).find()) {
            return "Safari";
        }
        return null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
