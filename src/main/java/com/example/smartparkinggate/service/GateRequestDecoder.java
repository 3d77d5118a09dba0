package com.example.smartparkinggate.service;

import com.example.smartparkinggate.exception.ImageDecodeException;
import com.example.smartparkinggate.model.GateRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedCaseInsensitiveMap;

import java.util.Base64;
import java.util.Map;

@Component
public class GateRequestDecoder {

    private static final Logger log = LoggerFactory.getLogger(GateRequestDecoder.class);

    public static final String ACTION_HEADER = "x-parking-action";
    public static final String ACTION_HEADER_CANONICAL = "X-Parking-Action";
    public static final String DEFAULT_ACTION = "ENTRY";

    /**
     * Looks up the action header in gateway supplied headers. Gateways forward
     * either the lower-case or the canonical spelling; any other casing is
     * accepted too. Returns {@code null} when the header is absent.
     */
    public String actionFromHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return null;
        }
        String action = headers.get(ACTION_HEADER);
        if (action == null) {
            action = headers.get(ACTION_HEADER_CANONICAL);
        }
        if (action == null) {
            Map<String, String> caseInsensitive = new LinkedCaseInsensitiveMap<>(headers.size());
            caseInsensitive.putAll(headers);
            action = caseInsensitive.get(ACTION_HEADER);
        }
        return action;
    }

    public String resolveAction(GateRequest request) {
        String action = request.action();
        return action != null ? action : DEFAULT_ACTION;
    }

    /**
     * Decodes the base64 body. The transport flag is only reported: gateways
     * that leave it unset still send base64 text.
     */
    public byte[] decodeImage(GateRequest request) {
        log.debug("Decoding capture (isBase64Encoded={})", request.base64Encoded());
        String body = request.body();
        if (body == null) {
            throw new ImageDecodeException("Request body is missing");
        }
        try {
            return Base64.getDecoder().decode(stripWhitespace(body));
        } catch (IllegalArgumentException ex) {
            throw new ImageDecodeException("Request body is not valid base64: " + ex.getMessage(), ex);
        }
    }

    private static String stripWhitespace(String body) {
        return body.replaceAll("\\s+", "");
    }
}
