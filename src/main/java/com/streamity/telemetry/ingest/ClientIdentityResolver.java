package com.streamity.telemetry.ingest;

import com.streamity.telemetry.model.ClientIdentity;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Derives the caller identity of an inbound request from its peer address.
 * Behind a trusted reverse proxy the first {@code X-Forwarded-For} hop is used instead.
 */
@Component
public class ClientIdentityResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";

    private final boolean trustForwardedFor;

    public ClientIdentityResolver(@Value("${telemetry.trust-forwarded-for:false}") boolean trustForwardedFor) {
        this.trustForwardedFor = trustForwardedFor;
    }

    public ClientIdentity resolve(HttpServletRequest request) {
        if (trustForwardedFor) {
            String forwarded = request.getHeader(FORWARDED_FOR);
            if (forwarded != null && !forwarded.isBlank()) {
                int comma = forwarded.indexOf(',');
                return ClientIdentity.of(comma >= 0 ? forwarded.substring(0, comma) : forwarded);
            }
        }
        return ClientIdentity.of(request.getRemoteAddr());
    }
}
