package com.metapharm.phi.infrastructure.audit;

import lombok.Value;

/**
 * Network and device context of the request that triggered an audited event.
 */
@Value
public class RequestContext {

    public static final RequestContext EMPTY = new RequestContext(null, null, null);

    String ipAddress;
    String userAgent;
    DeviceInfo deviceInfo;
}
