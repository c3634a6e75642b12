package com.metapharm.phi.infrastructure.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Best-effort description of the client device, parsed from the User-Agent.
 * Any field may be null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceInfo {

    private String os;
    private String browser;

    @JsonProperty("app_version")
    private String appVersion;

    @JsonProperty("device_model")
    private String deviceModel;

    /** mobile, tablet or desktop */
    private String platform;
}
