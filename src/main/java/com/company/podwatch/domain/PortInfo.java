package com.company.podwatch.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Container port, and how it is reachable from outside the pod (if at all)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PortInfo implements Serializable {
    private static final long serialVersionUID = 1L;

    private Integer port;
    private String protocol;
    private String name;

    private boolean exposed;
    private String serviceName;
    private Integer servicePort;
    private boolean loadBalancer;
    private String externalIp;
    private String accessUrl;
}
