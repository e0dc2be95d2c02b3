package com.tokenrelay.rpc;

import java.util.List;

public record LoadBalancerStats(List<EndpointHealth> endpoints, int healthyCount, int totalCount) {
}
