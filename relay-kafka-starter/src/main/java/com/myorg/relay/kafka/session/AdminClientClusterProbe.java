package com.myorg.relay.kafka.session;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.common.Node;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

//Connect check via describeCluster; the producer itself connects lazily.
@Slf4j
public class AdminClientClusterProbe implements ClusterProbe {

    @Override
    public void verify(Map<String, Object> adminConfig, Duration timeout) throws Exception {
        int ms = (int) Math.max(1, timeout.toMillis());

        Map<String, Object> cfg = new HashMap<>(adminConfig);
        cfg.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, ms);
        cfg.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, ms);

        try (AdminClient admin = AdminClient.create(cfg)) {
            Collection<Node> nodes = admin.describeCluster(new DescribeClusterOptions().timeoutMs(ms))
                    .nodes()
                    .get(ms, TimeUnit.MILLISECONDS);
            if (nodes.isEmpty()) {
                throw new IllegalStateException("Cluster reported no live brokers");
            }
            log.debug("Cluster reachable, nodes={}", nodes);
        }
    }
}
