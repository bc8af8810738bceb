package com.myorg.relay.kafka.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.relay.contracts.core.exception.BrokerDiscoveryException;
import com.myorg.relay.contracts.core.exception.DiscoveryParseException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the coordinator's connection document, e.g. {@code {"dns": ["b1:9092", "b2:9092"]}}.
 * Every shape problem becomes a {@link DiscoveryParseException}.
 */
@RequiredArgsConstructor
public class DiscoveryResponseParser {

    private final ObjectMapper mapper;
    private final String brokersField;

    public List<BrokerEndpoint> parse(String framework, String body) {
        if (body == null || body.isBlank()) {
            throw new DiscoveryParseException(framework, "Empty connection document");
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DiscoveryParseException(framework, "Connection document is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new DiscoveryParseException(framework, "Connection document is not a JSON object");
        }

        JsonNode list = root.get(brokersField);
        if (list == null || list.isNull()) {
            throw new DiscoveryParseException(framework, "Connection document has no '" + brokersField + "' field");
        }
        if (!list.isArray()) {
            throw new DiscoveryParseException(framework,
                    "'" + brokersField + "' must be a list of strings, got " + list.getNodeType());
        }

        List<BrokerEndpoint> brokers = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            JsonNode entry = list.get(i);
            if (!entry.isTextual()) {
                throw new DiscoveryParseException(framework,
                        "'" + brokersField + "'[" + i + "] must be a string, got " + entry.getNodeType());
            }
            try {
                brokers.add(BrokerEndpoint.parse(entry.asText()));
            } catch (IllegalArgumentException e) {
                throw new DiscoveryParseException(framework, "'" + brokersField + "'[" + i + "]: " + e.getMessage(), e);
            }
        }

        if (brokers.isEmpty()) {
            throw new BrokerDiscoveryException(framework, "Framework '" + framework + "' reported no brokers");
        }
        return brokers;
    }
}
