package com.myorg.relay.kafka.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.relay.contracts.core.exception.BrokerDiscoveryException;
import com.myorg.relay.contracts.core.exception.DiscoveryParseException;
import com.myorg.relay.contracts.core.exception.RelayConfigException;
import com.myorg.relay.contracts.core.message.BrokerEndpoint;
import com.myorg.relay.kafka.RelayKafkaConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DefaultBrokerResolverTest {

    private static final String COORDINATOR_URL = "http://kafka.mesos:31000/v1/connection";

    private final SrvLookup srvLookup = mock(SrvLookup.class);
    private MockRestServiceServer server;
    private DefaultBrokerResolver resolver;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        resolver = new DefaultBrokerResolver(srvLookup, restTemplate,
                new DiscoveryResponseParser(new ObjectMapper(), "dns"));
    }

    @Test
    void explicitList_shouldComeBackInOrderWithoutAnyLookup() {
        List<BrokerEndpoint> brokers = resolver.resolve(RelayKafkaConfig.explicit("b3:9094, b1:9092,,b2:9093"));

        assertThat(brokers).extracting(BrokerEndpoint::toString)
                .containsExactly("b3:9094", "b1:9092", "b2:9093");
        verifyNoInteractions(srvLookup);
        server.verify();
    }

    @Test
    void explicitList_empty_shouldFailWithConfigError() {
        assertThatThrownBy(() -> resolver.resolve(RelayKafkaConfig.explicit(" , ")))
                .isInstanceOf(RelayConfigException.class);
        verifyNoInteractions(srvLookup);
    }

    @Test
    void framework_shouldFetchBrokersFromCoordinator() {
        givenCoordinator();
        server.expect(requestTo(COORDINATOR_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"dns\":[\"b1:9092\",\"b2:9092\"]}", MediaType.APPLICATION_JSON));

        List<BrokerEndpoint> brokers = resolver.resolve(RelayKafkaConfig.framework("kafka"));

        assertThat(brokers).extracting(BrokerEndpoint::toString).containsExactly("b1:9092", "b2:9092");
        server.verify();
    }

    @Test
    void framework_shouldResolveAgainOnEveryCall() {
        givenCoordinator();
        server.expect(requestTo(COORDINATOR_URL))
                .andRespond(withSuccess("{\"dns\":[\"b1:9092\"]}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(COORDINATOR_URL))
                .andRespond(withSuccess("{\"dns\":[\"b9:9092\"]}", MediaType.APPLICATION_JSON));

        RelayKafkaConfig config = RelayKafkaConfig.framework("kafka");

        assertThat(resolver.resolve(config)).extracting(BrokerEndpoint::host).containsExactly("b1");
        assertThat(resolver.resolve(config)).extracting(BrokerEndpoint::host).containsExactly("b9");
        verify(srvLookup, times(2)).lookup("kafka", "marathon.mesos");
        server.verify();
    }

    @Test
    void framework_missingField_shouldFailWithParseError() {
        givenCoordinator();
        server.expect(requestTo(COORDINATOR_URL))
                .andRespond(withSuccess("{\"brokers\":[\"b1:9092\"]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> resolver.resolve(RelayKafkaConfig.framework("kafka")))
                .isInstanceOf(DiscoveryParseException.class)
                .satisfies(e -> assertThat(((DiscoveryParseException) e).getFramework()).isEqualTo("kafka"));
    }

    @Test
    void framework_nonStringEntry_shouldFailWithParseError() {
        givenCoordinator();
        server.expect(requestTo(COORDINATOR_URL))
                .andRespond(withSuccess("{\"dns\":[\"b1:9092\", 42]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> resolver.resolve(RelayKafkaConfig.framework("kafka")))
                .isInstanceOf(DiscoveryParseException.class)
                .hasMessageContaining("dns");
    }

    @Test
    void framework_notRegistered_shouldFailWithDiscoveryError() {
        when(srvLookup.lookup("kafka", "marathon.mesos")).thenReturn(List.of());

        assertThatThrownBy(() -> resolver.resolve(RelayKafkaConfig.framework("kafka")))
                .isExactlyInstanceOf(BrokerDiscoveryException.class)
                .hasMessageContaining("not found");
        server.verify();
    }

    @Test
    void framework_coordinatorError_shouldFailWithDiscoveryError() {
        givenCoordinator();
        server.expect(requestTo(COORDINATOR_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> resolver.resolve(RelayKafkaConfig.framework("kafka")))
                .isExactlyInstanceOf(BrokerDiscoveryException.class);
    }

    @Test
    void connectionEndpoint_shouldExpandHostFromPreferredRecord() {
        when(srvLookup.lookup("kafka", "marathon.mesos")).thenReturn(List.of(
                new SrvRecord(0, 10, 31000, "kafka-1.marathon.mesos."),
                new SrvRecord(0, 5, 31001, "kafka-2.marathon.mesos.")
        ));
        RelayKafkaConfig config = RelayKafkaConfig.framework("kafka").toBuilder()
                .connectionUrlTemplate("http://{host}:{port}/v1/connection")
                .build();

        assertThat(resolver.connectionEndpoint(config))
                .hasToString("http://kafka-1.marathon.mesos:31000/v1/connection");
    }

    private void givenCoordinator() {
        when(srvLookup.lookup("kafka", "marathon.mesos"))
                .thenReturn(List.of(new SrvRecord(0, 1, 31000, "kafka-abc.marathon.mesos.")));
    }
}
