package com.farm.anomaly.config;

import com.aerospike.client.AerospikeClient;
import org.mockito.Mockito;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Mock Aerospike client for @SpringBootTest contexts. The "test" profile turns the
 * real client off; namespace and policy beans still come from AerospikeConfig.
 */
@TestConfiguration
public class TestAerospikeConfig {

    @Bean
    public AerospikeClient aerospikeClient() {
        return Mockito.mock(AerospikeClient.class);
    }
}
