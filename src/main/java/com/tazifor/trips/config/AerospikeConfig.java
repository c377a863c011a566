package com.tazifor.trips.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Host;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Aerospike Configuration for the trip store
 *
 * Only active with {@code trips.store=aerospike}; the default in-memory store
 * needs no cluster.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "trips.store", havingValue = "aerospike")
public class AerospikeConfig {

    @Value("${aerospike.hosts}")
    private String hosts;

    @Value("${aerospike.namespace}")
    private String namespace;

    @Value("${aerospike.timeout-ms:1000}")
    private int timeoutMs;

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy policy = new ClientPolicy();

        // bulk import issues many small writes from one thread
        policy.maxConnsPerNode = 100;
        policy.connPoolsPerNode = 1;
        policy.readPolicyDefault.totalTimeout = timeoutMs;
        policy.writePolicyDefault.totalTimeout = timeoutMs;

        AerospikeClient client = new AerospikeClient(policy, parseHosts(hosts));

        log.info("Connected to Aerospike hosts={} namespace={} nodes={}",
            hosts, namespace, client.getNodes().length);

        return client;
    }

    @Bean
    public String aerospikeNamespace() {
        return namespace;
    }

    /**
     * Insert-only writes: an existing trip id fails with KEY_EXISTS_ERROR
     * and the store skips it.
     */
    @Bean("tripWritePolicy")
    public WritePolicy tripWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = timeoutMs;
        policy.sendKey = true;
        policy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        return policy;
    }

    static Host[] parseHosts(String hosts) {
        List<Host> hostList = new ArrayList<>();
        for (String hostPart : hosts.split(",")) {
            if (hostPart.isBlank()) {
                continue;
            }
            String[] parts = hostPart.trim().split(":");
            String hostname = parts[0];
            int port = parts.length > 1 ? Integer.parseInt(parts[1]) : 3000;
            hostList.add(new Host(hostname, port));
        }
        if (hostList.isEmpty()) {
            throw new IllegalArgumentException("aerospike.hosts must name at least one host");
        }
        return hostList.toArray(new Host[0]);
    }
}
