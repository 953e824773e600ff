package com.sparrowlogic.networktopology;

import com.sparrowlogic.networktopology.config.TopologyProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TopologyProperties.class)
public class NetworkTopologyApplication {

    public static void main(String[] args) {
        SpringApplication.run(NetworkTopologyApplication.class, args);
    }
}
