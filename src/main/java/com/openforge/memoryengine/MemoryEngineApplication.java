package com.openforge.memoryengine;

import com.openforge.memoryengine.memory.MemoryEngineProperties;
import com.openforge.memoryengine.vector.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

// Register ConfigurationProperties globally so they are available
// regardless of whether the conditional Milvus beans are loaded.
@SpringBootApplication
@EnableConfigurationProperties({MemoryEngineProperties.class, MilvusProperties.class})
public class MemoryEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoryEngineApplication.class, args);
    }
}
