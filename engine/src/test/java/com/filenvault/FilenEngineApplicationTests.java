package com.filenvault;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import com.filenvault.config.FilenProperties;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest
@ActiveProfiles("test")
class FilenEngineApplicationTests {

    @Autowired
    private FilenProperties properties;

    @Test
    void contextLoads() {
        assertEquals(16, properties.chunkSize());
        assertEquals("test-api-key", properties.apiKey());
    }
}
