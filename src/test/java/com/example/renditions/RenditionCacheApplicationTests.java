package com.example.renditions;

import com.example.renditions.service.TranscodingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RenditionCacheApplicationTests {

    @TempDir
    static Path storageDir;

    @DynamicPropertySource
    static void storageProperties(DynamicPropertyRegistry registry) {
        registry.add("transcode.storage.cache.path", () -> storageDir.resolve("cache").toString());
        registry.add("transcode.storage.temp.path", () -> storageDir.resolve("temp").toString());
    }

    @Autowired
    private TranscodingService transcodingService;

    @Test
    @DisplayName("Context loads with the transcoding service wired")
    void contextLoads() {
        assertThat(transcodingService).isNotNull();
        assertThat(transcodingService.statistics().maxConcurrentTranscodes()).isEqualTo(2);
    }
}
