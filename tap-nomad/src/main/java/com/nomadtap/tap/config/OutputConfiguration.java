package com.nomadtap.tap.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nomadtap.tap.output.MessageWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Routes protocol messages to stdout, or to a file when {@code tap-nomad.output.path} is set.
 */
@Configuration
@Slf4j
public class OutputConfiguration {

    @Bean(destroyMethod = "close")
    public MessageWriter messageWriter(ObjectMapper objectMapper, TapNomadProperties properties) throws IOException {
        String path = properties.getOutput().getPath();
        if (path == null || path.isBlank()) {
            PrintStream stdout = new PrintStream(new FileOutputStream(FileDescriptor.out), false, StandardCharsets.UTF_8);
            return new MessageWriter(objectMapper, stdout, false);
        }

        Path outputPath = Paths.get(path);
        if (outputPath.getParent() != null) {
            Files.createDirectories(outputPath.getParent());
        }
        log.info("Writing messages to {}", outputPath);
        PrintStream file = new PrintStream(Files.newOutputStream(outputPath), false, StandardCharsets.UTF_8);
        return new MessageWriter(objectMapper, file, true);
    }
}
