package com.pushit;

import com.pushit.config.AppProperties;
import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableRetry
@EnableConfigurationProperties(AppProperties.class)
public class PushItApplication {

    static {
        // .env values must be visible before property binding
        loadEnvironmentVariables();
    }

    public static void main(String[] args) {
        SpringApplication.run(PushItApplication.class, args);
    }

    private static void loadEnvironmentVariables() {
        Path currentPath = Paths.get(System.getProperty("user.dir"));
        Path envPath = currentPath.resolve(".env");

        // Running from the backend module, look one level up
        if (!Files.exists(envPath)
                && currentPath.getFileName() != null
                && currentPath.getFileName().toString().equals("backend")) {
            envPath = currentPath.getParent().resolve(".env");
        }

        if (!Files.exists(envPath)) {
            return;
        }

        Dotenv dotenv =
                Dotenv.configure()
                        .directory(envPath.getParent().toString())
                        .ignoreIfMissing()
                        .load();

        dotenv.entries()
                .forEach(
                        entry -> {
                            if (System.getProperty(entry.getKey()) == null) {
                                System.setProperty(entry.getKey(), entry.getValue());
                            }
                        });
    }
}
