package com.luanvv.parker.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.Data;
import lombok.extern.log4j.Log4j2;

@Log4j2
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Config {
    static final String DEFAULT_RESOURCE = "parker-config.yaml";

    private String baseUrl = "https://parker.candidatelabs.com";
    private String userAgent;
    private Login login = new Login();
    private RateLimit rateLimit = new RateLimit();
    private Retries retries = new Retries();
    private Output output = new Output();
    private Create create = new Create();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Login {
        private String path = CrmPaths.SIGN_IN;
        private String emailEnv = "PARKER_EMAIL";
        private String passwordEnv = "PARKER_PASSWORD";
        private String loggedInCheckSelector = "a[href*=sign_out], form[action*=sign_out]";
        private long timeoutMs = 30000;
    }

    @Data
    public static class RateLimit {
        private double permitsPerSecond = 2.0;
        private int burst = 4;
    }

    @Data
    public static class Retries {
        private int maxAttempts = 3;
        private long backoffMs = 500;
        private long maxBackoffMs = 4000;
    }

    @Data
    public static class Output {
        private String dir = "data";
        private boolean json = false;
        private boolean csv = false;

        public boolean isEnabled() {
            return json || csv;
        }
    }

    @Data
    public static class Create {
        // when true, a missing owner option for the configured email fails the creation
        private boolean requireOwner = false;
        private String commitLabel = "Create Candidate";
    }

    public static Config load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        }
    }

    public static Config load(String configPath) throws IOException {
        return load(Path.of(configPath));
    }

    public static Config load(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(in, Config.class);
    }

    public static Config loadDefault() throws IOException {
        String[] defaultPaths = {
            "parker-config.yaml",
            "parker-config.yml",
            "config/parker-config.yaml",
            "config/parker-config.yml"
        };

        for (String defaultPath : defaultPaths) {
            Path path = Path.of(defaultPath);
            if (Files.exists(path)) {
                log.info("Using config file: {}", path);
                return load(path);
            }
        }

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                log.info("Using bundled config: {}", DEFAULT_RESOURCE);
                return load(in);
            }
        }

        throw new IOException("No config file found in any of these locations: "
                            + String.join(", ", defaultPaths) + " or classpath:" + DEFAULT_RESOURCE);
    }

    /** Joins {@code path} onto the configured base URL. */
    public String urlFor(String path) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return path.startsWith("/") ? base + path : base + "/" + path;
    }
}
